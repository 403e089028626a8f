package com.trendrank.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.ToLongFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trendrank.model.SelectAlgorithm;

/**
 * Top-K selection algorithms.
 * <p>
 * Every {@code select*} method returns {@code min(k, n)} elements which are the k best ranked
 * under the comparator, in no particular order. Methods that take a mutable list may reorder it;
 * callers needing the original order must copy first. {@code k <= 0} yields an empty list, while an
 * empty input with a positive {@code k} is an {@link IndexOutOfBoundsException}.
 */
public final class TopKSelector {
    private static final Logger logger = LoggerFactory.getLogger(TopKSelector.class);

    private TopKSelector() {
    }

    /**
     * Dispatches to the chosen algorithm.
     *
     * @param integralKey extracts the integral value binary-partition select works on; when
     *                    {@code null} that algorithm is substituted by quickselect
     */
    public static <T> List<T> select(List<T> data, int k, SelectAlgorithm algorithm, Comparator<? super T> cmp,
            ToLongFunction<? super T> integralKey) {
        switch (algorithm) {
            case SEQUENTIAL:
                return sequentialSelect(data, k, cmp);
            case QUICK_SELECT:
                return quickSelectTopK(data, k, cmp);
            case BINARY_PARTITION:
                if (integralKey == null) {
                    logger.debug("Binary select needs integral keys, falling back to quick select");
                    return quickSelectTopK(data, k, cmp);
                }
                return binarySelect(data, k, integralKey, cmp);
            case NTH_ELEMENT:
            default:
                return nthElementSelect(data, k, cmp);
        }
    }

    public static <T> List<T> select(List<T> data, int k, SelectAlgorithm algorithm, Comparator<? super T> cmp) {
        return select(data, k, algorithm, cmp, null);
    }

    /**
     * The k-th best element (1-based) found with the chosen algorithm.
     *
     * @throws IndexOutOfBoundsException on empty input or when k is outside [1, n]
     */
    public static <T> T cutline(List<T> data, int k, SelectAlgorithm algorithm, Comparator<? super T> cmp) {
        checkRank(data, k - 1);
        if (algorithm == SelectAlgorithm.QUICK_SELECT || algorithm == SelectAlgorithm.BINARY_PARTITION) {
            return quickSelect(data, k - 1, cmp);
        }
        List<T> top = select(data, k, algorithm, cmp);
        return Collections.max(top, cmp);
    }

    /**
     * Scans the input once keeping the k best in a heap whose head is the worst kept element.
     * O(n log k); does not modify the input. The result comes out best first.
     */
    public static <T> List<T> sequentialSelect(List<? extends T> data, int k, Comparator<? super T> cmp) {
        if (k <= 0) {
            return new ArrayList<>();
        }
        checkNotEmpty(data);
        int limit = Math.min(k, data.size());

        PriorityQueue<T> heap = new PriorityQueue<>(limit, Collections.reverseOrder(cmp));
        for (T item : data) {
            if (heap.size() < limit) {
                heap.add(item);
            } else if (cmp.compare(item, heap.peek()) < 0) {
                heap.poll();
                heap.add(item);
            }
        }

        List<T> result = new ArrayList<>(limit);
        while (!heap.isEmpty()) {
            result.add(heap.poll());
        }
        Collections.reverse(result);
        return result;
    }

    /**
     * Places the element of the given 0-based rank at its final position and returns it.
     * Elements before it rank no worse, elements after it no better.
     *
     * @throws IndexOutOfBoundsException on empty input or out-of-range rank
     */
    public static <T> T quickSelect(List<T> data, int rank, Comparator<? super T> cmp) {
        checkRank(data, rank);
        int left = 0;
        int right = data.size() - 1;
        while (left < right) {
            int pivotIdx = Sorts.partition(data, left, right, cmp);
            if (rank < pivotIdx) {
                right = pivotIdx - 1;
            } else {
                left = pivotIdx;
            }
        }
        return data.get(rank);
    }

    public static <T> List<T> quickSelectTopK(List<T> data, int k, Comparator<? super T> cmp) {
        if (k <= 0) {
            return new ArrayList<>();
        }
        checkNotEmpty(data);
        int limit = Math.min(k, data.size());
        if (limit < data.size()) {
            quickSelect(data, limit - 1, cmp);
        }
        return new ArrayList<>(data.subList(0, limit));
    }

    /**
     * Bisects the integral value range until the cutline value is isolated: everything strictly
     * above it is selected outright, and the remaining slots are filled with the best ranked
     * elements sitting exactly on the cutline. O(n log range); does not modify the input.
     */
    public static <T> List<T> binarySelect(List<? extends T> data, int k, ToLongFunction<? super T> value,
            Comparator<? super T> cmp) {
        if (k <= 0) {
            return new ArrayList<>();
        }
        checkNotEmpty(data);
        int limit = Math.min(k, data.size());

        long lo = Long.MAX_VALUE;
        long hi = Long.MIN_VALUE;
        for (T item : data) {
            long v = value.applyAsLong(item);
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }

        List<T> result = new ArrayList<>(limit);
        List<T> cur = new ArrayList<>(data);
        List<T> big = new ArrayList<>();
        List<T> small = new ArrayList<>();
        int remain = limit;

        while (lo < hi) {
            long span = hi - lo;
            long mid = lo + (span >>> 1) + (span & 1);
            big.clear();
            small.clear();
            for (T item : cur) {
                if (value.applyAsLong(item) >= mid) {
                    big.add(item);
                } else {
                    small.add(item);
                }
            }
            if (big.size() >= remain) {
                lo = mid;
                List<T> t = cur;
                cur = big;
                big = t;
            } else {
                result.addAll(big);
                remain -= big.size();
                hi = mid - 1;
                List<T> t = cur;
                cur = small;
                small = t;
            }
        }

        // cur now only holds elements whose value equals lo
        if (remain > 0) {
            if (cur.size() > remain) {
                result.addAll(sequentialSelect(cur, remain, cmp));
            } else {
                result.addAll(cur);
            }
        }
        return result;
    }

    /**
     * Primitive variant over raw values: the k largest values, descending.
     */
    public static long[] binarySelect(long[] values, int k) {
        if (k <= 0) {
            return new long[0];
        }
        if (values.length == 0) {
            throw new IndexOutOfBoundsException("Cannot select from an empty collection");
        }
        List<Long> boxed = new ArrayList<>(values.length);
        for (long v : values) {
            boxed.add(v);
        }
        Comparator<Long> descending = Comparator.reverseOrder();
        List<Long> top = binarySelect(boxed, k, Long::longValue, descending);
        top.sort(descending);
        long[] out = new long[top.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = top.get(i);
        }
        return out;
    }

    /**
     * Partial ordering primitive: after the call the element at index {@code k - 1} is the one a full
     * sort would put there, everything before it ranks no worse and everything after no better.
     * Three-way partitioning with a median-of-three pivot; falls back to a heap select when the
     * recursion budget of 2 log n is exhausted.
     */
    public static <T> List<T> nthElementSelect(List<T> data, int k, Comparator<? super T> cmp) {
        if (k <= 0) {
            return new ArrayList<>();
        }
        checkNotEmpty(data);
        int limit = Math.min(k, data.size());
        if (limit < data.size()) {
            nthElement(data, limit - 1, cmp);
        }
        return new ArrayList<>(data.subList(0, limit));
    }

    public static <T> void nthElement(List<T> data, int nth, Comparator<? super T> cmp) {
        checkRank(data, nth);
        int left = 0;
        int right = data.size() - 1;
        int budget = 2 * (32 - Integer.numberOfLeadingZeros(data.size()));

        while (right > left) {
            if (budget-- == 0) {
                heapSelect(data, left, right, nth, cmp);
                return;
            }
            T pivot = Sorts.medianOfThree(data, left, right, cmp);
            // [left, lt) better than pivot, [lt, i) equal, (gt, right] worse
            int lt = left;
            int gt = right;
            int i = left;
            while (i <= gt) {
                int c = cmp.compare(data.get(i), pivot);
                if (c < 0) {
                    Collections.swap(data, lt++, i++);
                } else if (c > 0) {
                    Collections.swap(data, i, gt--);
                } else {
                    i++;
                }
            }
            if (nth < lt) {
                right = lt - 1;
            } else if (nth > gt) {
                left = gt + 1;
            } else {
                return;
            }
        }
    }

    private static <T> void heapSelect(List<T> data, int left, int right, int nth, Comparator<? super T> cmp) {
        List<T> range = new ArrayList<>(data.subList(left, right + 1));
        Sorts.heapSort(range, cmp);
        for (int i = 0; i < range.size(); i++) {
            data.set(left + i, range.get(i));
        }
    }

    private static void checkNotEmpty(List<?> data) {
        if (data.isEmpty()) {
            throw new IndexOutOfBoundsException("Cannot select from an empty collection");
        }
    }

    private static void checkRank(List<?> data, int rank) {
        checkNotEmpty(data);
        if (rank < 0 || rank >= data.size()) {
            throw new IndexOutOfBoundsException("Rank " + rank + " out of range for size " + data.size());
        }
    }
}

package com.trendrank.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trendrank.model.SortAlgorithm;

/**
 * Comparison sorts over lists, parameterized by an explicit comparator.
 * <p>
 * Every sort orders elements so that {@code comparator.compare(a, b) < 0} puts {@code a} first,
 * i.e. the first element is the best ranked one. Counting and radix sort work on raw
 * {@code long} values only and produce descending order.
 */
public final class Sorts {
    private static final Logger logger = LoggerFactory.getLogger(Sorts.class);

    private Sorts() {
    }

    /**
     * Sorts {@code data} in place with the chosen algorithm. Integral-only algorithms cannot order
     * composite keys and are substituted by the library's stable comparison sort.
     */
    public static <T> void sort(List<T> data, Comparator<? super T> comparator, SortAlgorithm algorithm) {
        switch (algorithm) {
            case SELECTION:
                selectionSort(data, comparator);
                break;
            case INSERTION:
                insertionSort(data, comparator);
                break;
            case BUBBLE:
                bubbleSort(data, comparator);
                break;
            case QUICK:
                quickSort(data, comparator);
                break;
            case MERGE:
                mergeSort(data, comparator);
                break;
            case SHELL:
                shellSort(data, comparator);
                break;
            case HEAP:
                heapSort(data, comparator);
                break;
            case COUNTING:
            case RADIX:
            default:
                logger.debug("{} needs integral values, falling back to comparison sort", algorithm.displayName());
                data.sort(comparator);
                break;
        }
    }

    public static <T> void selectionSort(List<T> p, Comparator<? super T> cmp) {
        int size = p.size();
        for (int i = 0; i < size - 1; i++) {
            int best = i;
            for (int j = i + 1; j < size; j++) {
                if (cmp.compare(p.get(j), p.get(best)) < 0) {
                    best = j;
                }
            }
            if (best != i) {
                Collections.swap(p, i, best);
            }
        }
    }

    public static <T> void insertionSort(List<T> p, Comparator<? super T> cmp) {
        int size = p.size();
        for (int i = 1; i < size; i++) {
            T key = p.get(i);
            int j = i - 1;
            while (j >= 0 && cmp.compare(key, p.get(j)) < 0) {
                p.set(j + 1, p.get(j));
                j--;
            }
            p.set(j + 1, key);
        }
    }

    public static <T> void bubbleSort(List<T> p, Comparator<? super T> cmp) {
        int size = p.size();
        for (int i = 0; i < size - 1; i++) {
            boolean swapped = false;
            for (int j = 0; j < size - 1 - i; j++) {
                if (cmp.compare(p.get(j), p.get(j + 1)) > 0) {
                    Collections.swap(p, j, j + 1);
                    swapped = true;
                }
            }
            if (!swapped) {
                break;
            }
        }
    }

    public static <T> void quickSort(List<T> p, Comparator<? super T> cmp) {
        if (p.size() > 1) {
            quickSort(p, 0, p.size() - 1, cmp);
        }
    }

    private static <T> void quickSort(List<T> p, int left, int right, Comparator<? super T> cmp) {
        // recurse into the smaller half, loop on the larger one
        while (left < right) {
            int idx = partition(p, left, right, cmp);
            if (idx - 1 - left < right - idx) {
                if (left < idx - 1) {
                    quickSort(p, left, idx - 1, cmp);
                }
                left = idx;
            } else {
                if (idx < right) {
                    quickSort(p, idx, right, cmp);
                }
                right = idx - 1;
            }
        }
    }

    /**
     * Hoare partition around a median-of-three pivot. On return every element left of the
     * returned index ranks no worse than the pivot, every element from it on no better.
     */
    static <T> int partition(List<T> p, int left, int right, Comparator<? super T> cmp) {
        T pivot = medianOfThree(p, left, right, cmp);
        int i = left;
        int j = right;
        while (i <= j) {
            while (cmp.compare(p.get(i), pivot) < 0) {
                i++;
            }
            while (cmp.compare(p.get(j), pivot) > 0) {
                j--;
            }
            if (i <= j) {
                Collections.swap(p, i, j);
                i++;
                j--;
            }
        }
        return i;
    }

    static <T> T medianOfThree(List<T> p, int left, int right, Comparator<? super T> cmp) {
        int mid = (left + right) >>> 1;
        T a = p.get(left);
        T b = p.get(mid);
        T c = p.get(right);
        if (cmp.compare(a, b) > 0) {
            T t = a;
            a = b;
            b = t;
        }
        if (cmp.compare(b, c) > 0) {
            b = c;
            if (cmp.compare(a, b) > 0) {
                b = a;
            }
        }
        return b;
    }

    public static <T> void mergeSort(List<T> p, Comparator<? super T> cmp) {
        if (p.size() <= 1) {
            return;
        }
        List<T> buffer = new ArrayList<>(p);
        mergeSort(p, buffer, 0, p.size() - 1, cmp);
    }

    private static <T> void mergeSort(List<T> p, List<T> buffer, int left, int right, Comparator<? super T> cmp) {
        if (left >= right) {
            return;
        }
        int mid = left + (right - left) / 2;
        mergeSort(p, buffer, left, mid, cmp);
        mergeSort(p, buffer, mid + 1, right, cmp);
        merge(p, buffer, left, mid, right, cmp);
    }

    private static <T> void merge(List<T> p, List<T> buffer, int left, int mid, int right,
            Comparator<? super T> cmp) {
        for (int t = left; t <= right; t++) {
            buffer.set(t, p.get(t));
        }
        int i = left;
        int j = mid + 1;
        int k = left;
        while (i <= mid && j <= right) {
            // <= keeps the sort stable
            if (cmp.compare(buffer.get(i), buffer.get(j)) <= 0) {
                p.set(k++, buffer.get(i++));
            } else {
                p.set(k++, buffer.get(j++));
            }
        }
        while (i <= mid) {
            p.set(k++, buffer.get(i++));
        }
        while (j <= right) {
            p.set(k++, buffer.get(j++));
        }
    }

    public static <T> void shellSort(List<T> p, Comparator<? super T> cmp) {
        int size = p.size();
        for (int gap = size / 2; gap > 0; gap /= 2) {
            for (int i = gap; i < size; i++) {
                T temp = p.get(i);
                int j = i;
                while (j >= gap && cmp.compare(temp, p.get(j - gap)) < 0) {
                    p.set(j, p.get(j - gap));
                    j -= gap;
                }
                p.set(j, temp);
            }
        }
    }

    public static <T> void heapSort(List<T> p, Comparator<? super T> cmp) {
        int size = p.size();
        if (size <= 1) {
            return;
        }
        // the worst-ranked element sits at the root, so extraction fills the tail with the worst first
        for (int i = size / 2 - 1; i >= 0; i--) {
            siftDown(p, size, i, cmp);
        }
        for (int i = size - 1; i > 0; i--) {
            Collections.swap(p, 0, i);
            siftDown(p, i, 0, cmp);
        }
    }

    private static <T> void siftDown(List<T> p, int n, int i, Comparator<? super T> cmp) {
        while (true) {
            int worst = i;
            int left = 2 * i + 1;
            int right = left + 1;
            if (left < n && cmp.compare(p.get(left), p.get(worst)) > 0) {
                worst = left;
            }
            if (right < n && cmp.compare(p.get(right), p.get(worst)) > 0) {
                worst = right;
            }
            if (worst == i) {
                return;
            }
            Collections.swap(p, i, worst);
            i = worst;
        }
    }

    /**
     * Stable counting sort over the value range, descending.
     *
     * @throws IllegalArgumentException when the value range does not fit an int-indexed table
     */
    public static void countingSort(long[] p) {
        if (p.length <= 1) {
            return;
        }
        long min = p[0];
        long max = p[0];
        for (long v : p) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        long range = max - min + 1;
        if (range <= 0 || range > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Value range too large for counting sort: " + min + ".." + max);
        }
        int[] count = new int[(int) range];
        for (long v : p) {
            count[(int) (v - min)]++;
        }
        // descending: accumulate from the top of the range down
        for (int i = count.length - 2; i >= 0; i--) {
            count[i] += count[i + 1];
        }
        long[] out = new long[p.length];
        for (int i = p.length - 1; i >= 0; i--) {
            out[--count[(int) (p[i] - min)]] = p[i];
        }
        System.arraycopy(out, 0, p, 0, p.length);
    }

    /**
     * LSD radix sort (base 10), descending. Negative values are handled by shifting the
     * whole array by its minimum first.
     */
    public static void radixSort(long[] p) {
        if (p.length <= 1) {
            return;
        }
        long min = p[0];
        for (long v : p) {
            min = Math.min(min, v);
        }
        long maxShifted = 0;
        for (int i = 0; i < p.length; i++) {
            p[i] -= min;
            if (Long.compareUnsigned(p[i], maxShifted) > 0) {
                maxShifted = p[i];
            }
        }
        long[] out = new long[p.length];
        for (long exp = 1; Long.divideUnsigned(maxShifted, exp) != 0; exp *= 10) {
            int[] count = new int[10];
            for (long v : p) {
                count[9 - digit(v, exp)]++;
            }
            for (int d = 1; d < 10; d++) {
                count[d] += count[d - 1];
            }
            for (int i = p.length - 1; i >= 0; i--) {
                out[--count[9 - digit(p[i], exp)]] = p[i];
            }
            System.arraycopy(out, 0, p, 0, p.length);
            // the next multiplication would overflow the unsigned range
            if (Long.compareUnsigned(exp, Long.divideUnsigned(-1L, 10)) > 0) {
                break;
            }
        }
        for (int i = 0; i < p.length; i++) {
            p[i] += min;
        }
    }

    private static int digit(long unsignedValue, long exp) {
        return (int) Long.remainderUnsigned(Long.divideUnsigned(unsignedValue, exp), 10);
    }

    public static <T> boolean isSorted(List<T> p, Comparator<? super T> cmp) {
        for (int i = 1; i < p.size(); i++) {
            if (cmp.compare(p.get(i - 1), p.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }
}

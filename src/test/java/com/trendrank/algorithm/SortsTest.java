package com.trendrank.algorithm;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.trendrank.model.RankingKey;
import com.trendrank.model.SortAlgorithm;

class SortsTest {

    private static List<RankingKey> randomKeys(int n, long seed) {
        Random random = new Random(seed);
        List<RankingKey> keys = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            // titles are unique so the expected order is fully determined
            keys.add(new RankingKey(random.nextInt(50), "id" + i, String.format("t%04d", i)));
        }
        return keys;
    }

    @ParameterizedTest
    @EnumSource(SortAlgorithm.class)
    void every_algorithm_matches_library_sort(SortAlgorithm algorithm) {
        for (int n : new int[] { 0, 1, 2, 3, 17, 200 }) {
            List<RankingKey> data = randomKeys(n, 31L * n + algorithm.ordinal());
            List<RankingKey> expected = new ArrayList<>(data);
            expected.sort(Comparator.naturalOrder());

            Sorts.sort(data, Comparator.naturalOrder(), algorithm);

            assertEquals(expected, data, algorithm + " n=" + n);
            assertTrue(Sorts.isSorted(data, Comparator.<RankingKey>naturalOrder()));
        }
    }

    @Test
    void merge_sort_is_stable() {
        List<RankingKey> data = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            data.add(new RankingKey(i % 3, "id" + i, "same"));
        }
        Sorts.mergeSort(data, Comparator.naturalOrder());

        int lastIndexInGroup = -1;
        long lastScore = Long.MAX_VALUE;
        for (RankingKey key : data) {
            int index = Integer.parseInt(key.id().substring(2));
            if (key.score() != lastScore) {
                lastScore = key.score();
                lastIndexInGroup = -1;
            }
            assertTrue(index > lastIndexInGroup, "order within equal keys changed at " + key);
            lastIndexInGroup = index;
        }
    }

    @Test
    void quick_sort_handles_many_duplicates() {
        List<Integer> data = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            data.add(i % 4);
        }
        Sorts.quickSort(data, Comparator.reverseOrder());

        assertTrue(Sorts.isSorted(data, Comparator.<Integer>reverseOrder()));
        assertEquals(3, data.get(0));
        assertEquals(0, data.get(499));
    }

    @Test
    void counting_sort_orders_descending_with_negatives() {
        long[] values = { 3, -2, 7, 0, 7, -2, 1 };
        Sorts.countingSort(values);

        assertArrayEquals(new long[] { 7, 7, 3, 1, 0, -2, -2 }, values);
    }

    @Test
    void counting_sort_rejects_huge_ranges() {
        long[] values = { Long.MIN_VALUE, Long.MAX_VALUE };

        assertThrows(IllegalArgumentException.class, () -> Sorts.countingSort(values));
    }

    @Test
    void radix_sort_orders_descending() {
        long[] values = { 170, 45, 75, -90, 802, 24, 2, 66, 0 };
        long[] expected = values.clone();
        Arrays.sort(expected);
        reverse(expected);

        Sorts.radixSort(values);

        assertArrayEquals(expected, values);
    }

    @Test
    void radix_sort_survives_extreme_values() {
        long[] values = { Long.MAX_VALUE, Long.MIN_VALUE, 0, -1, 1 };
        Sorts.radixSort(values);

        assertArrayEquals(new long[] { Long.MAX_VALUE, 1, 0, -1, Long.MIN_VALUE }, values);
    }

    private static void reverse(long[] values) {
        for (int i = 0, j = values.length - 1; i < j; i++, j--) {
            long t = values[i];
            values[i] = values[j];
            values[j] = t;
        }
    }
}

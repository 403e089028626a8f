package com.trendrank.algorithm;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.trendrank.model.RankingKey;

class OrderStatisticsTreeTest {

    private OrderStatisticsTree<RankingKey> tree;

    @BeforeEach
    void setUp() {
        tree = new OrderStatisticsTree<>(Comparator.naturalOrder(), RankingKey::id);
    }

    private static RankingKey key(String id, long score) {
        return new RankingKey(score, id, id);
    }

    @Test
    void rank_and_kth_element_of_small_tree() {
        RankingKey a = key("A", 50);
        RankingKey b = key("B", 40);
        RankingKey c = key("C", 30);
        tree.insert(b);
        tree.insert(c);
        tree.insert(a);

        assertEquals(2, tree.getRank(b).getAsInt());
        assertEquals(c, tree.kthElement(3).orElseThrow());
        assertEquals(a, tree.kthElement(1).orElseThrow());
        assertEquals(List.of(a, b, c), tree.toList());
    }

    @Test
    void out_of_range_and_missing_lookups_are_empty() {
        tree.insert(key("A", 1));

        assertTrue(tree.kthElement(0).isEmpty());
        assertTrue(tree.kthElement(2).isEmpty());
        assertTrue(tree.getRank(key("Z", 1)).isEmpty());
        assertTrue(tree.findById("Z").isEmpty());
        assertTrue(tree.rankOfId("Z").isEmpty());
        assertFalse(tree.removeById("Z"));
        assertFalse(tree.update("Z", key("Z", 3)));
    }

    @Test
    void equal_scores_and_titles_are_ordered_by_id() {
        RankingKey first = new RankingKey(10, "a", "same");
        RankingKey second = new RankingKey(10, "b", "same");
        tree.insert(second);
        tree.insert(first);

        assertEquals(2, tree.size());
        assertEquals(List.of(first, second), tree.toList());
        assertEquals(2, tree.getRank(second).getAsInt());
    }

    @Test
    void inserting_an_existing_id_replaces_it() {
        tree.insert(key("A", 10));
        tree.insert(key("B", 20));
        tree.insert(key("A", 30));

        assertEquals(2, tree.size());
        assertEquals(30, tree.findById("A").orElseThrow().score());
        assertEquals(1, tree.rankOfId("A").getAsInt());
        assertTrue(tree.isConsistent());
    }

    @Test
    void update_moves_key_to_new_rank() {
        for (int i = 0; i < 10; i++) {
            tree.insert(key("k" + i, i * 10));
        }
        assertEquals(10, tree.rankOfId("k0").getAsInt());

        assertTrue(tree.update("k0", key("k0", 1000)));

        assertEquals(1, tree.rankOfId("k0").getAsInt());
        assertEquals(10, tree.size());
        assertTrue(tree.isConsistent());
    }

    @Test
    void remove_of_node_with_two_children_keeps_id_map_valid() {
        for (int i = 0; i < 15; i++) {
            tree.insert(key("k" + i, i));
        }
        // the root of a balanced tree of 15 sequential inserts has two children
        RankingKey root = tree.kthElement(8).orElseThrow();
        assertTrue(tree.removeById(root.id()));

        assertEquals(14, tree.size());
        assertTrue(tree.isConsistent());
        for (int i = 0; i < 15; i++) {
            String id = "k" + i;
            if (!id.equals(root.id())) {
                assertEquals(id, tree.findById(id).orElseThrow().id());
            }
        }
    }

    @Test
    void random_operations_keep_tree_balanced_and_consistent() {
        Random random = new Random(2024);
        Map<String, RankingKey> reference = new HashMap<>();

        for (int step = 0; step < 3000; step++) {
            String id = "id" + random.nextInt(300);
            int op = random.nextInt(3);
            if (op == 0) {
                RankingKey k = key(id, random.nextInt(100));
                tree.insert(k);
                reference.put(id, k);
            } else if (op == 1) {
                assertEquals(reference.remove(id) != null, tree.removeById(id));
            } else {
                RankingKey k = key(id, random.nextInt(100));
                assertEquals(reference.containsKey(id), tree.update(id, k));
                if (reference.containsKey(id)) {
                    reference.put(id, k);
                }
            }
            if (step % 250 == 0) {
                assertTrue(tree.isConsistent(), "inconsistent at step " + step);
            }
        }

        assertTrue(tree.isConsistent());
        assertEquals(reference.size(), tree.size());
        // AVL height bound: 1.44 log2(n + 2)
        double bound = 1.45 * (Math.log(tree.size() + 2) / Math.log(2));
        assertTrue(tree.height() <= bound, "height " + tree.height() + " exceeds " + bound);

        List<RankingKey> inOrder = tree.toList();
        for (int k = 1; k <= tree.size(); k++) {
            RankingKey kth = tree.kthElement(k).orElseThrow();
            assertEquals(inOrder.get(k - 1), kth);
            assertEquals(k, tree.getRank(kth).getAsInt());
        }

        List<RankingKey> expected = new ArrayList<>(reference.values());
        expected.sort(Comparator.<RankingKey>naturalOrder().thenComparing(RankingKey::id));
        assertEquals(expected, inOrder);
    }

    @Test
    void top_k_is_bounded() {
        for (int i = 0; i < 20; i++) {
            tree.insert(key("k" + i, i));
        }

        List<RankingKey> top = tree.topK(3);

        assertEquals(List.of("k19", "k18", "k17"), top.stream().map(RankingKey::id).toList());
        assertTrue(tree.topK(0).isEmpty());
        assertEquals(20, tree.topK(100).size());
    }

    @Test
    void clear_recycles_everything() {
        for (int i = 0; i < 40; i++) {
            tree.insert(key("k" + i, i));
        }
        tree.clear();

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.height());
        tree.insert(key("again", 1));
        assertEquals(1, tree.size());
        assertTrue(tree.isConsistent());
    }
}

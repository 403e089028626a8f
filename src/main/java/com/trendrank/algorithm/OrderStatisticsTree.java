package com.trendrank.algorithm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * AVL tree augmented with subtree sizes, answering rank and k-th element queries in O(log n).
 * <p>
 * Nodes live in an arena of parallel arrays and reference their children by slot index; freed
 * slots are recycled. A companion id → slot map finds a node without traversal. The map never
 * owns anything: it is rewritten on every insert, remove and successor replacement so that it
 * always points at the slot currently holding the id's key.
 * <p>
 * Keys are ordered by the given comparator with the id as final tie-break, so every key has a
 * unique position. This class is not thread-safe.
 *
 * @param <T> key type
 */
public final class OrderStatisticsTree<T> {
    private static final int NIL = -1;
    private static final int INITIAL_CAPACITY = 16;

    private final Comparator<? super T> order;
    private final Function<? super T, String> idOf;
    private final Map<String, Integer> slotById = new HashMap<>();

    private Object[] keys;
    private int[] left;
    private int[] right;
    private int[] height;
    private int[] subtreeSize;

    private int root = NIL;
    private int nextUnused;
    private int[] freeSlots;
    private int freeCount;

    public OrderStatisticsTree(Comparator<? super T> comparator, Function<? super T, String> idOf) {
        this.idOf = idOf;
        this.order = (a, b) -> {
            int c = comparator.compare(a, b);
            return c != 0 ? c : idOf.apply(a).compareTo(idOf.apply(b));
        };
        allocate(INITIAL_CAPACITY);
    }

    /**
     * Inserts a key. A key whose id is already present replaces the old one.
     */
    public void insert(T key) {
        String id = idOf.apply(key);
        if (slotById.containsKey(id)) {
            removeById(id);
        }
        int slot = newSlot(key);
        slotById.put(id, slot);
        root = insertNode(root, slot);
    }

    /**
     * Removes the key with the given id.
     *
     * @return false when no such id is present
     */
    public boolean removeById(String id) {
        Integer slot = slotById.remove(id);
        if (slot == null) {
            return false;
        }
        root = removeNode(root, key(slot));
        return true;
    }

    /**
     * Replaces the key stored under {@code id}. Implemented as remove-then-insert because the
     * new key's rank may differ arbitrarily from the old one.
     *
     * @return false when no such id is present
     */
    public boolean update(String id, T newKey) {
        if (!removeById(id)) {
            return false;
        }
        insert(newKey);
        return true;
    }

    public void clear() {
        slotById.clear();
        root = NIL;
        nextUnused = 0;
        freeCount = 0;
        Arrays.fill(keys, null);
    }

    public int size() {
        return sizeOf(root);
    }

    public boolean isEmpty() {
        return root == NIL;
    }

    public int height() {
        return heightOf(root);
    }

    public boolean contains(String id) {
        return slotById.containsKey(id);
    }

    public Optional<T> findById(String id) {
        Integer slot = slotById.get(id);
        return slot == null ? Optional.empty() : Optional.of(key(slot));
    }

    /**
     * @param k 1-based rank
     * @return the key of that rank, empty when k is outside [1, size]
     */
    public Optional<T> kthElement(int k) {
        if (k < 1 || k > size()) {
            return Optional.empty();
        }
        int node = root;
        while (node != NIL) {
            int leftSize = sizeOf(left[node]);
            if (k <= leftSize) {
                node = left[node];
            } else if (k == leftSize + 1) {
                return Optional.of(key(node));
            } else {
                k -= leftSize + 1;
                node = right[node];
            }
        }
        return Optional.empty();
    }

    /**
     * @return the 1-based rank of a key stored in the tree, empty when it is not present
     */
    public OptionalInt getRank(T key) {
        int node = root;
        int rank = 0;
        while (node != NIL) {
            int c = order.compare(key, key(node));
            if (c < 0) {
                node = left[node];
            } else if (c > 0) {
                rank += sizeOf(left[node]) + 1;
                node = right[node];
            } else {
                return OptionalInt.of(rank + sizeOf(left[node]) + 1);
            }
        }
        return OptionalInt.empty();
    }

    public OptionalInt rankOfId(String id) {
        Integer slot = slotById.get(id);
        return slot == null ? OptionalInt.empty() : getRank(key(slot));
    }

    /**
     * The first {@code min(k, size)} keys in order, via a bounded in-order walk.
     */
    public List<T> topK(int k) {
        int limit = Math.max(0, Math.min(k, size()));
        List<T> result = new ArrayList<>(limit);
        Deque<Integer> stack = new ArrayDeque<>();
        int node = root;
        while (result.size() < limit && (node != NIL || !stack.isEmpty())) {
            while (node != NIL) {
                stack.push(node);
                node = left[node];
            }
            node = stack.pop();
            result.add(key(node));
            node = right[node];
        }
        return result;
    }

    public List<T> toList() {
        return topK(size());
    }

    private int insertNode(int node, int slot) {
        if (node == NIL) {
            return slot;
        }
        if (order.compare(key(slot), key(node)) < 0) {
            left[node] = insertNode(left[node], slot);
        } else {
            right[node] = insertNode(right[node], slot);
        }
        return rebalance(node);
    }

    private int removeNode(int node, T target) {
        if (node == NIL) {
            return NIL;
        }
        int c = order.compare(target, key(node));
        if (c < 0) {
            left[node] = removeNode(left[node], target);
        } else if (c > 0) {
            right[node] = removeNode(right[node], target);
        } else {
            if (left[node] == NIL || right[node] == NIL) {
                int child = left[node] != NIL ? left[node] : right[node];
                release(node);
                return child;
            }
            int successor = right[node];
            while (left[successor] != NIL) {
                successor = left[successor];
            }
            T moved = key(successor);
            keys[node] = moved;
            slotById.put(idOf.apply(moved), node);
            right[node] = removeNode(right[node], moved);
        }
        return rebalance(node);
    }

    private int rebalance(int node) {
        refresh(node);
        int balance = balanceOf(node);
        if (balance > 1) {
            if (balanceOf(left[node]) < 0) {
                left[node] = rotateLeft(left[node]);
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            if (balanceOf(right[node]) > 0) {
                right[node] = rotateRight(right[node]);
            }
            return rotateLeft(node);
        }
        return node;
    }

    private int rotateRight(int y) {
        int x = left[y];
        left[y] = right[x];
        right[x] = y;
        refresh(y);
        refresh(x);
        return x;
    }

    private int rotateLeft(int x) {
        int y = right[x];
        right[x] = left[y];
        left[y] = x;
        refresh(x);
        refresh(y);
        return y;
    }

    private void refresh(int node) {
        height[node] = 1 + Math.max(heightOf(left[node]), heightOf(right[node]));
        subtreeSize[node] = 1 + sizeOf(left[node]) + sizeOf(right[node]);
    }

    private int balanceOf(int node) {
        return node == NIL ? 0 : heightOf(left[node]) - heightOf(right[node]);
    }

    private int heightOf(int node) {
        return node == NIL ? 0 : height[node];
    }

    private int sizeOf(int node) {
        return node == NIL ? 0 : subtreeSize[node];
    }

    @SuppressWarnings("unchecked")
    private T key(int slot) {
        return (T) keys[slot];
    }

    private int newSlot(T key) {
        int slot;
        if (freeCount > 0) {
            slot = freeSlots[--freeCount];
        } else {
            if (nextUnused == keys.length) {
                allocate(keys.length * 2);
            }
            slot = nextUnused++;
        }
        keys[slot] = key;
        left[slot] = NIL;
        right[slot] = NIL;
        height[slot] = 1;
        subtreeSize[slot] = 1;
        return slot;
    }

    private void release(int slot) {
        keys[slot] = null;
        freeSlots[freeCount++] = slot;
    }

    private void allocate(int capacity) {
        keys = keys == null ? new Object[capacity] : Arrays.copyOf(keys, capacity);
        left = left == null ? new int[capacity] : Arrays.copyOf(left, capacity);
        right = right == null ? new int[capacity] : Arrays.copyOf(right, capacity);
        height = height == null ? new int[capacity] : Arrays.copyOf(height, capacity);
        subtreeSize = subtreeSize == null ? new int[capacity] : Arrays.copyOf(subtreeSize, capacity);
        freeSlots = freeSlots == null ? new int[capacity] : Arrays.copyOf(freeSlots, capacity);
    }

    /**
     * Walks the whole tree and checks ordering, AVL balance, cached heights and sizes, and that the
     * id map points at the slot holding each id. Linear time; meant for tests.
     */
    boolean isConsistent() {
        if (checkSubtree(root) < 0) {
            return false;
        }
        if (slotById.size() != size()) {
            return false;
        }
        for (Map.Entry<String, Integer> entry : slotById.entrySet()) {
            Object stored = keys[entry.getValue()];
            if (stored == null || !idOf.apply(key(entry.getValue())).equals(entry.getKey())) {
                return false;
            }
        }
        List<T> inOrder = toList();
        for (int i = 1; i < inOrder.size(); i++) {
            if (order.compare(inOrder.get(i - 1), inOrder.get(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    private int checkSubtree(int node) {
        if (node == NIL) {
            return 0;
        }
        int lh = checkSubtree(left[node]);
        int rh = checkSubtree(right[node]);
        if (lh < 0 || rh < 0 || Math.abs(lh - rh) > 1) {
            return -1;
        }
        if (height[node] != 1 + Math.max(lh, rh)) {
            return -1;
        }
        if (subtreeSize[node] != 1 + sizeOf(left[node]) + sizeOf(right[node])) {
            return -1;
        }
        return height[node];
    }
}

package com.trendrank.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trendrank.model.Item;

final class Snapshots {

    private Snapshots() {
    }

    /**
     * Indexes a snapshot by id, keeping snapshot order. When an id occurs more than once the last
     * occurrence wins.
     */
    static Map<String, Item> byId(List<Item> items) {
        Map<String, Item> byId = new LinkedHashMap<>(Math.max(16, items.size() * 4 / 3 + 1));
        for (Item item : items) {
            byId.put(item.id(), item);
        }
        return byId;
    }

    static List<Item> distinct(List<Item> items) {
        Map<String, Item> byId = byId(items);
        return byId.size() == items.size() ? items : List.copyOf(byId.values());
    }
}

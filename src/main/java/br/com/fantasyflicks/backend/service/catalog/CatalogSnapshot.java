package br.com.fantasyflicks.backend.service.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fotografia imutável de um pool do catálogo.
 * 
 * {@code rankedItems} já vem na ordem de ranking (melhor primeiro) e
 * {@code categories} na ordem declarada pelo catálogo.
 */
public record CatalogSnapshot(
        String poolId,
        List<String> rankedItems,
        Map<String, String> categoryByItem,
        List<String> categories,
        Map<String, Double> itemValues,
        Set<String> winners) {

    public CatalogSnapshot {
        rankedItems = List.copyOf(rankedItems);
        categoryByItem = Collections.unmodifiableMap(new LinkedHashMap<>(categoryByItem));
        categories = List.copyOf(categories);
        itemValues = Collections.unmodifiableMap(new LinkedHashMap<>(itemValues));
        winners = Collections.unmodifiableSet(new LinkedHashSet<>(winners));
    }

    public static CatalogSnapshot empty(String poolId) {
        return new CatalogSnapshot(poolId, List.of(), Map.of(), List.of(), Map.of(), Set.of());
    }

    public List<String> itemsInPool() {
        return rankedItems;
    }

    public boolean contains(String itemId) {
        return itemId != null && categoryByItem.containsKey(itemId);
    }

    /**
     * Categoria do item, ou null se o item não tiver categoria ou não existir.
     */
    public String categoryOf(String itemId) {
        return itemId == null ? null : categoryByItem.get(itemId);
    }

    public List<String> itemsInCategory(String categoryId) {
        List<String> result = new ArrayList<>();
        for (String itemId : rankedItems) {
            if (categoryId != null && categoryId.equals(categoryByItem.get(itemId))) {
                result.add(itemId);
            }
        }
        return result;
    }
}

package br.com.fantasyflicks.backend.service.catalog;

import br.com.fantasyflicks.backend.config.CacheConfig;
import br.com.fantasyflicks.backend.domain.entity.CatalogCategoryEntity;
import br.com.fantasyflicks.backend.domain.entity.CatalogItemEntity;
import br.com.fantasyflicks.backend.domain.repository.CatalogCategoryRepository;
import br.com.fantasyflicks.backend.domain.repository.CatalogItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catálogo lido do banco, com snapshot em cache (Caffeine) por pool.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaItemCatalog implements ItemCatalog {

    private final CatalogItemRepository itemRepository;
    private final CatalogCategoryRepository categoryRepository;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.CATALOG_SNAPSHOTS, key = "#poolId")
    public CatalogSnapshot snapshot(String poolId) {
        List<CatalogItemEntity> items = itemRepository.findByPoolIdOrderByRankOrderAsc(poolId);
        if (items.isEmpty()) {
            log.warn("⚠️ [Catalog] Pool {} vazio ou inexistente", poolId);
            return CatalogSnapshot.empty(poolId);
        }

        List<String> ranked = new ArrayList<>(items.size());
        Map<String, String> categoryByItem = new LinkedHashMap<>();
        Map<String, Double> values = new LinkedHashMap<>();
        Set<String> winners = new HashSet<>();

        for (CatalogItemEntity item : items) {
            ranked.add(item.getItemId());
            categoryByItem.put(item.getItemId(), item.getCategoryId());
            if (item.getScoreValue() != null) {
                values.put(item.getItemId(), item.getScoreValue());
            }
            if (item.isWinner()) {
                winners.add(item.getItemId());
            }
        }

        List<String> categories = categoryRepository.findByPoolIdOrderByDisplayOrderAsc(poolId).stream()
                .map(CatalogCategoryEntity::getCategoryId)
                .toList();

        log.debug("[Catalog] Snapshot do pool {} carregado: {} itens, {} categorias",
                poolId, ranked.size(), categories.size());
        return new CatalogSnapshot(poolId, ranked, categoryByItem, categories, values, winners);
    }
}

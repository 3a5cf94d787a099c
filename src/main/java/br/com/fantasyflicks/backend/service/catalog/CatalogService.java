package br.com.fantasyflicks.backend.service.catalog;

import br.com.fantasyflicks.backend.config.CacheConfig;
import br.com.fantasyflicks.backend.domain.entity.CatalogCategoryEntity;
import br.com.fantasyflicks.backend.domain.entity.CatalogItemEntity;
import br.com.fantasyflicks.backend.domain.repository.CatalogCategoryRepository;
import br.com.fantasyflicks.backend.domain.repository.CatalogItemRepository;
import br.com.fantasyflicks.backend.dto.CatalogCategoryRequest;
import br.com.fantasyflicks.backend.dto.CatalogItemRequest;
import br.com.fantasyflicks.backend.dto.CatalogPoolDTO;
import br.com.fantasyflicks.backend.dto.CatalogPoolRequest;
import br.com.fantasyflicks.backend.dto.ItemResultRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Manutenção dos pools do catálogo (itens ranqueados, categorias e
 * resultados usados na pontuação).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final CatalogItemRepository itemRepository;
    private final CatalogCategoryRepository categoryRepository;

    /**
     * Substitui todo o conteúdo do pool.
     *
     * @throws IllegalArgumentException se houver item/categoria duplicado ou
     *                                  item numa categoria não declarada
     */
    @Transactional
    @CacheEvict(value = CacheConfig.CATALOG_SNAPSHOTS, key = "#poolId")
    public CatalogPoolDTO replacePool(String poolId, CatalogPoolRequest request) {
        validatePool(request);

        itemRepository.deleteByPoolId(poolId);
        categoryRepository.deleteByPoolId(poolId);
        // deletes antes dos inserts (chaves únicas por pool)
        itemRepository.flush();
        categoryRepository.flush();

        List<CatalogCategoryEntity> categories = new ArrayList<>();
        int order = 0;
        for (CatalogCategoryRequest category : request.getCategories()) {
            categories.add(CatalogCategoryEntity.builder()
                    .poolId(poolId)
                    .categoryId(category.getCategoryId())
                    .displayName(category.getDisplayName())
                    .displayOrder(order++)
                    .build());
        }
        categoryRepository.saveAll(categories);

        List<CatalogItemEntity> items = new ArrayList<>();
        int rank = 0;
        for (CatalogItemRequest item : request.getItems()) {
            items.add(CatalogItemEntity.builder()
                    .poolId(poolId)
                    .itemId(item.getItemId())
                    .displayName(item.getDisplayName())
                    .categoryId(item.getCategoryId())
                    .rankOrder(rank++)
                    .scoreValue(item.getScoreValue())
                    .winner(item.isWinner())
                    .build());
        }
        itemRepository.saveAll(items);

        log.info("✅ [Catalog] Pool {} atualizado: {} itens, {} categorias",
                poolId, items.size(), categories.size());
        return getPool(poolId);
    }

    @Transactional(readOnly = true)
    public CatalogPoolDTO getPool(String poolId) {
        List<CatalogItemRequest> items = itemRepository.findByPoolIdOrderByRankOrderAsc(poolId).stream()
                .map(item -> CatalogItemRequest.builder()
                        .itemId(item.getItemId())
                        .displayName(item.getDisplayName())
                        .categoryId(item.getCategoryId())
                        .scoreValue(item.getScoreValue())
                        .winner(item.isWinner())
                        .build())
                .toList();
        List<CatalogCategoryRequest> categories = categoryRepository.findByPoolIdOrderByDisplayOrderAsc(poolId)
                .stream()
                .map(category -> CatalogCategoryRequest.builder()
                        .categoryId(category.getCategoryId())
                        .displayName(category.getDisplayName())
                        .build())
                .toList();

        return CatalogPoolDTO.builder()
                .poolId(poolId)
                .items(items)
                .categories(categories)
                .build();
    }

    /**
     * Registra o resultado de um item (valor e/ou vencedor).
     */
    @Transactional
    @CacheEvict(value = CacheConfig.CATALOG_SNAPSHOTS, key = "#poolId")
    public CatalogItemRequest recordResult(String poolId, String itemId, ItemResultRequest result) {
        CatalogItemEntity item = itemRepository.findByPoolIdAndItemId(poolId, itemId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Item " + itemId + " não encontrado no pool " + poolId));

        if (result.getScoreValue() != null) {
            item.setScoreValue(result.getScoreValue());
        }
        if (result.getWinner() != null) {
            item.setWinner(result.getWinner());
        }
        itemRepository.save(item);

        log.info("🏆 [Catalog] Resultado registrado: pool={}, item={}, valor={}, vencedor={}",
                poolId, itemId, item.getScoreValue(), item.isWinner());
        return CatalogItemRequest.builder()
                .itemId(item.getItemId())
                .displayName(item.getDisplayName())
                .categoryId(item.getCategoryId())
                .scoreValue(item.getScoreValue())
                .winner(item.isWinner())
                .build();
    }

    private void validatePool(CatalogPoolRequest request) {
        Set<String> categoryIds = new HashSet<>();
        for (CatalogCategoryRequest category : request.getCategories()) {
            if (!categoryIds.add(category.getCategoryId())) {
                throw new IllegalArgumentException("Categoria duplicada: " + category.getCategoryId());
            }
        }
        Set<String> itemIds = new HashSet<>();
        for (CatalogItemRequest item : request.getItems()) {
            if (!itemIds.add(item.getItemId())) {
                throw new IllegalArgumentException("Item duplicado: " + item.getItemId());
            }
            if (item.getCategoryId() != null && !categoryIds.contains(item.getCategoryId())) {
                throw new IllegalArgumentException(
                        "Item " + item.getItemId() + " usa categoria não declarada: " + item.getCategoryId());
            }
        }
    }
}

package br.com.fantasyflicks.backend.service.catalog;

/**
 * Fonte dos itens de um pool (filmes, indicados por categoria).
 */
public interface ItemCatalog {

    /**
     * Snapshot atual do pool. Pool desconhecido devolve snapshot vazio.
     */
    CatalogSnapshot snapshot(String poolId);
}

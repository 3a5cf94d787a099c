package br.com.fantasyflicks.backend.domain.model;

public enum EligibilityMode {

    /**
     * Qualquer item ainda não escolhido (posse global única)
     */
    OPEN_POOL,

    /**
     * Itens particionados em categorias (ex.: categorias do Oscar)
     */
    CATEGORY_CONSTRAINED
}

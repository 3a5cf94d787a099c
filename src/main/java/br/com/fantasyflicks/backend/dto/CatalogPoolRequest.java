package br.com.fantasyflicks.backend.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conteúdo completo de um pool. {@code items} já na ordem de ranking e
 * {@code categories} na ordem em que as rodadas as liberam.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogPoolRequest {

    @Valid
    @Builder.Default
    private List<CatalogItemRequest> items = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<CatalogCategoryRequest> categories = new ArrayList<>();
}

package br.com.fantasyflicks.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogPoolDTO {
    private String poolId;
    private List<CatalogItemRequest> items;
    private List<CatalogCategoryRequest> categories;
}

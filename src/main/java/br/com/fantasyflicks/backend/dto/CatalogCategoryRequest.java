package br.com.fantasyflicks.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogCategoryRequest {

    @NotBlank(message = "ID da categoria é obrigatório")
    private String categoryId;

    private String displayName;
}

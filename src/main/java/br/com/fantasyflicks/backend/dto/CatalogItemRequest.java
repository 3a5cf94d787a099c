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
public class CatalogItemRequest {

    @NotBlank(message = "ID do item é obrigatório")
    private String itemId;

    private String displayName;

    private String categoryId;

    private Double scoreValue;

    private boolean winner;
}

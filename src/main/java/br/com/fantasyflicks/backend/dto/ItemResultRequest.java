package br.com.fantasyflicks.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resultado de um item (bilheteria, vencedor da categoria). Campos nulos não
 * são alterados.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemResultRequest {
    private Double scoreValue;
    private Boolean winner;
}

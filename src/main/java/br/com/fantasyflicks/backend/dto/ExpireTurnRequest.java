package br.com.fantasyflicks.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpireTurnRequest {

    @NotNull(message = "Versão esperada é obrigatória")
    private Long expectedVersion;
}

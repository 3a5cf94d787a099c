package br.com.fantasyflicks.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDraftRequest {

    @NotNull(message = "Horário de início é obrigatório")
    private Instant scheduledAt;

    /**
     * Versão lida pelo cliente; null aceita a versão atual
     */
    private Long expectedVersion;
}

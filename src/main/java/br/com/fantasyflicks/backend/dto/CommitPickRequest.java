package br.com.fantasyflicks.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommitPickRequest {

    @NotBlank(message = "Item é obrigatório")
    private String itemId;

    @NotNull(message = "Versão esperada é obrigatória")
    private Long expectedVersion;
}

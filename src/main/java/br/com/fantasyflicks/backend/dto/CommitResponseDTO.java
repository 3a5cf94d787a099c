package br.com.fantasyflicks.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resposta de um pick (aceito ou recusado).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitResponseDTO {
    private boolean success;
    private String error;
    private String reason;
    private String message;
    private boolean retryable;
    private SelectionDTO selection;
    private DraftSessionDTO session;
}

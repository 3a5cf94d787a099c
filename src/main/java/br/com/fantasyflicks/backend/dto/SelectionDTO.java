package br.com.fantasyflicks.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionDTO {
    private int overallPickNumber;
    private int roundNumber;
    private int positionInRound;
    private String pickerId;
    private String itemId;
    private Instant committedAt;
    private boolean autoSelected;
}

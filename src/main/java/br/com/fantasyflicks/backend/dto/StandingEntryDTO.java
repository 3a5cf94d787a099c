package br.com.fantasyflicks.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StandingEntryDTO {
    private int rank;
    private String participantId;
    private double primaryScore;
    private double secondaryTiebreakMetric;
    private int selectionCount;
}

package br.com.fantasyflicks.backend.dto;

import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftDiscipline;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.EligibilityMode;
import br.com.fantasyflicks.backend.domain.model.FallbackPolicy;
import br.com.fantasyflicks.backend.service.TimerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftSessionDTO {
    private Long id;
    private String leagueId;
    private String commissionerId;
    private String poolId;
    private List<String> order;
    private DraftDiscipline discipline;
    private int roundsTotal;
    private int totalPicks;
    private int turnBudgetSeconds;
    private EligibilityMode eligibilityMode;
    private CategoryStyle categoryStyle;
    private FallbackPolicy fallbackPolicy;

    private DraftStatus status;
    private int currentOverallPick;
    private Integer currentRound;
    private String currentPickerId;
    private Instant turnStartedAt;
    private long version;

    // preenchidos pelo serviço a partir do relógio do servidor
    private Long remainingSeconds;
    private TimerState timerState;
    private String activeCategory;

    private Instant createdAt;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant pausedAt;
    private Instant completedAt;
}

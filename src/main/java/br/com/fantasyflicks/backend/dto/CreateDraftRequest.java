package br.com.fantasyflicks.backend.dto;

import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftDiscipline;
import br.com.fantasyflicks.backend.domain.model.DraftOrderType;
import br.com.fantasyflicks.backend.domain.model.EligibilityMode;
import br.com.fantasyflicks.backend.domain.model.FallbackPolicy;
import br.com.fantasyflicks.backend.domain.model.ScoringDirection;
import br.com.fantasyflicks.backend.domain.model.ScoringMode;
import br.com.fantasyflicks.backend.domain.model.TiebreakMetric;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Pedido de criação de draft. Campos opcionais nulos assumem o padrão da liga
 * ou de {@code app.draft}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDraftRequest {

    private String leagueId;

    @NotBlank(message = "Pool do catálogo é obrigatório")
    private String poolId;

    @NotEmpty(message = "Participantes são obrigatórios")
    private List<String> participants;

    /**
     * RANDOM embaralha {@code participants}; MANUAL usa a ordem recebida
     */
    private DraftOrderType orderType;

    private DraftDiscipline discipline;

    @Min(value = 1, message = "Número de rodadas deve ser pelo menos 1")
    private int roundsTotal;

    /**
     * null = padrão do servidor, 0 = sem timer
     */
    @PositiveOrZero(message = "Tempo por pick deve ser positivo")
    private Integer turnBudgetSeconds;

    private EligibilityMode eligibilityMode;
    private CategoryStyle categoryStyle;
    private Boolean allowDuplicatePicks;
    private Boolean sharedOwnership;
    private FallbackPolicy fallbackPolicy;

    private ScoringMode scoringMode;
    private TiebreakMetric tiebreakMetric;
    private Double pointsPerCorrectPick;
    private ScoringDirection scoringDirection;
}

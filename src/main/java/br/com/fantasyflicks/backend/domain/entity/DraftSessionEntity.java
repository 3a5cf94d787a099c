package br.com.fantasyflicks.backend.domain.entity;

import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftDiscipline;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.EligibilityMode;
import br.com.fantasyflicks.backend.domain.model.FallbackPolicy;
import br.com.fantasyflicks.backend.domain.model.ScoringDirection;
import br.com.fantasyflicks.backend.domain.model.ScoringMode;
import br.com.fantasyflicks.backend.domain.model.TiebreakMetric;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "draft_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftSessionEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "league_id")
    private String leagueId;

    @Column(name = "commissioner_id")
    private String commissionerId;

    @Column(name = "pool_id", nullable = false)
    private String poolId;

    @Column(name = "draft_order", columnDefinition = "TEXT", nullable = false)
    private String draftOrderJson;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private DraftDiscipline discipline;

    @Column(name = "rounds_total", nullable = false)
    private int roundsTotal;

    @Column(name = "turn_budget_seconds", nullable = false)
    private int turnBudgetSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "eligibility_mode", length = 30, nullable = false)
    private EligibilityMode eligibilityMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "category_style", length = 30, nullable = false)
    private CategoryStyle categoryStyle;

    @Column(name = "allow_duplicate_picks", nullable = false)
    private boolean allowDuplicatePicks;

    @Column(name = "shared_ownership", nullable = false)
    private boolean sharedOwnership;

    @Enumerated(EnumType.STRING)
    @Column(name = "fallback_policy", length = 20, nullable = false)
    private FallbackPolicy fallbackPolicy;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_mode", length = 30, nullable = false)
    private ScoringMode scoringMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "tiebreak_metric", length = 20, nullable = false)
    private TiebreakMetric tiebreakMetric;

    @Column(name = "points_per_correct_pick", nullable = false)
    private double pointsPerCorrectPick;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_direction", length = 10, nullable = false)
    private ScoringDirection scoringDirection;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private DraftStatus status;

    @Column(name = "current_overall_pick", nullable = false)
    private int currentOverallPick;

    @Column(name = "current_picker_id")
    private String currentPickerId;

    @Column(name = "turn_started_at")
    private Instant turnStartedAt;

    // versão do compare-and-swap (não é @Version: o update condicional é feito à mão)
    @Column(name = "state_version", nullable = false)
    private long stateVersion;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "paused_at")
    private Instant pausedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null)
            createdAt = now;
        if (updatedAt == null)
            updatedAt = now;
        if (status == null)
            status = DraftStatus.PENDING;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}

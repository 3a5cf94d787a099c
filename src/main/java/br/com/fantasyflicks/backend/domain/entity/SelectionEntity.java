package br.com.fantasyflicks.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "draft_selections", uniqueConstraints = @UniqueConstraint(name = "uk_selection_session_pick", columnNames = {
        "session_id", "overall_pick_number" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SelectionEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "overall_pick_number", nullable = false)
    private int overallPickNumber;

    @Column(name = "round_number", nullable = false)
    private int roundNumber;

    @Column(name = "position_in_round", nullable = false)
    private int positionInRound;

    @Column(name = "picker_id", nullable = false)
    private String pickerId;

    // null em auto-pick SKIP
    @Column(name = "item_id")
    private String itemId;

    @Column(name = "committed_at", nullable = false)
    private Instant committedAt;

    @Column(name = "auto_selected", nullable = false)
    private boolean autoSelected;
}

package br.com.fantasyflicks.backend.dto.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * ✅ Evento de pick confirmado
 * 
 * CANAL REDIS:
 * - draft:pick_committed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickCommittedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private String eventType = "pick_committed";

    private Instant timestamp;

    private Long sessionId;

    private int overallPickNumber;

    private String pickerId;

    /**
     * Item escolhido (null quando o auto-pick pulou a vez)
     */
    private String itemId;

    private boolean autoSelected;

    /**
     * Versão da sessão depois do pick
     */
    private long version;
}

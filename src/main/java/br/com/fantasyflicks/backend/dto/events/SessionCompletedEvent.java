package br.com.fantasyflicks.backend.dto.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * ✅ Evento de draft concluído
 * 
 * CANAL REDIS:
 * - draft:session_completed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCompletedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private String eventType = "session_completed";

    private Instant timestamp;

    private Long sessionId;

    private int totalPicks;
}

package br.com.fantasyflicks.backend.dto.events;

import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Evento de mudança de status (agendado, iniciado, pausado, retomado).
 * 
 * CANAL REDIS:
 * - draft:status_changed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftStatusEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private String eventType = "status_changed";

    private Instant timestamp;

    private Long sessionId;

    private DraftStatus status;

    private long version;
}

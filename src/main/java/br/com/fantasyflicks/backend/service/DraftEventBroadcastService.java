package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.dto.events.DraftStatusEvent;
import br.com.fantasyflicks.backend.dto.events.PickCommittedEvent;
import br.com.fantasyflicks.backend.dto.events.SessionCompletedEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * ✅ Publicação dos eventos do draft via Redis Pub/Sub
 * 
 * Falha ao publicar nunca desfaz o pick: o estado já foi gravado e os
 * clientes podem recarregar a sessão.
 * 
 * CANAIS:
 * - draft:pick_committed - Pick confirmado (manual ou auto-pick)
 * - draft:session_completed - Último pick feito
 * - draft:status_changed - Agendado, iniciado, pausado ou retomado
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftEventBroadcastService {

    public static final String CHANNEL_PICK_COMMITTED = "draft:pick_committed";
    public static final String CHANNEL_SESSION_COMPLETED = "draft:session_completed";
    public static final String CHANNEL_STATUS_CHANGED = "draft:status_changed";

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void publishPickCommitted(Selection selection, DraftSession session) {
        PickCommittedEvent event = PickCommittedEvent.builder()
                .timestamp(clock.instant())
                .sessionId(selection.sessionId())
                .overallPickNumber(selection.overallPickNumber())
                .pickerId(selection.pickerId())
                .itemId(selection.itemId())
                .autoSelected(selection.autoSelected())
                .version(session.getVersion())
                .build();

        if (publish(CHANNEL_PICK_COMMITTED, event)) {
            log.info("📢 [Pub/Sub] pick_committed publicado: sessão {} pick {} ({})",
                    selection.sessionId(), selection.overallPickNumber(), selection.pickerId());
        }
    }

    public void publishSessionCompleted(DraftSession session) {
        SessionCompletedEvent event = SessionCompletedEvent.builder()
                .timestamp(clock.instant())
                .sessionId(session.getId())
                .totalPicks(session.getConfiguration().totalPicks())
                .build();

        if (publish(CHANNEL_SESSION_COMPLETED, event)) {
            log.info("📢 [Pub/Sub] session_completed publicado: sessão {}", session.getId());
        }
    }

    public void publishStatusChanged(DraftSession session) {
        DraftStatusEvent event = DraftStatusEvent.builder()
                .timestamp(clock.instant())
                .sessionId(session.getId())
                .status(session.getStatus())
                .version(session.getVersion())
                .build();

        if (publish(CHANNEL_STATUS_CHANGED, event)) {
            log.info("📢 [Pub/Sub] status_changed publicado: sessão {} → {}", session.getId(), session.getStatus());
        }
    }

    private boolean publish(String channel, Object event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            redisTemplate.convertAndSend(channel, json);
            return true;
        } catch (JsonProcessingException e) {
            log.error("❌ [Pub/Sub] Erro ao serializar evento para {}", channel, e);
        } catch (Exception e) {
            log.error("❌ [Pub/Sub] Erro ao publicar em {}", channel, e);
        }
        return false;
    }
}

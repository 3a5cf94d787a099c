package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.support.DraftFixtures;
import br.com.fantasyflicks.backend.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;

import static br.com.fantasyflicks.backend.support.DraftFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DraftEventBroadcastServiceTest {

    private RedisTemplate<String, Object> redisTemplate;
    private ObjectMapper objectMapper;
    private DraftEventBroadcastService broadcastService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setup() {
        redisTemplate = mock(RedisTemplate.class);
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        broadcastService = new DraftEventBroadcastService(redisTemplate, objectMapper, new MutableClock(T0));
    }

    @Test
    void pickCommittedIsPublishedAsJson() throws Exception {
        DraftSession session = DraftFixtures.inProgress(3L, DraftFixtures.config("A", "B").build(), "B", 2, 6, T0);
        Selection selection = new Selection(3L, 1, 1, 1, "A", "X", T0, true);

        broadcastService.publishPickCommitted(selection, session);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(redisTemplate).convertAndSend(eq(DraftEventBroadcastService.CHANNEL_PICK_COMMITTED), payload.capture());
        var json = objectMapper.readTree((String) payload.getValue());
        assertThat(json.get("eventType").asText()).isEqualTo("pick_committed");
        assertThat(json.get("sessionId").asLong()).isEqualTo(3L);
        assertThat(json.get("itemId").asText()).isEqualTo("X");
        assertThat(json.get("autoSelected").asBoolean()).isTrue();
        assertThat(json.get("version").asLong()).isEqualTo(6L);
    }

    @Test
    void completionAndStatusUseTheirOwnChannels() {
        DraftSession completed = DraftFixtures.inProgress(3L, DraftFixtures.config("A", "B").build(), null, 5, 9, null)
                .toBuilder().status(DraftStatus.COMPLETED).build();

        broadcastService.publishSessionCompleted(completed);
        broadcastService.publishStatusChanged(completed);

        verify(redisTemplate).convertAndSend(eq(DraftEventBroadcastService.CHANNEL_SESSION_COMPLETED), anyString());
        verify(redisTemplate).convertAndSend(eq(DraftEventBroadcastService.CHANNEL_STATUS_CHANGED), anyString());
    }

    @Test
    void redisFailureIsLoggedNotThrown() {
        doThrow(new RedisConnectionFailureException("down")).when(redisTemplate).convertAndSend(anyString(), any());
        DraftSession session = DraftFixtures.inProgress(3L, DraftFixtures.config("A", "B").build(), "A", 1, 1, T0);

        assertThatCode(() -> broadcastService.publishStatusChanged(session)).doesNotThrowAnyException();
    }
}

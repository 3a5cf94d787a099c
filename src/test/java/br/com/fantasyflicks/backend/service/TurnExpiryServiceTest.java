package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.service.catalog.ItemCatalog;
import br.com.fantasyflicks.backend.service.lock.DraftTimerLockService;
import br.com.fantasyflicks.backend.service.store.InMemoryDraftSessionStore;
import br.com.fantasyflicks.backend.support.DraftFixtures;
import br.com.fantasyflicks.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static br.com.fantasyflicks.backend.support.DraftFixtures.POOL;
import static br.com.fantasyflicks.backend.support.DraftFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class TurnExpiryServiceTest {

    private MutableClock clock;
    private InMemoryDraftSessionStore store;
    private DraftTimerLockService timerLockService;
    private TurnExpiryService expiryService;
    private DraftSession session;

    @BeforeEach
    void setup() {
        clock = new MutableClock(T0);
        store = new InMemoryDraftSessionStore();
        timerLockService = mock(DraftTimerLockService.class);
        ItemCatalog itemCatalog = mock(ItemCatalog.class);
        DraftEventBroadcastService broadcastService = mock(DraftEventBroadcastService.class);

        when(itemCatalog.snapshot(POOL)).thenReturn(DraftFixtures.openPool("X", "Y", "Z", "W"));
        when(timerLockService.claimExpiry(anyLong(), anyLong())).thenReturn(true);

        TurnSequencer sequencer = new TurnSequencer();
        TurnTimer timer = new TurnTimer(clock);
        PickCommitEngine engine = new PickCommitEngine(store, sequencer,
                new DraftSessionStateMachine(sequencer, clock), itemCatalog, new AutoPickSelector(),
                broadcastService, clock);
        expiryService = new TurnExpiryService(store, timer, engine, timerLockService);

        DraftConfiguration config = DraftFixtures.config("P1", "P2").turnBudgetSeconds(30).build();
        session = store.create(DraftFixtures.inProgress(null, config, "P1", 1, 3, T0));
    }

    @Test
    void expiredTurnProducesExactlyOneAutoSelection() {
        clock.advanceSeconds(31);

        int expired = expiryService.expireOverdueTurns();

        assertThat(expired).isEqualTo(1);
        List<Selection> selections = store.selections(session.getId());
        assertThat(selections).hasSize(1);
        assertThat(selections.get(0).autoSelected()).isTrue();
        assertThat(selections.get(0).pickerId()).isEqualTo("P1");

        DraftSession after = store.find(session.getId()).orElseThrow();
        assertThat(after.getCurrentOverallPick()).isEqualTo(2);
        assertThat(after.getVersion()).isEqualTo(4);
        assertThat(after.getTurnStartedAt()).isEqualTo(T0.plusSeconds(31));
        verify(timerLockService, never()).releaseExpiry(anyLong(), anyLong());

        // segunda varredura no mesmo instante: turno novo ainda não venceu
        assertThat(expiryService.expireOverdueTurns()).isZero();
        assertThat(store.selections(session.getId())).hasSize(1);
    }

    @Test
    void duplicateObservationOfSameTurnIsNoOp() {
        clock.advanceSeconds(30);

        CommitResult first = expiryService.expireTurn(session.getId(), 3);
        clock.advanceSeconds(30);
        CommitResult second = expiryService.expireTurn(session.getId(), 3);

        assertThat(first.success()).isTrue();
        assertThat(second.error()).isEqualTo(CommitError.STALE_TURN);
        assertThat(store.selections(session.getId())).hasSize(1);
    }

    @Test
    void expiryBeforeBudgetIsRejected() {
        clock.advanceSeconds(29);

        CommitResult result = expiryService.expireTurn(session.getId(), 3);

        assertThat(result.error()).isEqualTo(CommitError.TIMER_NOT_EXPIRED);
        assertThat(store.selections(session.getId())).isEmpty();
        verifyNoInteractions(timerLockService);
    }

    @Test
    void claimHeldByAnotherInstanceSkipsAutoSelection() {
        when(timerLockService.claimExpiry(session.getId(), 3)).thenReturn(false);
        clock.advanceSeconds(45);

        CommitResult result = expiryService.expireTurn(session.getId(), 3);

        assertThat(result.success()).isFalse();
        assertThat(store.selections(session.getId())).isEmpty();
    }

    @Test
    void untimedDraftsNeverExpire() {
        DraftConfiguration untimed = DraftFixtures.config("A", "B").turnBudgetSeconds(0).build();
        DraftSession other = store.create(DraftFixtures.inProgress(null, untimed, "A", 1, 1, null));
        clock.advanceSeconds(10_000);

        expiryService.expireOverdueTurns();

        assertThat(store.selections(other.getId())).isEmpty();
        assertThat(expiryService.expireTurn(other.getId(), 1).error()).isEqualTo(CommitError.TIMER_NOT_EXPIRED);
    }

    @Test
    void failedAutoSelectionReleasesClaim() {
        PickCommitEngine racingEngine = mock(PickCommitEngine.class);
        when(racingEngine.autoSelect(session.getId(), 3)).thenReturn(CommitResult.rejected(CommitError.STALE_TURN));
        TurnExpiryService racing = new TurnExpiryService(store, new TurnTimer(clock), racingEngine, timerLockService);
        clock.advanceSeconds(31);

        CommitResult result = racing.expireTurn(session.getId(), 3);

        assertThat(result.error()).isEqualTo(CommitError.STALE_TURN);
        verify(timerLockService).releaseExpiry(session.getId(), 3);
    }
}

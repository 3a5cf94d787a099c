package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.config.properties.DraftProperties;
import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftDiscipline;
import br.com.fantasyflicks.backend.domain.model.DraftOrderType;
import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.EligibilityMode;
import br.com.fantasyflicks.backend.domain.model.FallbackPolicy;
import br.com.fantasyflicks.backend.domain.model.StandingEntry;
import br.com.fantasyflicks.backend.dto.CreateDraftRequest;
import br.com.fantasyflicks.backend.dto.DraftSessionDTO;
import br.com.fantasyflicks.backend.exception.AlreadyStartedException;
import br.com.fantasyflicks.backend.exception.DraftNotFoundException;
import br.com.fantasyflicks.backend.exception.InvalidDraftConfigurationException;
import br.com.fantasyflicks.backend.exception.InvalidDraftTransitionException;
import br.com.fantasyflicks.backend.exception.NotCommissionerException;
import br.com.fantasyflicks.backend.mapper.DraftMapper;
import br.com.fantasyflicks.backend.service.catalog.CatalogSnapshot;
import br.com.fantasyflicks.backend.service.catalog.ItemCatalog;
import br.com.fantasyflicks.backend.service.store.InMemoryDraftSessionStore;
import br.com.fantasyflicks.backend.support.DraftFixtures;
import br.com.fantasyflicks.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static br.com.fantasyflicks.backend.support.DraftFixtures.POOL;
import static br.com.fantasyflicks.backend.support.DraftFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DraftSessionServiceTest {

    private MutableClock clock;
    private InMemoryDraftSessionStore store;
    private ItemCatalog itemCatalog;
    private DraftEventBroadcastService broadcastService;
    private DraftProperties properties;
    private PickCommitEngine engine;
    private DraftSessionService service;

    @BeforeEach
    void setup() {
        clock = new MutableClock(T0);
        store = new InMemoryDraftSessionStore();
        itemCatalog = mock(ItemCatalog.class);
        broadcastService = mock(DraftEventBroadcastService.class);
        properties = new DraftProperties();

        when(itemCatalog.snapshot(POOL)).thenReturn(DraftFixtures.openPool("m1", "m2", "m3", "m4", "m5", "m6"));

        TurnSequencer sequencer = new TurnSequencer();
        DraftSessionStateMachine stateMachine = new DraftSessionStateMachine(sequencer, clock);
        service = new DraftSessionService(store, stateMachine, sequencer, new TurnTimer(clock),
                new StandingsAggregator(), itemCatalog, broadcastService, DraftMapper.INSTANCE, properties, clock);
        engine = new PickCommitEngine(store, sequencer, stateMachine, itemCatalog, new AutoPickSelector(),
                broadcastService, clock);
    }

    private CreateDraftRequest.CreateDraftRequestBuilder request(String... participants) {
        return CreateDraftRequest.builder()
                .poolId(POOL)
                .participants(List.of(participants))
                .roundsTotal(2);
    }

    @Test
    void createAppliesDefaultsAndMakesCallerCommissioner() {
        DraftSession created = service.createDraft(request("A", "B", "C").build(), "A");

        assertThat(created.getId()).isNotNull();
        assertThat(created.getStatus()).isEqualTo(DraftStatus.PENDING);
        assertThat(created.getVersion()).isZero();
        assertThat(created.isCommissioner("A")).isTrue();
        assertThat(created.getConfiguration().getOrder()).containsExactly("A", "B", "C");
        assertThat(created.getConfiguration().getDiscipline()).isEqualTo(DraftDiscipline.SERPENTINE);
        assertThat(created.getConfiguration().getTurnBudgetSeconds()).isEqualTo(120);
        assertThat(created.getConfiguration().getFallbackPolicy()).isEqualTo(FallbackPolicy.HIGHEST_RANKED);
        assertThat(created.getConfiguration().isSharedOwnership()).isFalse();
    }

    @Test
    void categoryDraftsShareOwnershipByDefault() {
        Map<String, List<String>> pool = new LinkedHashMap<>();
        pool.put("picture", List.of("p1", "p2"));
        pool.put("director", List.of("d1", "d2"));
        CatalogSnapshot oscars = DraftFixtures.categoryPool(pool);
        when(itemCatalog.snapshot(POOL)).thenReturn(oscars);

        DraftSession created = service.createDraft(request("A", "B")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .categoryStyle(CategoryStyle.CATEGORY_ROUNDS)
                .build(), "A");

        assertThat(created.getConfiguration().isSharedOwnership()).isTrue();
    }

    @Test
    void randomOrderKeepsSameParticipants() {
        DraftSession created = service.createDraft(request("A", "B", "C")
                .orderType(DraftOrderType.RANDOM)
                .roundsTotal(1)
                .build(), "A");

        assertThat(created.getConfiguration().getOrder()).containsExactlyInAnyOrder("A", "B", "C");
    }

    @Test
    void createRejectsInvalidConfigurations() {
        assertThatThrownBy(() -> service.createDraft(request("A", "A").build(), "A"))
                .isInstanceOf(InvalidDraftConfigurationException.class);
        assertThatThrownBy(() -> service.createDraft(request("A", "B").roundsTotal(0).build(), "A"))
                .isInstanceOf(InvalidDraftConfigurationException.class);
        // 4 participantes × 2 rodadas > 6 itens
        assertThatThrownBy(() -> service.createDraft(request("A", "B", "C", "D").build(), "A"))
                .isInstanceOf(InvalidDraftConfigurationException.class)
                .hasMessageContaining("8 picks");
    }

    @Test
    void onlyCommissionerControlsLifecycle() {
        DraftSession created = service.createDraft(request("A", "B").build(), "A");

        assertThatThrownBy(() -> service.startSession(created.getId(), "B"))
                .isInstanceOf(NotCommissionerException.class);

        DraftSession started = service.startSession(created.getId(), "A");
        assertThat(started.getStatus()).isEqualTo(DraftStatus.IN_PROGRESS);
        assertThat(started.getCurrentPickerId()).isEqualTo("A");
        assertThat(started.getVersion()).isEqualTo(1);
        verify(broadcastService).publishStatusChanged(started);

        assertThatThrownBy(() -> service.startSession(created.getId(), "A"))
                .isInstanceOf(AlreadyStartedException.class);
    }

    @Test
    void pauseBlocksPicksUntilResume() {
        DraftSession created = service.createDraft(request("A", "B").build(), "A");
        service.startSession(created.getId(), "A");

        DraftSession paused = service.pauseSession(created.getId(), "A");
        assertThat(engine.commit(created.getId(), "A", "m1", paused.getVersion()).error())
                .isEqualTo(CommitError.SESSION_NOT_ACTIVE);

        DraftSession resumed = service.resumeSession(created.getId(), "A");
        assertThat(engine.commit(created.getId(), "A", "m1", resumed.getVersion()).success()).isTrue();
    }

    @Test
    void scheduleRejectsStaleExpectedVersion() {
        DraftSession created = service.createDraft(request("A", "B").build(), "A");

        assertThatThrownBy(() -> service.scheduleSession(created.getId(), T0.plusSeconds(60), "A", 5L))
                .isInstanceOf(InvalidDraftTransitionException.class);

        DraftSession scheduled = service.scheduleSession(created.getId(), T0.plusSeconds(60), "A", 0L);
        assertThat(scheduled.getStatus()).isEqualTo(DraftStatus.SCHEDULED);
        assertThat(scheduled.getScheduledAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void startDueSessionsOnlyStartsSessionsWhoseTimeHasCome() {
        DraftSession soon = service.createDraft(request("A", "B").build(), "A");
        DraftSession later = service.createDraft(request("A", "B").build(), "A");
        service.scheduleSession(soon.getId(), T0.plusSeconds(60), "A", null);
        service.scheduleSession(later.getId(), T0.plusSeconds(3600), "A", null);

        clock.advanceSeconds(61);
        int started = service.startDueSessions();

        assertThat(started).isEqualTo(1);
        assertThat(service.getSession(soon.getId()).getStatus()).isEqualTo(DraftStatus.IN_PROGRESS);
        assertThat(service.getSession(later.getId()).getStatus()).isEqualTo(DraftStatus.SCHEDULED);
    }

    @Test
    void selectableItemsAndStandingsFollowCommittedPicks() {
        when(itemCatalog.snapshot(POOL)).thenReturn(new CatalogSnapshot(POOL,
                List.of("m1", "m2", "m3", "m4"),
                Map.of("m1", "", "m2", "", "m3", "", "m4", ""),
                List.of(),
                Map.of("m1", 10.0, "m2", 30.0, "m3", 5.0, "m4", 1.0),
                Set.of()));
        DraftSession created = service.createDraft(request("A", "B").build(), "A");
        DraftSession started = service.startSession(created.getId(), "A");

        engine.commit(created.getId(), "A", "m1", started.getVersion());

        assertThat(service.selectableItems(created.getId(), null)).containsExactly("m2", "m3", "m4");
        List<StandingEntry> standings = service.standings(created.getId());
        assertThat(standings).extracting(StandingEntry::participantId).containsExactly("A", "B");
        assertThat(standings.get(0).primaryScore()).isEqualTo(10.0);
    }

    @Test
    void dtoCarriesTimerAndRound() {
        DraftSession created = service.createDraft(request("A", "B").turnBudgetSeconds(30).build(), "A");
        DraftSession started = service.startSession(created.getId(), "A");
        clock.advanceSeconds(12);

        DraftSessionDTO dto = service.toDTO(started);

        assertThat(dto.getRemainingSeconds()).isEqualTo(18L);
        assertThat(dto.getTimerState()).isEqualTo(TimerState.RUNNING);
        assertThat(dto.getCurrentRound()).isEqualTo(1);
        assertThat(dto.getTotalPicks()).isEqualTo(4);
        assertThat(dto.getOrder()).containsExactly("A", "B");
    }

    @Test
    void unknownSessionRaisesNotFound() {
        assertThatThrownBy(() -> service.getSession(404L)).isInstanceOf(DraftNotFoundException.class);
        verify(broadcastService, never()).publishStatusChanged(any());
    }
}

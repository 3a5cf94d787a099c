package br.com.fantasyflicks.backend.service.store;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.Selection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store em memória (um único nó). O compare-and-swap usa
 * {@link ConcurrentMap#compute}, que é atômico por chave.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.draft.store", havingValue = "memory")
public class InMemoryDraftSessionStore implements DraftSessionStore {

    private final ConcurrentMap<Long, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public DraftSession create(DraftSession session) {
        long id = idSequence.incrementAndGet();
        DraftSession stored = session.toBuilder().id(id).build();
        sessions.put(id, new SessionRecord(stored, List.of()));
        log.info("✅ [InMemoryStore] Sessão {} criada", id);
        return stored;
    }

    @Override
    public Optional<DraftSession> find(Long sessionId) {
        SessionRecord record = sessionId == null ? null : sessions.get(sessionId);
        return Optional.ofNullable(record).map(SessionRecord::session);
    }

    @Override
    public List<Selection> selections(Long sessionId) {
        SessionRecord record = sessionId == null ? null : sessions.get(sessionId);
        return record == null ? List.of() : record.selections();
    }

    @Override
    public List<DraftSession> findByStatus(DraftStatus status) {
        List<DraftSession> result = new ArrayList<>();
        for (SessionRecord record : sessions.values()) {
            if (record.session().getStatus() == status) {
                result.add(record.session());
            }
        }
        return result;
    }

    @Override
    public boolean compareAndSet(DraftSession next, long expectedVersion, Selection appended) {
        AtomicBoolean swapped = new AtomicBoolean(false);

        sessions.computeIfPresent(next.getId(), (id, current) -> {
            if (current.session().getVersion() != expectedVersion) {
                return current;
            }
            if (appended != null && appended.overallPickNumber() != current.selections().size() + 1) {
                log.warn("⚠️ [InMemoryStore] Pick {} fora de sequência na sessão {} (já existem {})",
                        appended.overallPickNumber(), id, current.selections().size());
                return current;
            }
            swapped.set(true);
            return current.with(next, appended);
        });

        return swapped.get();
    }

    private record SessionRecord(DraftSession session, List<Selection> selections) {

        SessionRecord with(DraftSession next, Selection appended) {
            if (appended == null) {
                return new SessionRecord(next, selections);
            }
            List<Selection> updated = new ArrayList<>(selections.size() + 1);
            updated.addAll(selections);
            updated.add(appended);
            return new SessionRecord(next, List.copyOf(updated));
        }
    }
}

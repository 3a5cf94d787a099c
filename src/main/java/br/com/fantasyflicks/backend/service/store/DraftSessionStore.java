package br.com.fantasyflicks.backend.service.store;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.DraftStatus;
import br.com.fantasyflicks.backend.domain.model.Selection;

import java.util.List;
import java.util.Optional;

/**
 * Armazenamento das sessões de draft, chaveado por id.
 * 
 * Toda escrita depois da criação passa por {@link #compareAndSet}: a sessão
 * nova só é gravada se a versão armazenada ainda for a esperada, e o pick
 * (quando houver) entra na mesma escrita atômica.
 */
public interface DraftSessionStore {

    /**
     * Grava uma sessão nova e devolve o snapshot com o id atribuído.
     */
    DraftSession create(DraftSession session);

    Optional<DraftSession> find(Long sessionId);

    /**
     * Picks da sessão em ordem de pick geral.
     */
    List<Selection> selections(Long sessionId);

    List<DraftSession> findByStatus(DraftStatus status);

    /**
     * Substitui a sessão se a versão armazenada for {@code expectedVersion}.
     *
     * @param next            snapshot novo (normalmente {@code expectedVersion + 1})
     * @param expectedVersion versão que o chamador leu
     * @param appended        pick a anexar na mesma escrita, ou null
     * @return true se esta escrita venceu
     */
    boolean compareAndSet(DraftSession next, long expectedVersion, Selection appended);
}

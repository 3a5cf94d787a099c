package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.service.eligibility.IneligibilityReason;

/**
 * Resultado de uma tentativa de pick: sucesso com o pick e a sessão nova, ou
 * o erro tipado (com o motivo quando for NOT_ELIGIBLE).
 */
public record CommitResult(
        boolean success,
        Selection selection,
        DraftSession session,
        CommitError error,
        IneligibilityReason reason) {

    public static CommitResult accepted(Selection selection, DraftSession session) {
        return new CommitResult(true, selection, session, null, null);
    }

    public static CommitResult rejected(CommitError error) {
        return new CommitResult(false, null, null, error, null);
    }

    public static CommitResult notEligible(IneligibilityReason reason) {
        return new CommitResult(false, null, null, CommitError.NOT_ELIGIBLE, reason);
    }

    public boolean isRetryable() {
        return error != null && error.isRetryable();
    }
}

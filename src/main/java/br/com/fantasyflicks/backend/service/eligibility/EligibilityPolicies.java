package br.com.fantasyflicks.backend.service.eligibility;

import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;

/**
 * Escolhe a política de elegibilidade a partir da configuração do draft.
 */
public final class EligibilityPolicies {

    private static final EligibilityPolicy OPEN_POOL = new OpenPoolPolicy();
    private static final EligibilityPolicy ANY_CATEGORY = new AnyCategoryPolicy();
    private static final EligibilityPolicy CATEGORY_ROUNDS = new CategoryRoundsPolicy();

    private EligibilityPolicies() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static EligibilityPolicy forConfiguration(DraftConfiguration configuration) {
        switch (configuration.getEligibilityMode()) {
            case OPEN_POOL:
                return OPEN_POOL;
            case CATEGORY_CONSTRAINED:
                return configuration.getCategoryStyle() == CategoryStyle.CATEGORY_ROUNDS
                        ? CATEGORY_ROUNDS
                        : ANY_CATEGORY;
            default:
                throw new IllegalArgumentException("Modo de elegibilidade desconhecido: "
                        + configuration.getEligibilityMode());
        }
    }
}

package br.com.fantasyflicks.backend.service.eligibility;

import java.util.Optional;

/**
 * Pool aberto: qualquer item do catálogo que ainda não tenha dono.
 */
public class OpenPoolPolicy implements EligibilityPolicy {

    @Override
    public Optional<IneligibilityReason> check(EligibilityContext context, String itemId) {
        if (!context.getCatalog().contains(itemId)) {
            return Optional.of(IneligibilityReason.UNKNOWN_ITEM);
        }
        return checkOwnership(context, itemId);
    }
}

package br.com.fantasyflicks.backend.service.eligibility;

import java.util.Optional;

/**
 * Modo categoria livre: o participante escolhe em qualquer categoria que
 * ainda não preencheu (a não ser que a liga permita repetir).
 */
public class AnyCategoryPolicy implements EligibilityPolicy {

    @Override
    public Optional<IneligibilityReason> check(EligibilityContext context, String itemId) {
        String category = context.getCatalog().categoryOf(itemId);
        if (category == null) {
            return Optional.of(IneligibilityReason.UNKNOWN_ITEM);
        }

        Optional<IneligibilityReason> ownership = checkOwnership(context, itemId);
        if (ownership.isPresent()) {
            return ownership;
        }

        if (!context.getConfiguration().isAllowDuplicatePicks() && context.hasFilledCategory(category)) {
            return Optional.of(IneligibilityReason.CATEGORY_ALREADY_FILLED);
        }
        return Optional.empty();
    }
}

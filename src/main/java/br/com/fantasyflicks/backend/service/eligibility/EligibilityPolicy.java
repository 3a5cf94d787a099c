package br.com.fantasyflicks.backend.service.eligibility;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Regra de elegibilidade de um modo de draft.
 */
public interface EligibilityPolicy {

    /**
     * @return vazio se o item pode ser escolhido, senão o motivo da recusa
     */
    Optional<IneligibilityReason> check(EligibilityContext context, String itemId);

    /**
     * Itens elegíveis agora, na ordem de ranking do catálogo.
     */
    default Set<String> selectableItems(EligibilityContext context) {
        Set<String> selectable = new LinkedHashSet<>();
        for (String itemId : context.getCatalog().itemsInPool()) {
            if (check(context, itemId).isEmpty()) {
                selectable.add(itemId);
            }
        }
        return selectable;
    }

    /**
     * Posse do item: com posse compartilhada nenhum pick bloqueia o item.
     */
    default Optional<IneligibilityReason> checkOwnership(EligibilityContext context, String itemId) {
        if (!context.getConfiguration().isSharedOwnership() && context.isOwnedByAnyone(itemId)) {
            return Optional.of(IneligibilityReason.ALREADY_OWNED);
        }
        return Optional.empty();
    }
}

package br.com.fantasyflicks.backend.service.eligibility;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Modo categoria por rodada: a rodada R libera só a categoria
 * {@code categories[min(R - 1, size - 1)]}. Rodadas além do número de
 * categorias ficam na última.
 */
public class CategoryRoundsPolicy implements EligibilityPolicy {

    @Override
    public Optional<IneligibilityReason> check(EligibilityContext context, String itemId) {
        String category = context.getCatalog().categoryOf(itemId);
        if (category == null) {
            return Optional.of(IneligibilityReason.UNKNOWN_ITEM);
        }
        if (!category.equals(activeCategory(context))) {
            return Optional.of(IneligibilityReason.WRONG_CATEGORY_FOR_ROUND);
        }
        return checkOwnership(context, itemId);
    }

    @Override
    public Set<String> selectableItems(EligibilityContext context) {
        Set<String> selectable = new LinkedHashSet<>();
        for (String itemId : context.getCatalog().itemsInCategory(activeCategory(context))) {
            if (checkOwnership(context, itemId).isEmpty()) {
                selectable.add(itemId);
            }
        }
        return selectable;
    }

    /**
     * Categoria liberada na rodada do contexto, ou null se o catálogo não tem categorias.
     */
    public String activeCategory(EligibilityContext context) {
        List<String> categories = context.getCatalog().categories();
        if (categories.isEmpty()) {
            return null;
        }
        int index = Math.min(Math.max(context.getRoundNumber(), 1) - 1, categories.size() - 1);
        return categories.get(index);
    }
}

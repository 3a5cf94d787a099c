package br.com.fantasyflicks.backend.service.eligibility;

import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.service.catalog.CatalogSnapshot;
import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tudo que uma política precisa para decidir: configuração, catálogo,
 * picks já feitos, quem está escolhendo e em qual rodada.
 * 
 * Os conjuntos derivados são calculados uma vez na construção.
 */
@Getter
public class EligibilityContext {

    private final DraftConfiguration configuration;
    private final CatalogSnapshot catalog;
    private final List<Selection> selections;
    private final String participantId;
    private final int roundNumber;

    private final Set<String> ownedItems = new HashSet<>();
    private final Set<String> filledCategories = new HashSet<>();

    public EligibilityContext(DraftConfiguration configuration, CatalogSnapshot catalog,
            List<Selection> selections, String participantId, int roundNumber) {
        this.configuration = configuration;
        this.catalog = catalog;
        this.selections = List.copyOf(selections);
        this.participantId = participantId;
        this.roundNumber = roundNumber;

        for (Selection selection : this.selections) {
            if (selection.isSkip()) {
                continue;
            }
            ownedItems.add(selection.itemId());
            if (selection.pickerId().equals(participantId)) {
                String category = catalog.categoryOf(selection.itemId());
                if (category != null) {
                    filledCategories.add(category);
                }
            }
        }
    }

    public boolean isOwnedByAnyone(String itemId) {
        return ownedItems.contains(itemId);
    }

    public boolean hasFilledCategory(String categoryId) {
        return filledCategories.contains(categoryId);
    }
}

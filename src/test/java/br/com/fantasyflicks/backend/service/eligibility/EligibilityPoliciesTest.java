package br.com.fantasyflicks.backend.service.eligibility;

import br.com.fantasyflicks.backend.domain.model.CategoryStyle;
import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.EligibilityMode;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.service.catalog.CatalogSnapshot;
import br.com.fantasyflicks.backend.support.DraftFixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EligibilityPoliciesTest {

    private static final Long SESSION = 1L;

    @Test
    void forConfigurationPicksVariantByModeAndStyle() {
        DraftConfiguration open = DraftFixtures.config("A", "B").build();
        DraftConfiguration any = open.toBuilder().eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED).build();
        DraftConfiguration rounds = any.toBuilder().categoryStyle(CategoryStyle.CATEGORY_ROUNDS).build();

        assertThat(EligibilityPolicies.forConfiguration(open)).isInstanceOf(OpenPoolPolicy.class);
        assertThat(EligibilityPolicies.forConfiguration(any)).isInstanceOf(AnyCategoryPolicy.class);
        assertThat(EligibilityPolicies.forConfiguration(rounds)).isInstanceOf(CategoryRoundsPolicy.class);
    }

    @Test
    void openPoolRejectsItemAlreadyOwnedByAnotherParticipant() {
        DraftConfiguration config = DraftFixtures.config("P1", "P2", "P3", "P4").build();
        CatalogSnapshot catalog = DraftFixtures.openPool("X", "Y", "Z", "W", "V", "U", "T", "S");
        List<Selection> selections = List.of(
                DraftFixtures.selection(SESSION, 1, "P1", "Y"),
                DraftFixtures.selection(SESSION, 2, "P2", "Z"),
                DraftFixtures.selection(SESSION, 3, "P3", "X"));

        EligibilityContext context = new EligibilityContext(config, catalog, selections, "P4", 1);
        EligibilityPolicy policy = new OpenPoolPolicy();

        assertThat(policy.check(context, "X")).contains(IneligibilityReason.ALREADY_OWNED);
        assertThat(policy.check(context, "W")).isEmpty();
        assertThat(policy.selectableItems(context)).containsExactly("W", "V", "U", "T", "S");
    }

    @Test
    void openPoolRejectsUnknownAndNullItems() {
        DraftConfiguration config = DraftFixtures.config("A", "B").build();
        EligibilityContext context = new EligibilityContext(config, DraftFixtures.openPool("X"), List.of(), "A", 1);
        EligibilityPolicy policy = new OpenPoolPolicy();

        assertThat(policy.check(context, "nope")).contains(IneligibilityReason.UNKNOWN_ITEM);
        assertThat(policy.check(context, null)).contains(IneligibilityReason.UNKNOWN_ITEM);
    }

    @Test
    void openPoolWithSharedOwnershipSubtractsNothing() {
        DraftConfiguration config = DraftFixtures.config("A", "B").sharedOwnership(true).build();
        List<Selection> selections = List.of(DraftFixtures.selection(SESSION, 1, "A", "X"));
        CatalogSnapshot catalog = DraftFixtures.openPool("X", "Y");
        EligibilityPolicy policy = new OpenPoolPolicy();

        EligibilityContext forB = new EligibilityContext(config, catalog, selections, "B", 1);
        EligibilityContext forA = new EligibilityContext(config, catalog, selections, "A", 2);

        assertThat(policy.check(forB, "X")).isEmpty();
        assertThat(policy.check(forA, "X")).isEmpty();
        assertThat(policy.selectableItems(forA)).containsExactly("X", "Y");
    }

    @Test
    void skipSelectionsDoNotOwnAnything() {
        DraftConfiguration config = DraftFixtures.config("A", "B").build();
        List<Selection> selections = List.of(DraftFixtures.selection(SESSION, 1, "A", null));
        EligibilityContext context = new EligibilityContext(config, DraftFixtures.openPool("X", "Y"),
                selections, "B", 1);

        assertThat(new OpenPoolPolicy().selectableItems(context)).containsExactly("X", "Y");
    }

    @Test
    void anyCategoryBlocksFilledCategoryUnlessDuplicatesAllowed() {
        DraftConfiguration config = DraftFixtures.config("A", "B")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .sharedOwnership(true)
                .build();
        CatalogSnapshot catalog = oscarPool(2);
        List<Selection> selections = List.of(DraftFixtures.selection(SESSION, 1, "A", "cat1-n1"));

        EligibilityContext contextA = new EligibilityContext(config, catalog, selections, "A", 1);
        EligibilityPolicy policy = new AnyCategoryPolicy();

        assertThat(policy.check(contextA, "cat1-n2")).contains(IneligibilityReason.CATEGORY_ALREADY_FILLED);
        assertThat(policy.selectableItems(contextA)).containsExactly("cat2-n1", "cat2-n2", "cat2-n3");

        DraftConfiguration duplicates = config.toBuilder().allowDuplicatePicks(true).build();
        EligibilityContext withDuplicates = new EligibilityContext(duplicates, catalog, selections, "A", 1);
        assertThat(policy.check(withDuplicates, "cat1-n2")).isEmpty();
    }

    @Test
    void anyCategoryWithSharedOwnershipLetsOthersPickSameNominee() {
        DraftConfiguration config = DraftFixtures.config("A", "B")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .sharedOwnership(true)
                .build();
        List<Selection> selections = List.of(DraftFixtures.selection(SESSION, 1, "A", "cat1-n1"));

        EligibilityContext contextB = new EligibilityContext(config, oscarPool(2), selections, "B", 1);

        assertThat(new AnyCategoryPolicy().check(contextB, "cat1-n1")).isEmpty();
    }

    @Test
    void categoryRoundsActiveCategoryFollowsRoundForEveryPicker() {
        DraftConfiguration config = DraftFixtures.config("A", "B", "C")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .categoryStyle(CategoryStyle.CATEGORY_ROUNDS)
                .roundsTotal(5)
                .sharedOwnership(true)
                .build();
        CatalogSnapshot catalog = oscarPool(5);
        CategoryRoundsPolicy policy = new CategoryRoundsPolicy();

        for (String picker : List.of("A", "B", "C")) {
            EligibilityContext round3 = new EligibilityContext(config, catalog, List.of(), picker, 3);
            assertThat(policy.activeCategory(round3)).isEqualTo("cat3");
            assertThat(policy.selectableItems(round3)).containsExactly("cat3-n1", "cat3-n2", "cat3-n3");
            assertThat(policy.check(round3, "cat1-n1")).contains(IneligibilityReason.WRONG_CATEGORY_FOR_ROUND);
        }
    }

    @Test
    void categoryRoundsClampsToLastCategory() {
        DraftConfiguration config = DraftFixtures.config("A", "B")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .categoryStyle(CategoryStyle.CATEGORY_ROUNDS)
                .roundsTotal(4)
                .build();
        EligibilityContext round4 = new EligibilityContext(config, oscarPool(2), List.of(), "A", 4);

        assertThat(new CategoryRoundsPolicy().activeCategory(round4)).isEqualTo("cat2");
    }

    @Test
    void categoryRoundsStillRespectsExclusiveOwnership() {
        DraftConfiguration config = DraftFixtures.config("A", "B")
                .eligibilityMode(EligibilityMode.CATEGORY_CONSTRAINED)
                .categoryStyle(CategoryStyle.CATEGORY_ROUNDS)
                .sharedOwnership(false)
                .build();
        List<Selection> selections = List.of(DraftFixtures.selection(SESSION, 1, "A", "cat1-n1"));
        EligibilityContext context = new EligibilityContext(config, oscarPool(2), selections, "B", 1);

        assertThat(new CategoryRoundsPolicy().check(context, "cat1-n1")).contains(IneligibilityReason.ALREADY_OWNED);
    }

    private static CatalogSnapshot oscarPool(int categories) {
        Map<String, List<String>> pool = new LinkedHashMap<>();
        for (int c = 1; c <= categories; c++) {
            String category = "cat" + c;
            pool.put(category, List.of(category + "-n1", category + "-n2", category + "-n3"));
        }
        return DraftFixtures.categoryPool(pool);
    }
}

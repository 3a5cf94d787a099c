package br.com.fantasyflicks.backend.domain.model;

import br.com.fantasyflicks.backend.exception.InvalidDraftConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuração imutável de um draft, congelada quando a sessão é criada.
 */
@Value
@Builder(toBuilder = true)
public class DraftConfiguration {

    String leagueId;
    String commissionerId;
    String poolId;

    /**
     * Ordem dos participantes (posição 1 = índice 0)
     */
    List<String> order;

    @Builder.Default
    DraftDiscipline discipline = DraftDiscipline.SERPENTINE;

    int roundsTotal;

    /**
     * Segundos por pick (0 = sem timer)
     */
    int turnBudgetSeconds;

    @Builder.Default
    EligibilityMode eligibilityMode = EligibilityMode.OPEN_POOL;

    @Builder.Default
    CategoryStyle categoryStyle = CategoryStyle.ANY_CATEGORY;

    /**
     * Participante pode repetir categoria (modo categoria)
     */
    boolean allowDuplicatePicks;

    /**
     * Mais de um participante pode ter o mesmo item
     */
    boolean sharedOwnership;

    @Builder.Default
    FallbackPolicy fallbackPolicy = FallbackPolicy.HIGHEST_RANKED;

    @Builder.Default
    ScoringSettings scoring = ScoringSettings.defaults();

    public int participantCount() {
        return order.size();
    }

    public int totalPicks() {
        return order.size() * roundsTotal;
    }

    public boolean isTimed() {
        return turnBudgetSeconds > 0;
    }

    public boolean isRoundLocked() {
        return eligibilityMode == EligibilityMode.CATEGORY_CONSTRAINED
                && categoryStyle == CategoryStyle.CATEGORY_ROUNDS;
    }

    /**
     * Valida invariantes da configuração.
     *
     * @throws InvalidDraftConfigurationException se ordem vazia, duplicada,
     *                                            com ids mal formatados ou
     *                                            números fora do intervalo
     */
    public void validate() {
        if (order == null || order.isEmpty()) {
            throw new InvalidDraftConfigurationException("A ordem do draft não pode ser vazia");
        }
        Set<String> seen = new HashSet<>();
        for (String participantId : order) {
            if (participantId == null || participantId.isBlank()) {
                throw new InvalidDraftConfigurationException("Participante sem identificador na ordem do draft");
            }
            if (!participantId.equals(participantId.trim())) {
                // o header X-Participant-Id chega sem espaços
                throw new InvalidDraftConfigurationException(
                        "Identificador com espaços nas pontas na ordem do draft: '" + participantId + "'");
            }
            if (!seen.add(participantId)) {
                throw new InvalidDraftConfigurationException(
                        "Participante duplicado na ordem do draft: " + participantId);
            }
        }
        if (roundsTotal < 1) {
            throw new InvalidDraftConfigurationException("roundsTotal deve ser pelo menos 1");
        }
        if (turnBudgetSeconds < 0) {
            throw new InvalidDraftConfigurationException("turnBudgetSeconds não pode ser negativo");
        }
        if (poolId == null || poolId.isBlank()) {
            throw new InvalidDraftConfigurationException("poolId é obrigatório");
        }
        if (discipline == null || eligibilityMode == null || categoryStyle == null
                || fallbackPolicy == null || scoring == null) {
            throw new InvalidDraftConfigurationException("Configuração do draft incompleta");
        }
    }
}

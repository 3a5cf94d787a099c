package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.DraftConfiguration;
import br.com.fantasyflicks.backend.domain.model.DraftDiscipline;
import br.com.fantasyflicks.backend.exception.TurnOutOfRangeException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * ✅ Calcula de quem é a vez a partir do número do pick geral.
 * 
 * Função pura: não guarda estado. O pick geral é 1-indexed e vai até
 * {@code order.size() * roundsTotal}.
 * 
 * Exemplo serpentine com [A, B, C] e 2 rodadas: A B C C B A
 */
@Component
public class TurnSequencer {

    /**
     * Participante que escolhe no pick geral informado.
     *
     * @throws TurnOutOfRangeException se o pick estiver fora de 1..totalPicks
     */
    public String pickerFor(DraftConfiguration config, int overallPick) {
        checkRange(config, overallPick);

        List<String> order = config.getOrder();
        int n = order.size();
        int round = roundOf(config, overallPick);
        int position = positionInRound(config, overallPick);

        if (config.getDiscipline() == DraftDiscipline.SERPENTINE && round % 2 == 0) {
            return order.get(n - position);
        }
        return order.get(position - 1);
    }

    public int roundOf(DraftConfiguration config, int overallPick) {
        checkRange(config, overallPick);
        return (overallPick - 1) / config.participantCount() + 1;
    }

    /**
     * Posição dentro da rodada (1..N), antes de aplicar a inversão serpentine.
     */
    public int positionInRound(DraftConfiguration config, int overallPick) {
        checkRange(config, overallPick);
        return (overallPick - 1) % config.participantCount() + 1;
    }

    public int totalPicks(DraftConfiguration config) {
        return config.totalPicks();
    }

    private void checkRange(DraftConfiguration config, int overallPick) {
        int total = config.totalPicks();
        if (overallPick < 1 || overallPick > total) {
            throw new TurnOutOfRangeException(overallPick, total);
        }
    }
}

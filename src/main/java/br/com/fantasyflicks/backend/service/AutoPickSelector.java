package br.com.fantasyflicks.backend.service;

import br.com.fantasyflicks.backend.domain.model.FallbackPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Escolhe o item do auto-pick quando o turno expira.
 */
@Component
public class AutoPickSelector {

    private final Random random;

    public AutoPickSelector() {
        this(new Random());
    }

    AutoPickSelector(Random random) {
        this.random = random;
    }

    /**
     * @param selectable itens elegíveis na ordem de ranking
     * @return item escolhido, ou vazio para pular a vez
     */
    public Optional<String> choose(FallbackPolicy policy, Set<String> selectable) {
        if (policy == FallbackPolicy.SKIP || selectable.isEmpty()) {
            return Optional.empty();
        }
        if (policy == FallbackPolicy.RANDOM) {
            List<String> candidates = new ArrayList<>(selectable);
            return Optional.of(candidates.get(random.nextInt(candidates.size())));
        }
        return Optional.of(selectable.iterator().next());
    }
}

package br.com.fantasyflicks.backend.config.properties;

import br.com.fantasyflicks.backend.domain.model.FallbackPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "app.draft")
public class DraftProperties {

    /**
     * Tempo por pick quando a criação não informa (0 = sem timer)
     */
    private int defaultTurnBudgetSeconds = 120;

    // lidos também pelos @Scheduled de DraftScheduledTasks
    private long timeoutScanIntervalMs = 1000;

    private long scheduledStartScanIntervalMs = 5000;

    private FallbackPolicy defaultFallbackPolicy = FallbackPolicy.HIGHEST_RANKED;

    /**
     * TTL do claim de expiração no Redis
     */
    private int expiryClaimTtlSeconds = 10;
}

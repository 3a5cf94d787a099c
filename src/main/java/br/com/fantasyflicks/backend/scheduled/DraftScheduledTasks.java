package br.com.fantasyflicks.backend.scheduled;

import br.com.fantasyflicks.backend.service.DraftSessionService;
import br.com.fantasyflicks.backend.service.TurnExpiryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DraftScheduledTasks {

    private final TurnExpiryService turnExpiryService;
    private final DraftSessionService draftSessionService;

    /**
     * Expira turnos vencidos (auto-pick)
     */
    @Scheduled(fixedDelayString = "${app.draft.timeout-scan-interval-ms:1000}")
    public void expireOverdueTurns() {
        try {
            int expired = turnExpiryService.expireOverdueTurns();
            if (expired > 0) {
                log.info("⏰ [Scheduled] {} turno(s) expirado(s)", expired);
            }
        } catch (Exception e) {
            log.error("❌ [Scheduled] Erro ao expirar turnos", e);
        }
    }

    /**
     * Inicia drafts agendados cujo horário chegou
     */
    @Scheduled(fixedDelayString = "${app.draft.scheduled-start-scan-interval-ms:5000}")
    public void startScheduledDrafts() {
        try {
            int started = draftSessionService.startDueSessions();
            if (started > 0) {
                log.info("🚀 [Scheduled] {} draft(s) agendado(s) iniciado(s)", started);
            }
        } catch (Exception e) {
            log.error("❌ [Scheduled] Erro ao iniciar drafts agendados", e);
        }
    }
}

package br.com.fantasyflicks.backend.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot imutável de uma sessão de draft.
 * 
 * Cada mudança aceita gera um novo snapshot com {@code version + 1}; o store
 * só grava o snapshot novo se a versão armazenada ainda for a esperada.
 */
@Value
@Builder(toBuilder = true)
public class DraftSession {

    Long id;
    DraftConfiguration configuration;
    DraftStatus status;

    /**
     * Pick geral atual (1-indexed). Passa de totalPicks quando COMPLETED.
     */
    int currentOverallPick;

    /**
     * Quem escolhe agora; null quando não há turno ativo
     */
    String currentPickerId;

    /**
     * Início do turno atual, sempre do relógio do servidor
     */
    Instant turnStartedAt;

    long version;

    Instant createdAt;
    Instant scheduledAt;
    Instant startedAt;
    Instant pausedAt;
    Instant completedAt;

    public boolean isInProgress() {
        return status == DraftStatus.IN_PROGRESS;
    }

    public boolean isCompleted() {
        return status == DraftStatus.COMPLETED;
    }

    public boolean isCommissioner(String participantId) {
        return participantId != null && participantId.equals(configuration.getCommissionerId());
    }
}

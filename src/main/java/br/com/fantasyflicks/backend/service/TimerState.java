package br.com.fantasyflicks.backend.service;

public enum TimerState {

    /**
     * Sem timer: draft sem limite, pausado, concluído ou sem turno ativo
     */
    IDLE,

    RUNNING,

    /**
     * Tempo do turno esgotado, aguardando auto-pick
     */
    EXPIRED
}

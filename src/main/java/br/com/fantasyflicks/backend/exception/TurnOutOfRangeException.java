package br.com.fantasyflicks.backend.exception;

/**
 * Pick geral fora de 1..totalPicks.
 * 
 * Erro de programação: significa que a invariante da sessão já foi violada
 * antes de chegar aqui. Nunca deve ser mostrado ao usuário.
 */
public class TurnOutOfRangeException extends RuntimeException {

    private final int overallPick;
    private final int totalPicks;

    public TurnOutOfRangeException(int overallPick, int totalPicks) {
        super("Pick geral " + overallPick + " fora do intervalo 1.." + totalPicks);
        this.overallPick = overallPick;
        this.totalPicks = totalPicks;
    }

    public int getOverallPick() {
        return overallPick;
    }

    public int getTotalPicks() {
        return totalPicks;
    }
}

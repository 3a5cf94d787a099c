package br.com.fantasyflicks.backend.service.eligibility;

/**
 * Motivo pelo qual um item não pode ser escolhido agora.
 */
public enum IneligibilityReason {

    UNKNOWN_ITEM("Item não existe no pool do draft"),
    ALREADY_OWNED("Item já foi escolhido"),
    CATEGORY_ALREADY_FILLED("Participante já preencheu esta categoria"),
    WRONG_CATEGORY_FOR_ROUND("Item não pertence à categoria da rodada");

    private final String message;

    IneligibilityReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}

package br.com.fantasyflicks.backend.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Utilitário para extrair o header X-Participant-Id das requisições HTTP.
 * A identidade já vem resolvida pelo gateway; aqui só lemos o ID.
 */
public class ParticipantAuthUtil {

    public static final String HEADER_NAME = "X-Participant-Id";

    // Construtor privado para classe utilitária
    private ParticipantAuthUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Extrai o ID do participante do header.
     *
     * @throws ResponseStatusException com HTTP 401 se o header estiver
     *                                 ausente/vazio
     */
    public static String getParticipantIdFromRequest(HttpServletRequest request) {
        String participantId = request.getHeader(HEADER_NAME);

        if (participantId == null || participantId.trim().isEmpty()) {
            throw new ResponseStatusException(
                    HttpStatus.UNAUTHORIZED,
                    "Header X-Participant-Id é obrigatório para identificar o participante");
        }

        return participantId.trim();
    }

    /**
     * Igual a {@link #getParticipantIdFromRequest}, mas devolve null quando o
     * header não vem.
     */
    public static String getParticipantIdFromRequestOptional(HttpServletRequest request) {
        String participantId = request.getHeader(HEADER_NAME);

        if (participantId == null || participantId.trim().isEmpty()) {
            return null;
        }

        return participantId.trim();
    }
}

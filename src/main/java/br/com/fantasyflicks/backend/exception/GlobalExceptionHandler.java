package br.com.fantasyflicks.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String MESSAGE_KEY = "message";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        log.warn("Erro de validação: {}", errors);
        return ResponseEntity.badRequest().body(createErrorResponse(
                "Erro de validação",
                HttpStatus.BAD_REQUEST.value(),
                errors));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolationException(
            ConstraintViolationException ex) {

        Map<String, String> errors = new HashMap<>();
        for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
            errors.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        log.warn("Erro de validação de constraint: {}", errors);
        return ResponseEntity.badRequest().body(createErrorResponse(
                "Erro de validação de parâmetros",
                HttpStatus.BAD_REQUEST.value(),
                errors));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex) {

        String error = String.format("Parâmetro '%s' deve ser do tipo %s",
                ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "desconhecido");

        log.warn("Erro de tipo de parâmetro: {}", error);
        return ResponseEntity.badRequest().body(createErrorResponse(
                "Erro de tipo de parâmetro",
                HttpStatus.BAD_REQUEST.value(),
                Map.of("parameter", error)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex) {

        log.warn("Argumento inválido: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(createErrorResponse(
                "Argumento inválido",
                HttpStatus.BAD_REQUEST.value(),
                Map.of(MESSAGE_KEY, String.valueOf(ex.getMessage()))));
    }

    @ExceptionHandler(DraftNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleDraftNotFound(DraftNotFoundException ex) {
        log.warn("Draft não encontrado: {}", ex.getSessionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(createErrorResponse(
                "Draft não encontrado",
                HttpStatus.NOT_FOUND.value(),
                Map.of(MESSAGE_KEY, ex.getMessage())));
    }

    @ExceptionHandler(NotCommissionerException.class)
    public ResponseEntity<Map<String, Object>> handleNotCommissioner(NotCommissionerException ex) {
        log.warn("Ação restrita ao comissário: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(createErrorResponse(
                "Apenas o comissário pode executar esta ação",
                HttpStatus.FORBIDDEN.value(),
                Map.of(MESSAGE_KEY, ex.getMessage())));
    }

    @ExceptionHandler({ AlreadyStartedException.class, InvalidDraftTransitionException.class,
            IllegalStateException.class })
    public ResponseEntity<Map<String, Object>> handleInvalidState(RuntimeException ex) {
        log.warn("Estado inválido: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(createErrorResponse(
                "Estado inválido",
                HttpStatus.CONFLICT.value(),
                Map.of(MESSAGE_KEY, String.valueOf(ex.getMessage()))));
    }

    @ExceptionHandler(TurnOutOfRangeException.class)
    public ResponseEntity<Map<String, Object>> handleTurnOutOfRange(TurnOutOfRangeException ex) {
        // invariante da sessão quebrada antes de chegar aqui
        log.error("❌ Pick fora do intervalo: pick={}, total={}", ex.getOverallPick(), ex.getTotalPicks(), ex);
        return ResponseEntity.internalServerError().body(createErrorResponse(
                "Erro interno do servidor",
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                Map.of(MESSAGE_KEY, "Estado do draft inconsistente")));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Requisição rejeitada ({}): {}", ex.getStatusCode(), ex.getReason());
        return ResponseEntity.status(ex.getStatusCode()).body(createErrorResponse(
                "Requisição rejeitada",
                ex.getStatusCode().value(),
                Map.of(MESSAGE_KEY, String.valueOf(ex.getReason()))));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Erro não tratado", ex);
        return ResponseEntity.internalServerError().body(createErrorResponse(
                "Erro interno do servidor",
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                Map.of(MESSAGE_KEY, "Ocorreu um erro inesperado")));
    }

    private Map<String, Object> createErrorResponse(String title, int status, Object details) {
        Map<String, Object> response = new HashMap<>();
        response.put("title", title);
        response.put("status", status);
        response.put("timestamp", Instant.now());
        response.put("details", details);
        return response;
    }
}

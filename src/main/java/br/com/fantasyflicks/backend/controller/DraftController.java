package br.com.fantasyflicks.backend.controller;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.dto.CommitPickRequest;
import br.com.fantasyflicks.backend.dto.CommitResponseDTO;
import br.com.fantasyflicks.backend.dto.CreateDraftRequest;
import br.com.fantasyflicks.backend.dto.DraftSessionDTO;
import br.com.fantasyflicks.backend.dto.ExpireTurnRequest;
import br.com.fantasyflicks.backend.dto.ScheduleDraftRequest;
import br.com.fantasyflicks.backend.dto.SelectionDTO;
import br.com.fantasyflicks.backend.dto.StandingEntryDTO;
import br.com.fantasyflicks.backend.mapper.DraftMapper;
import br.com.fantasyflicks.backend.service.CommitError;
import br.com.fantasyflicks.backend.service.CommitResult;
import br.com.fantasyflicks.backend.service.DraftSessionService;
import br.com.fantasyflicks.backend.service.PickCommitEngine;
import br.com.fantasyflicks.backend.service.TurnExpiryService;
import br.com.fantasyflicks.backend.util.ParticipantAuthUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/drafts")
@RequiredArgsConstructor
public class DraftController {

    private final DraftSessionService draftSessionService;
    private final PickCommitEngine pickCommitEngine;
    private final TurnExpiryService turnExpiryService;
    private final DraftMapper draftMapper;

    @PostMapping
    public ResponseEntity<DraftSessionDTO> createDraft(
            @Valid @RequestBody CreateDraftRequest request,
            HttpServletRequest httpRequest) {
        String commissionerId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        DraftSession session = draftSessionService.createDraft(request, commissionerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(draftSessionService.toDTO(session));
    }

    @PostMapping("/{sessionId}/schedule")
    public ResponseEntity<DraftSessionDTO> scheduleDraft(
            @PathVariable Long sessionId,
            @Valid @RequestBody ScheduleDraftRequest request,
            HttpServletRequest httpRequest) {
        String caller = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        DraftSession session = draftSessionService.scheduleSession(
                sessionId, request.getScheduledAt(), caller, request.getExpectedVersion());
        return ResponseEntity.ok(draftSessionService.toDTO(session));
    }

    @PostMapping("/{sessionId}/start")
    public ResponseEntity<DraftSessionDTO> startDraft(@PathVariable Long sessionId, HttpServletRequest httpRequest) {
        String caller = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(draftSessionService.toDTO(draftSessionService.startSession(sessionId, caller)));
    }

    @PostMapping("/{sessionId}/pause")
    public ResponseEntity<DraftSessionDTO> pauseDraft(@PathVariable Long sessionId, HttpServletRequest httpRequest) {
        String caller = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(draftSessionService.toDTO(draftSessionService.pauseSession(sessionId, caller)));
    }

    @PostMapping("/{sessionId}/resume")
    public ResponseEntity<DraftSessionDTO> resumeDraft(@PathVariable Long sessionId, HttpServletRequest httpRequest) {
        String caller = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        return ResponseEntity.ok(draftSessionService.toDTO(draftSessionService.resumeSession(sessionId, caller)));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<DraftSessionDTO> getDraft(@PathVariable Long sessionId) {
        return ResponseEntity.ok(draftSessionService.toDTO(draftSessionService.getSession(sessionId)));
    }

    @GetMapping("/{sessionId}/selections")
    public ResponseEntity<List<SelectionDTO>> getSelections(@PathVariable Long sessionId) {
        return ResponseEntity.ok(draftMapper.toSelectionDTOs(draftSessionService.selections(sessionId)));
    }

    /**
     * Itens disponíveis para o participante do header (ou para quem está na
     * vez, se o header não vier).
     */
    @GetMapping("/{sessionId}/selectable")
    public ResponseEntity<Set<String>> getSelectableItems(@PathVariable Long sessionId,
            HttpServletRequest httpRequest) {
        String participantId = ParticipantAuthUtil.getParticipantIdFromRequestOptional(httpRequest);
        return ResponseEntity.ok(draftSessionService.selectableItems(sessionId, participantId));
    }

    @PostMapping("/{sessionId}/picks")
    public ResponseEntity<CommitResponseDTO> commitPick(
            @PathVariable Long sessionId,
            @Valid @RequestBody CommitPickRequest request,
            HttpServletRequest httpRequest) {
        String participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        CommitResult result = pickCommitEngine.commit(
                sessionId, participantId, request.getItemId(), request.getExpectedVersion());
        return toResponse(result);
    }

    /**
     * Expiração disparada por um observador (cliente ou outra instância).
     */
    @PostMapping("/{sessionId}/expire")
    public ResponseEntity<CommitResponseDTO> expireTurn(
            @PathVariable Long sessionId,
            @Valid @RequestBody ExpireTurnRequest request) {
        return toResponse(turnExpiryService.expireTurn(sessionId, request.getExpectedVersion()));
    }

    @GetMapping("/{sessionId}/standings")
    public ResponseEntity<List<StandingEntryDTO>> getStandings(@PathVariable Long sessionId) {
        return ResponseEntity.ok(draftMapper.toStandingDTOs(draftSessionService.standings(sessionId)));
    }

    private ResponseEntity<CommitResponseDTO> toResponse(CommitResult result) {
        if (result.success()) {
            return ResponseEntity.ok(CommitResponseDTO.builder()
                    .success(true)
                    .selection(draftMapper.toDTO(result.selection()))
                    .session(draftSessionService.toDTO(result.session()))
                    .build());
        }

        CommitResponseDTO body = CommitResponseDTO.builder()
                .success(false)
                .error(result.error().name())
                .reason(result.reason() != null ? result.reason().name() : null)
                .message(result.reason() != null ? result.reason().getMessage() : null)
                .retryable(result.isRetryable())
                .build();
        return ResponseEntity.status(statusFor(result.error())).body(body);
    }

    static HttpStatus statusFor(CommitError error) {
        switch (error) {
            case SESSION_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case NOT_YOUR_TURN:
                return HttpStatus.FORBIDDEN;
            case NOT_ELIGIBLE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STALE_TURN:
            case SESSION_NOT_ACTIVE:
            case TIMER_NOT_EXPIRED:
            default:
                return HttpStatus.CONFLICT;
        }
    }
}

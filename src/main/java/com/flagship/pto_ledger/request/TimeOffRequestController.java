package com.flagship.pto_ledger.request;

import com.flagship.pto_ledger.ledger.ConflictRetrier;
import com.flagship.pto_ledger.request.dto.CreateTimeOffRequestBody;
import com.flagship.pto_ledger.request.dto.DecisionBody;
import com.flagship.pto_ledger.request.dto.TimeOffRequestResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST adapter for the request workflow.
 *
 * Submissions accept an optional {@code Idempotency-Key}; resending the same key returns the
 * original request. Transitions run through {@link ConflictRetrier}, each attempt in its own
 * transaction.
 */
@RestController
@RequestMapping("/api/companies/{companyId}/requests")
@RequiredArgsConstructor
public class TimeOffRequestController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String ACTOR_HEADER = "X-Actor-Id";

    private final TimeOffRequestService requestService;
    private final ConflictRetrier retrier;

    @PostMapping
    public ResponseEntity<TimeOffRequestResponse> submit(
            @PathVariable("companyId") UUID companyId,
            @Valid @RequestBody CreateTimeOffRequestBody body,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
        NewTimeOffRequest command = body.toCommand(companyId, idempotencyKey, actorId);
        TimeOffRequest request = retrier.execute("request_submit", () -> requestService.submitRequest(command));
        return ResponseEntity.status(HttpStatus.CREATED).body(TimeOffRequestResponse.from(request));
    }

    @PostMapping("/drafts")
    public ResponseEntity<TimeOffRequestResponse> createDraft(
            @PathVariable("companyId") UUID companyId,
            @Valid @RequestBody CreateTimeOffRequestBody body,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
        NewTimeOffRequest command = body.toCommand(companyId, idempotencyKey, actorId);
        TimeOffRequest request = retrier.execute("request_draft", () -> requestService.createDraft(command));
        return ResponseEntity.status(HttpStatus.CREATED).body(TimeOffRequestResponse.from(request));
    }

    @PostMapping("/{requestId}/submit")
    public TimeOffRequestResponse submitDraft(@PathVariable("companyId") UUID companyId,
                                              @PathVariable("requestId") UUID requestId,
                                              @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
        return TimeOffRequestResponse.from(retrier.execute("request_submit",
                () -> requestService.submitDraft(companyId, requestId, actorId)));
    }

    @PostMapping("/{requestId}/approve")
    public TimeOffRequestResponse approve(@PathVariable("companyId") UUID companyId,
                                          @PathVariable("requestId") UUID requestId,
                                          @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId,
                                          @Valid @RequestBody(required = false) DecisionBody body) {
        String note = body != null ? body.getNote() : null;
        return TimeOffRequestResponse.from(retrier.execute("request_approve",
                () -> requestService.approveRequest(companyId, requestId, actorId, note)));
    }

    @PostMapping("/{requestId}/deny")
    public TimeOffRequestResponse deny(@PathVariable("companyId") UUID companyId,
                                       @PathVariable("requestId") UUID requestId,
                                       @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId,
                                       @Valid @RequestBody(required = false) DecisionBody body) {
        String note = body != null ? body.getNote() : null;
        return TimeOffRequestResponse.from(retrier.execute("request_deny",
                () -> requestService.denyRequest(companyId, requestId, actorId, note)));
    }

    @PostMapping("/{requestId}/cancel")
    public TimeOffRequestResponse cancel(@PathVariable("companyId") UUID companyId,
                                         @PathVariable("requestId") UUID requestId,
                                         @RequestHeader(value = ACTOR_HEADER, required = false) UUID actorId) {
        return TimeOffRequestResponse.from(retrier.execute("request_cancel",
                () -> requestService.cancelRequest(companyId, requestId, actorId)));
    }

    @GetMapping("/{requestId}")
    public TimeOffRequestResponse get(@PathVariable("companyId") UUID companyId,
                                      @PathVariable("requestId") UUID requestId) {
        return TimeOffRequestResponse.from(requestService.getRequest(companyId, requestId));
    }

    @GetMapping
    public List<TimeOffRequestResponse> list(@PathVariable("companyId") UUID companyId,
                                             @RequestParam("employeeId") UUID employeeId,
                                             @RequestParam(value = "status", required = false) RequestStatus status) {
        return requestService.listRequests(companyId, employeeId, status).stream()
            .map(TimeOffRequestResponse::from)
            .toList();
    }
}

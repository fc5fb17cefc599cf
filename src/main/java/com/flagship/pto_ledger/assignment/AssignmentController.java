package com.flagship.pto_ledger.assignment;

import com.flagship.pto_ledger.assignment.dto.AssignmentResponse;
import com.flagship.pto_ledger.assignment.dto.CreateAssignmentBody;
import com.flagship.pto_ledger.assignment.dto.EndAssignmentBody;
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

@RestController
@RequestMapping("/api/companies/{companyId}/assignments")
@RequiredArgsConstructor
public class AssignmentController {

    private final AssignmentService assignmentService;

    @PostMapping
    public ResponseEntity<AssignmentResponse> assign(
            @PathVariable("companyId") UUID companyId,
            @Valid @RequestBody CreateAssignmentBody body,
            @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
        Assignment assignment = assignmentService.assign(companyId, body.getEmployeeId(), body.getPolicyId(),
                body.getEffectiveFrom(), body.getEffectiveTo(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(AssignmentResponse.from(assignment));
    }

    @PostMapping("/{assignmentId}/end")
    public AssignmentResponse end(@PathVariable("companyId") UUID companyId,
                                  @PathVariable("assignmentId") UUID assignmentId,
                                  @Valid @RequestBody EndAssignmentBody body,
                                  @RequestHeader(value = "X-Actor-Id", required = false) UUID actorId) {
        return AssignmentResponse.from(
            assignmentService.endAssignment(companyId, assignmentId, body.getEffectiveTo(), actorId));
    }

    @GetMapping
    public List<AssignmentResponse> list(@PathVariable("companyId") UUID companyId,
                                         @RequestParam("employeeId") UUID employeeId) {
        return assignmentService.listAssignments(companyId, employeeId).stream()
            .map(AssignmentResponse::from)
            .toList();
    }
}

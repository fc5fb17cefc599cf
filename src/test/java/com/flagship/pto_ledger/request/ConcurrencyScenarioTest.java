package com.flagship.pto_ledger.request;

import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.assignment.Assignment;
import com.flagship.pto_ledger.exception.InsufficientBalanceException;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.AdjustmentService;
import com.flagship.pto_ledger.ledger.BalanceService;
import com.flagship.pto_ledger.ledger.BalanceView;
import com.flagship.pto_ledger.ledger.ConflictRetrier;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent writers on one balance: the snapshot lock serializes them, so the balance floor
 * holds no matter how submissions interleave.
 */
class ConcurrencyScenarioTest extends AbstractIntegrationTest {

    @Autowired
    private TimeOffRequestService requestService;

    @Autowired
    private AdjustmentService adjustmentService;

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private ConflictRetrier retrier;

    @Test
    @DisplayName("Concurrent submissions of just over half the balance: exactly one succeeds")
    void onlyOneSubmissionFits() throws Exception {
        printTestHeader("Concurrent submissions against 960 minutes");
        UUID employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));
        assign(employeeId, policy.getId(), LocalDate.of(2024, 1, 1));
        adjustmentService.createAdjustment(companyId, employeeId, policy.getId(), 960, LocalDate.of(2024, 1, 1),
                "Opening balance", null, null);

        // Non-overlapping ranges of 481 minutes each: 09:00-17:00 plus one minute of the next day
        List<NewTimeOffRequest> inputs = new ArrayList<>();
        for (LocalDate monday = LocalDate.of(2024, 3, 4); inputs.size() < 4; monday = monday.plusWeeks(1)) {
            inputs.add(NewTimeOffRequest.builder()
                .companyId(companyId)
                .employeeId(employeeId)
                .policyId(policy.getId())
                .startAt(monday.atTime(9, 0).toInstant(ZoneOffset.UTC))
                .endAt(monday.plusDays(1).atTime(9, 1).toInstant(ZoneOffset.UTC))
                .build());
        }
        printInput("Requests", inputs.size() + " x 481 minutes");

        ExecutorService executor = Executors.newFixedThreadPool(inputs.size());
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(inputs.size());
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        for (NewTimeOffRequest input : inputs) {
            executor.submit(() -> {
                try {
                    start.await();
                    retrier.execute("request_submit", () -> requestService.submitRequest(input));
                    succeeded.incrementAndGet();
                } catch (InsufficientBalanceException e) {
                    refused.incrementAndGet();
                } catch (Exception e) {
                    failed.incrementAndGet();
                    e.printStackTrace();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        BalanceView balance = balanceService.getBalance(companyId, employeeId, policy.getId());
        printOutput("Succeeded", succeeded.get());
        printOutput("Refused", refused.get());
        printOutput("Balance", balance);

        assertEquals(1, succeeded.get());
        assertEquals(inputs.size() - 1, refused.get());
        assertEquals(0, failed.get());
        assertEquals(481, balance.getHeldMinutes());
        assertEquals(479L, balance.getAvailableMinutes());
        assertEquals(1, requestService.listRequests(companyId, employeeId, null).size());
        printSuccess("Exactly one hold fits; available never went negative");
    }

    @Test
    @DisplayName("Many concurrent adjustments all land and the snapshot matches the ledger")
    void concurrentAdjustmentsSerialize() throws Exception {
        UUID employeeId = UUID.randomUUID();
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));

        int writers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);
        AtomicInteger failed = new AtomicInteger();
        for (int i = 0; i < writers; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    retrier.execute("adjustment", () -> adjustmentService.createAdjustment(companyId, employeeId,
                            policy.getId(), 60, LocalDate.of(2024, 2, 1), "Bonus", null, null));
                } catch (Exception e) {
                    failed.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        BalanceView balance = balanceService.getBalance(companyId, employeeId, policy.getId());
        assertEquals(0, failed.get());
        assertEquals(600, balance.getAccruedMinutes());
        assertEquals(writers, balance.getVersion());
        assertEquals(writers, countLedgerEntries(employeeId, policy.getId()));
    }

    @Test
    @DisplayName("Concurrent overlapping assignments: the policy lock lets exactly one in")
    void onlyOneOverlappingAssignmentLands() throws Exception {
        printTestHeader("Concurrent overlapping assignments");
        UUID employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));

        int writers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        for (int i = 0; i < writers; i++) {
            LocalDate from = LocalDate.of(2024, 1 + i, 1);
            executor.submit(() -> {
                try {
                    start.await();
                    assign(employeeId, policy.getId(), from);
                    succeeded.incrementAndGet();
                } catch (ValidationException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    e.printStackTrace();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        List<Assignment> assignments = assignmentService.listAssignments(companyId, employeeId);
        printOutput("Succeeded", succeeded.get());
        printOutput("Assignments", assignments);

        assertEquals(1, succeeded.get());
        assertEquals(writers - 1, rejected.get());
        assertEquals(1, assignments.size());
        printSuccess("Open-ended assignments never overlap");
    }

    @Test
    @DisplayName("A closed assignment cannot be reopened across its successor")
    void reopeningAcrossSuccessorIsRejected() {
        UUID employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(800, null, null, null));
        Assignment first = assignmentService.assign(companyId, employeeId, policy.getId(),
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 1), null);
        assign(employeeId, policy.getId(), LocalDate.of(2024, 3, 1));

        assertThrows(ValidationException.class,
                () -> assignmentService.endAssignment(companyId, first.getId(), LocalDate.of(2024, 6, 1), null));

        Assignment shortened = assignmentService.endAssignment(companyId, first.getId(), LocalDate.of(2024, 2, 1), null);
        assertEquals(LocalDate.of(2024, 2, 1), shortened.getEffectiveTo());
        assertEquals(LocalDate.of(2024, 2, 1), assignmentService.listAssignments(companyId, employeeId)
                .get(0).getEffectiveTo());
    }
}

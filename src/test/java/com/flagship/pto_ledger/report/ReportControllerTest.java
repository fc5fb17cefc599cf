package com.flagship.pto_ledger.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.ledger.AdjustmentService;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import com.flagship.pto_ledger.policy.UnlimitedSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Company reports over HTTP: balance summary, ledger export and audit log.
 */
@AutoConfigureMockMvc
class ReportControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AdjustmentService adjustmentService;

    private UUID employeeId;
    private UUID vacationId;
    private UUID unlimitedId;

    @BeforeEach
    void setUp() {
        employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy vacation = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(480, null, null, null));
        TimeOffPolicy unlimited = createPolicy("sick", LocalDate.of(2024, 1, 1), new UnlimitedSettings());
        vacationId = vacation.getId();
        unlimitedId = unlimited.getId();
        assign(employeeId, vacationId, LocalDate.of(2024, 1, 1));
        assign(employeeId, unlimitedId, LocalDate.of(2024, 1, 1));
        adjustmentService.createAdjustment(companyId, employeeId, vacationId, 480, LocalDate.of(2024, 1, 1),
                "Opening balance", null, null);
    }

    private String path(String suffix) {
        return "/api/companies/" + companyId + suffix;
    }

    private JsonNode getJson(String url) throws Exception {
        MvcResult result = mockMvc.perform(get(url)).andExpect(status().isOk()).andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("GET /reports/balances lists every active assignment")
    void balanceSummary() throws Exception {
        printTestHeader("Company balance summary");
        JsonNode body = getJson(path("/reports/balances?date=2024-03-01"));
        printOutput("Summary", body);

        assertEquals("2024-03-01", body.get("as_of").asText());
        assertEquals(2, body.get("total").asInt());

        JsonNode items = body.get("items");
        JsonNode vacation = null;
        JsonNode unlimited = null;
        for (JsonNode item : items) {
            if (item.get("policy_id").asText().equals(vacationId.toString())) {
                vacation = item;
            } else if (item.get("policy_id").asText().equals(unlimitedId.toString())) {
                unlimited = item;
            }
        }
        assertNotNull(vacation);
        assertNotNull(unlimited);
        assertEquals(480, vacation.get("available_minutes").asLong());
        assertFalse(vacation.get("is_unlimited").asBoolean());
        assertTrue(unlimited.get("is_unlimited").asBoolean());
        assertTrue(unlimited.get("available_minutes").isNull());
        printSuccess("Both assignments reported, unlimited one without an available figure");
    }

    @Test
    @DisplayName("Assignments that have not started are left out of the summary")
    void summaryRespectsDate() throws Exception {
        UUID newcomer = createEmployee(480, "UTC", null);
        assign(newcomer, vacationId, LocalDate.of(2024, 6, 1));

        JsonNode body = getJson(path("/reports/balances?date=2024-03-01"));

        assertEquals(2, body.get("total").asInt());
        for (JsonNode item : body.get("items")) {
            assertEquals(employeeId.toString(), item.get("employee_id").asText());
        }
    }

    @Test
    @DisplayName("GET /reports/ledger pages newest first and filters by policy")
    void ledgerExport() throws Exception {
        adjustmentService.createAdjustment(companyId, employeeId, vacationId, 60, LocalDate.of(2024, 2, 1),
                "Bonus", null, null);
        adjustmentService.createAdjustment(companyId, employeeId, vacationId, -30, LocalDate.of(2024, 3, 1),
                "Correction", null, null);

        JsonNode firstPage = getJson(path("/reports/ledger?policyId=" + vacationId + "&size=2"));
        JsonNode secondPage = getJson(path("/reports/ledger?policyId=" + vacationId + "&size=2&page=1"));
        JsonNode ranged = getJson(path("/reports/ledger?from=2024-02-01T00:00:00Z&to=2024-03-01T00:00:00Z"));
        JsonNode otherPolicy = getJson(path("/reports/ledger?policyId=" + unlimitedId));

        assertEquals(3, firstPage.get("total").asInt());
        assertEquals(2, firstPage.get("items").size());
        assertEquals(-30, firstPage.get("items").get(0).get("amount_minutes").asInt());
        assertEquals("ADJUSTMENT", firstPage.get("items").get(0).get("entry_type").asText());
        assertEquals(1, secondPage.get("items").size());
        assertEquals(480, secondPage.get("items").get(0).get("amount_minutes").asInt());
        assertEquals(1, ranged.get("total").asInt());
        assertEquals(60, ranged.get("items").get(0).get("amount_minutes").asInt());
        assertEquals(0, otherPolicy.get("total").asInt());
    }

    @Test
    @DisplayName("GET /audit-log filters by entity type")
    void auditLogByEntityType() throws Exception {
        JsonNode policies = getJson(path("/audit-log?entityType=POLICY"));
        JsonNode adjustments = getJson(path("/audit-log?entityType=ADJUSTMENT"));

        assertEquals(2, policies.get("total").asInt());
        JsonNode created = policies.get("items").get(0);
        assertEquals("CREATE", created.get("action").asText());
        assertTrue(created.get("before").isNull());
        assertTrue(created.get("after").isObject());

        assertEquals(1, adjustments.get("total").asInt());
        assertEquals(480, adjustments.get("items").get(0).get("after").get("amountMinutes").asInt());
    }

    @Test
    @DisplayName("Oversized pages and unknown filters are rejected")
    void invalidParametersRejected() throws Exception {
        mockMvc.perform(get(path("/audit-log?size=500")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mockMvc.perform(get(path("/reports/ledger?page=-1")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mockMvc.perform(get(path("/audit-log?entityType=PAYROLL")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }
}

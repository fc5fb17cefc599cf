package com.flagship.pto_ledger.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pto_ledger.AbstractIntegrationTest;
import com.flagship.pto_ledger.ledger.AdjustmentService;
import com.flagship.pto_ledger.policy.TimeOffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of the request workflow: status codes, error bodies and idempotency headers.
 */
@AutoConfigureMockMvc
class TimeOffRequestControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AdjustmentService adjustmentService;

    private UUID employeeId;
    private UUID policyId;

    @BeforeEach
    void setUp() {
        employeeId = createEmployee(480, "UTC", null);
        TimeOffPolicy policy = createPolicy("vacation", LocalDate.of(2024, 1, 1), monthlyAccrual(480, null, null, null));
        policyId = policy.getId();
        assign(employeeId, policyId, LocalDate.of(2024, 1, 1));
        adjustmentService.createAdjustment(companyId, employeeId, policyId, 480, LocalDate.of(2024, 1, 1),
                "Opening balance", null, null);
    }

    private String body(String startAt, String endAt) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("employee_id", employeeId);
        body.put("policy_id", policyId);
        body.put("start_at", startAt);
        body.put("end_at", endAt);
        body.put("reason", "Family visit");
        return objectMapper.writeValueAsString(body);
    }

    private String requestsPath() {
        return "/api/companies/" + companyId + "/requests";
    }

    private JsonNode submit(String startAt, String endAt, String idempotencyKey) throws Exception {
        MvcResult result = mockMvc.perform(post(requestsPath())
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", idempotencyKey)
                .content(body(startAt, endAt)))
            .andExpect(status().isCreated())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("POST /requests submits and holds the balance")
    void submitReturnsCreated() throws Exception {
        printTestHeader("Submit over HTTP");
        JsonNode response = submit("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z", "http-1");
        printOutput("Response", response);

        assertEquals("SUBMITTED", response.get("status").asText());
        assertEquals(480, response.get("requested_minutes").asInt());

        mockMvc.perform(get("/api/companies/" + companyId + "/employees/" + employeeId + "/balances/" + policyId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.held_minutes").value(480))
            .andExpect(jsonPath("$.available_minutes").value(0));
        printSuccess("201 Created with the hold in place");
    }

    @Test
    @DisplayName("The same Idempotency-Key returns the same request")
    void idempotencyKeyReplay() throws Exception {
        JsonNode first = submit("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z", "http-2");
        JsonNode second = submit("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z", "http-2");

        assertEquals(first.get("id").asText(), second.get("id").asText());
    }

    @Test
    @DisplayName("Insufficient balance maps to 422 with the amounts in the details")
    void insufficientBalanceIs422() throws Exception {
        mockMvc.perform(post(requestsPath())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("2024-03-04T00:00:00Z", "2024-03-06T00:00:00Z")))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_BALANCE"))
            .andExpect(jsonPath("$.details.available_minutes").value("480"))
            .andExpect(jsonPath("$.details.required_minutes").value("960"));
    }

    @Test
    @DisplayName("Illegal transitions map to 409")
    void invalidTransitionIs409() throws Exception {
        JsonNode created = submit("2024-03-04T00:00:00Z", "2024-03-05T00:00:00Z", "http-3");
        String path = requestsPath() + "/" + created.get("id").asText();

        mockMvc.perform(post(path + "/deny").header("X-Actor-Id", UUID.randomUUID().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DENIED"));
        mockMvc.perform(post(path + "/approve"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("Malformed input maps to 400")
    void badInputIs400() throws Exception {
        mockMvc.perform(post(requestsPath())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"policy_id\":\"" + policyId + "\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.employeeId").exists());

        mockMvc.perform(post(requestsPath())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("2024-03-05T00:00:00Z", "2024-03-04T00:00:00Z")))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown requests map to 404")
    void unknownRequestIs404() throws Exception {
        mockMvc.perform(get(requestsPath() + "/" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }
}

package com.flagship.pto_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.ledger.BalanceView;
import com.flagship.pto_ledger.policy.PolicyCategory;
import com.flagship.pto_ledger.report.EmployeeBalanceSummary;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Balances of every active assignment in a company. {@code available_minutes} is null for
 * unlimited policies.
 */
@Value
public class BalanceSummaryResponse {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("total")
    int total;

    public static BalanceSummaryResponse of(LocalDate asOf, List<EmployeeBalanceSummary> rows) {
        return new BalanceSummaryResponse(asOf, rows.stream().map(Item::from).toList(), rows.size());
    }

    @Value
    @Builder
    public static class Item {

        @JsonProperty("employee_id")
        UUID employeeId;

        @JsonProperty("policy_id")
        UUID policyId;

        @JsonProperty("policy_key")
        String policyKey;

        @JsonProperty("policy_category")
        PolicyCategory policyCategory;

        @JsonProperty("accrued_minutes")
        long accruedMinutes;

        @JsonProperty("used_minutes")
        long usedMinutes;

        @JsonProperty("held_minutes")
        long heldMinutes;

        @JsonProperty("available_minutes")
        Long availableMinutes;

        @JsonProperty("is_unlimited")
        boolean unlimited;

        static Item from(EmployeeBalanceSummary row) {
            BalanceView balance = row.getBalance();
            return Item.builder()
                .employeeId(balance.getEmployeeId())
                .policyId(balance.getPolicyId())
                .policyKey(row.getPolicyKey())
                .policyCategory(row.getPolicyCategory())
                .accruedMinutes(balance.getAccruedMinutes())
                .usedMinutes(balance.getUsedMinutes())
                .heldMinutes(balance.getHeldMinutes())
                .availableMinutes(balance.getAvailableMinutes())
                .unlimited(row.isUnlimited())
                .build();
        }
    }
}

package com.flagship.pto_ledger.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.flagship.pto_ledger.config.JacksonConfig;
import com.flagship.pto_ledger.exception.ValidationException;
import com.flagship.pto_ledger.ledger.BalanceRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.MonthDay;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicySettingsTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Settings JSON selects the variant by its type discriminator")
    void readsVariantFromJson() throws Exception {
        String json = """
            {"type": "TIME_ACCRUAL", "frequency": "MONTHLY", "rateMinutes": 800,
             "bankCapMinutes": 15000,
             "carryover": {"enabled": true, "capMinutes": 2400, "expiresAfterDays": 90}}
            """;

        PolicySettings settings = objectMapper.readValue(json, PolicySettings.class);

        TimeAccrualSettings accrual = assertInstanceOf(TimeAccrualSettings.class, settings);
        assertEquals(PolicyKind.TIME_ACCRUAL, accrual.kind());
        assertEquals(AccrualTiming.START_OF_PERIOD, accrual.getTiming());
        assertEquals(ProrationMethod.DAYS_ACTIVE, accrual.getProration());
        assertEquals(MonthDay.of(1, 1), accrual.carryoverRules().boundary());
        assertEquals(15_000L, accrual.balanceRules().getBankCapMinutes());
    }

    @Test
    @DisplayName("Settings survive a JSON round trip")
    void roundTrip() throws Exception {
        PolicySettings original = HoursWorkedAccrualSettings.builder()
            .ratio(new AccrualRatio(60, 1800))
            .allowNegative(true)
            .negativeLimitMinutes(480)
            .build();

        String json = objectMapper.writeValueAsString(original);
        PolicySettings read = objectMapper.readValue(json, PolicySettings.class);

        assertEquals(original, read);
        assertTrue(json.contains("\"type\":\"HOURS_WORKED_ACCRUAL\""));
    }

    @Test
    @DisplayName("Unlimited policies carry no floor")
    void unlimitedHasNoFloor() {
        BalanceRules rules = new UnlimitedSettings().balanceRules();

        assertTrue(rules.isUnlimited());
        assertNull(rules.floorMinutes());
    }

    @Test
    @DisplayName("Invalid settings are rejected on construction")
    void rejectsInvalidSettings() {
        assertThrows(ValidationException.class, () -> TimeAccrualSettings.builder()
            .frequency(AccrualFrequency.MONTHLY).rateMinutes(0).build());
        assertThrows(ValidationException.class, () -> TimeAccrualSettings.builder()
            .rateMinutes(800).build());
        assertThrows(ValidationException.class, () -> TimeAccrualSettings.builder()
            .frequency(AccrualFrequency.MONTHLY).rateMinutes(800).negativeLimitMinutes(60).build());
        assertThrows(ValidationException.class, () -> TimeAccrualSettings.builder()
            .frequency(AccrualFrequency.MONTHLY).rateMinutes(800)
            .tenureTiers(List.of(new TenureTier(12, 900), new TenureTier(12, 1000))).build());
        assertThrows(ValidationException.class, () -> new CarryoverSettings(true, -1, null, null, null));
        assertThrows(ValidationException.class, () -> new CarryoverSettings(true, null, null, 2, 30));
        assertThrows(ValidationException.class, () -> new ExpirationSettings(true, null, null, null));
        assertThrows(ValidationException.class, () -> new AccrualRatio(0, 30));
    }

    @Test
    @DisplayName("Invalid settings JSON surfaces the validation failure")
    void rejectsInvalidJson() {
        String json = """
            {"type": "TIME_ACCRUAL", "frequency": "MONTHLY", "rateMinutes": -5}
            """;

        ValueInstantiationException e = assertThrows(ValueInstantiationException.class,
            () -> objectMapper.readValue(json, PolicySettings.class));
        assertInstanceOf(ValidationException.class, e.getCause());
    }
}

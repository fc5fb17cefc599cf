package com.flagship.pto_ledger.policy;

import com.flagship.pto_ledger.exception.ValidationException;

final class SettingsChecks {

    private SettingsChecks() {
    }

    static void checkNegativeAndCap(boolean allowNegative, Integer negativeLimitMinutes, Integer bankCapMinutes) {
        if (negativeLimitMinutes != null) {
            if (!allowNegative) {
                throw new ValidationException("negativeLimitMinutes requires allowNegative=true");
            }
            if (negativeLimitMinutes < 0) {
                throw new ValidationException("negativeLimitMinutes must be >= 0, got " + negativeLimitMinutes);
            }
        }
        if (bankCapMinutes != null && bankCapMinutes <= 0) {
            throw new ValidationException("bankCapMinutes must be > 0, got " + bankCapMinutes);
        }
    }
}

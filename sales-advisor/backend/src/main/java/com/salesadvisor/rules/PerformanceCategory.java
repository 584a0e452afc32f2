package com.salesadvisor.rules;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PerformanceCategory {
    SIGNIFICANTLY_BELOW("significantly_below"),
    BELOW("below"),
    ON_TARGET("on_target"),
    ABOVE("above"),
    SIGNIFICANTLY_ABOVE("significantly_above");

    private final String code;

    PerformanceCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static PerformanceCategory of(double forecast, double benchmark) {
        double ratio = benchmark > 0 && Double.isFinite(benchmark) ? forecast / benchmark : 1.0;
        if (ratio < 0.85) {
            return SIGNIFICANTLY_BELOW;
        } else if (ratio < 0.95) {
            return BELOW;
        } else if (ratio <= 1.05) {
            return ON_TARGET;
        } else if (ratio <= 1.15) {
            return ABOVE;
        }
        return SIGNIFICANTLY_ABOVE;
    }
}

package com.meridian.backend.service.scheduler;

import java.util.Locale;

public enum RunOutcome {
    EMITTED,
    SUPPRESSED,
    NEUTRAL,
    FAILED,
    SKIPPED;

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

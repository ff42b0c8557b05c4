package com.meridian.backend.dto;

import com.meridian.backend.model.CriticalAlert;
import com.meridian.backend.service.marketdata.CacheStats;
import com.meridian.backend.service.scheduler.SymbolRunStatus;
import com.meridian.backend.service.signal.SignalDeduplicator;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class PipelineStatusResponse {
    Instant timestamp;
    boolean schedulerEnabled;
    String modelVersion;
    List<SymbolRunStatus> symbols;
    CacheStats cache;
    SignalDeduplicator.DedupStats dedup;
    int openPositions;
    MetricsSnapshot metrics;
    List<CriticalAlert> recentAlerts;
}

package com.vidnyan.smelldsl.domain.report;

import java.time.Instant;

/**
 * One user-facing progress entry.
 */
public record LogEntry(
    Instant timestamp,
    LogLevel level,
    String message
) {}

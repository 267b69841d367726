package com.vidnyan.smelldsl.domain.report;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress log of a single pipeline run.
 *
 * A new instance is created per run and handed explicitly to every stage that
 * reports progress. Each entry is also written to the application log.
 * Timestamps never go backwards within one log.
 */
@Slf4j
public class RunLog {

    private final Clock clock;
    private final List<LogEntry> entries = new ArrayList<>();
    private Instant last = Instant.MIN;

    public RunLog() {
        this(Clock.systemUTC());
    }

    public RunLog(Clock clock) {
        this.clock = clock;
    }

    public void info(String message) {
        append(LogLevel.INFO, message);
    }

    public void warning(String message) {
        append(LogLevel.WARNING, message);
    }

    public void error(String message) {
        append(LogLevel.ERROR, message);
    }

    public void success(String message) {
        append(LogLevel.SUCCESS, message);
    }

    public List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    public long count(LogLevel level) {
        return entries.stream().filter(e -> e.level() == level).count();
    }

    private void append(LogLevel level, String message) {
        Instant now = clock.instant();
        if (now.isBefore(last)) {
            now = last;
        }
        last = now;
        entries.add(new LogEntry(now, level, message));

        switch (level) {
            case WARNING -> log.warn(message);
            case ERROR -> log.error(message);
            default -> log.info(message);
        }
    }
}

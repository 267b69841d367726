package com.vidnyan.smelldsl.domain.report;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders progress entries as a single text block, one line per entry.
 */
public final class Transcript {

    private Transcript() {}

    public static String unified(List<LogEntry> entries) {
        return entries.stream()
                .map(Transcript::line)
                .collect(Collectors.joining("\n"));
    }

    static String line(LogEntry entry) {
        String marker = switch (entry.level()) {
            case SUCCESS -> "[✔]";
            case WARNING -> "[⚠]";
            case ERROR -> "[✖]";
            case INFO -> "[i]";
        };
        return marker + " " + entry.message();
    }
}

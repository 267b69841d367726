package com.vidnyan.smelldsl.domain.report;

/**
 * Severity of a progress entry shown to the user.
 */
public enum LogLevel {
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}

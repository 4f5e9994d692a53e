package com.subphot.metrics;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A companion file exists but its content cannot be turned into metrics.
 */
public class MetricParseException extends IOException {
    public MetricParseException(Path file, int lineNo, String message) {
        super(file + ":" + lineNo + ": " + message);
    }
}

package com.subphot.metrics;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

/**
 * Reads numeric keywords from a frame's embedded header. Keywords that are absent or not numeric are
 * left out of the returned map.
 */
public interface FrameHeaderReader {
    Map<String, Double> read(Path frame, Collection<String> keywords) throws IOException;
}

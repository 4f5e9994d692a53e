package com.subphot.metrics;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one photometry list into a {@link PhotometryTable}.
 */
public interface PhotometryReader {
    PhotometryTable read(Path photometryFile) throws IOException;
}

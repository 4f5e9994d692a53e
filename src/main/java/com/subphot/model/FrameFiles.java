package com.subphot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * A frame together with its detection list and photometry list.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FrameFiles {
    public final Path frame;
    public final Path sourceList;
    public final Path photometry;
}

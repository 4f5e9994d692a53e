package com.subphot.stage;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One invocation of a transform: the frame it works on, the values substituted into the command,
 * the output whose existence marks success, and any extra files the command also writes.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Task {
    public final Path input;
    @Singular
    public final Map<String, String> params;
    public final Path output;
    @Singular
    public final List<Path> sideOutputs;
}

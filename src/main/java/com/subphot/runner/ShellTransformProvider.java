package com.subphot.runner;

import com.subphot.config.Config;
import com.subphot.stage.ShellTransform;
import com.subphot.stage.Transform;

/**
 * Builds shell transforms from the configured command templates.
 */
public final class ShellTransformProvider implements TransformProvider {
    private final Config config;

    public ShellTransformProvider(Config config) {
        this.config = config;
    }

    @Override
    public Transform transformFor(TransformKind kind) {
        return new ShellTransform(
                kind.key(),
                config.requireString(kind.configKey()),
                config.workingDir(),
                config.getBoolean("app.debug", false)
        );
    }
}

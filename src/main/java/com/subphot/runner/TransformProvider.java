package com.subphot.runner;

import com.subphot.stage.Transform;

public interface TransformProvider {
    Transform transformFor(TransformKind kind);
}

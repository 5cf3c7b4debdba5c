package com.di.importgate.pipeline;

public enum StageStatus {
    PASSED,
    FAILED,
    SKIPPED
}

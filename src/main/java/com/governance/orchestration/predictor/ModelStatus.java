package com.governance.orchestration.predictor;

public enum ModelStatus {
    NOT_TRAINED,
    INSUFFICIENT_SAMPLES,
    TRAINED,
    FAILED
}

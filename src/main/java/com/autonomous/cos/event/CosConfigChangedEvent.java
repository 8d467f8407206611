package com.autonomous.cos.event;

import com.autonomous.cos.model.CosConfig;

public record CosConfigChangedEvent(CosConfig previous, CosConfig current) {

    public boolean evaluationIntervalChanged() {
        return previous == null || previous.getEvaluationIntervalMs() != current.getEvaluationIntervalMs();
    }

    public boolean healthIntervalChanged() {
        return previous == null || previous.getHealthCheckIntervalMs() != current.getHealthCheckIntervalMs();
    }
}

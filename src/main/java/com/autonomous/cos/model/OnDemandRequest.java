package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnDemandRequest {
    private String id;
    private String taskType;
    // null means the request is not tied to a particular app
    private String appId;
    private Instant requestedAt;

    public boolean matches(String taskType, String appId) {
        if (!this.taskType.equals(taskType)) {
            return false;
        }
        return this.appId == null || this.appId.equals(appId);
    }
}

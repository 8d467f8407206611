package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-app override of a task type's schedule. A null field inherits the global value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppOverride {
    private Boolean enabled;
    private IntervalType interval;
}

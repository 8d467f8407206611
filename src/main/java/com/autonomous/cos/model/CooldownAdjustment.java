package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CooldownAdjustment {
    private double multiplier;
    private boolean skip;
    private String reason;

    public static CooldownAdjustment neutral(String reason) {
        return new CooldownAdjustment(1.0, false, reason);
    }
}

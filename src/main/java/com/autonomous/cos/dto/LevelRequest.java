package com.autonomous.cos.dto;

import com.autonomous.cos.model.AutonomyLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LevelRequest {
    private AutonomyLevel level;
}

package com.eyelevel.imageprocessor.model;

import java.time.Instant;

public record PhaseTransition(String phaseLabel, PhaseStatus status, Instant timestamp) {
}

package com.apimonitor.anomaly.detection.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/** Trained models; {@code lastTrainingTime} is null until the first training completes. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ModelsResponseDto(Instant lastTrainingTime, boolean retrainDue, List<ModelStatusDto> models) {
}

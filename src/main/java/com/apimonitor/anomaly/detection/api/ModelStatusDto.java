package com.apimonitor.anomaly.detection.api;

import com.apimonitor.anomaly.detection.engine.TrainedModel;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ModelStatusDto(String signal, String algorithm, List<String> featureNames,
                             Instant trainedAt, int sampleCount) {

    public static ModelStatusDto from(TrainedModel model) {
        return new ModelStatusDto(model.getSignal().wireName(), model.getAlgorithm(), model.getFeatureNames(),
                model.getTrainedAt(), model.getSampleCount());
    }
}

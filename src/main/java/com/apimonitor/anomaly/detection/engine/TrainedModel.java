package com.apimonitor.anomaly.detection.engine;

import com.apimonitor.anomaly.detection.domain.AnomalyType;
import com.apimonitor.anomaly.detection.domain.FeatureRow;
import com.apimonitor.anomaly.detection.ml.OutlierDetector;
import com.apimonitor.anomaly.detection.ml.StandardScaler;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A fitted outlier model with the scaler and feature order it was trained with.
 * Never mutated after construction; a retrain publishes a new instance.
 */
@Value
@Builder
public class TrainedModel {

    AnomalyType signal;
    String algorithm;
    OutlierDetector detector;
    StandardScaler scaler;
    List<String> featureNames;
    Instant trainedAt;
    int sampleCount;

    /** Feature matrix for the given rows, standardized with this model's scaler. */
    public double[][] standardize(List<FeatureRow> rows) {
        return scaler.transform(featureMatrix(rows, featureNames));
    }

    static double[][] featureMatrix(List<FeatureRow> rows, List<String> featureNames) {
        double[][] matrix = new double[rows.size()][featureNames.size()];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < featureNames.size(); j++) {
                matrix[i][j] = rows.get(i).feature(featureNames.get(j));
            }
        }
        return matrix;
    }
}

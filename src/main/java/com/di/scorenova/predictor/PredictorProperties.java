package com.di.scorenova.predictor;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binding for the built-in predictors.
 *
 * <pre>
 * scorenova:
 *   predictors:
 *     linear:
 *       enabled: true
 *       name: LinearRisk
 *       weights: 0.04,0.5,0.0,0.0005,0.05
 *       bias: -4.0
 *     threshold-vote:
 *       enabled: true
 *       name: ThresholdVote
 *       thresholds: 45,3.0,1018,2600,27
 * </pre>
 *
 * Feature order is temperature, vibration, pressure, rpm, current.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.predictors")
public class PredictorProperties {

    private Linear linear = new Linear();

    private ThresholdVote thresholdVote = new ThresholdVote();

    @Data
    public static class Linear {
        private boolean enabled = true;
        private String name = "LinearRisk";
        private List<Double> weights = new ArrayList<>(List.of(0.04, 0.5, 0.0, 0.0005, 0.05));
        private double bias = -4.0;
    }

    @Data
    public static class ThresholdVote {
        private boolean enabled = true;
        private String name = "ThresholdVote";
        private List<Double> thresholds = new ArrayList<>(List.of(45.0, 3.0, 1018.0, 2600.0, 27.0));
    }

    static double[] toArray(List<Double> values) {
        if (values == null) return new double[0];
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            out[i] = v != null ? v : 0.0;
        }
        return out;
    }
}

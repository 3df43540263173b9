package com.di.scorenova.predictor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinearRiskPredictor Tests")
class LinearRiskPredictorTest {

    @Test
    @DisplayName("Should return 0.5 with zero confidence at the decision boundary")
    void testPredict_Boundary() {
        LinearRiskPredictor p = new LinearRiskPredictor("lin", new double[]{1.0, 1.0}, 0.0);
        PredictorScore s = p.predict(FeatureVector.of(0.0, 0.0));
        assertEquals(0.5, s.getScore(), 1e-9);
        assertEquals(0.0, s.getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Should increase with weighted features and stay in [0,1]")
    void testPredict_Monotonic() {
        LinearRiskPredictor p = new LinearRiskPredictor("lin", new double[]{0.5}, -1.0);
        double low = p.predict(FeatureVector.of(0.0)).getScore();
        double high = p.predict(FeatureVector.of(10.0)).getScore();
        assertTrue(high > low);
        assertTrue(low > 0.0 && high < 1.0);
    }

    @Test
    @DisplayName("Should ignore features beyond the weight vector")
    void testPredict_ExtraFeaturesIgnored() {
        LinearRiskPredictor p = new LinearRiskPredictor("lin", new double[]{1.0}, 0.0);
        assertEquals(p.predict(FeatureVector.of(2.0)).getScore(),
                     p.predict(FeatureVector.of(2.0, 1000.0)).getScore(), 1e-12);
    }

    @Test
    @DisplayName("Should reject non-finite features as permanent failures")
    void testPredict_NonFinite() {
        LinearRiskPredictor p = new LinearRiskPredictor("lin", new double[]{1.0}, 0.0);
        PredictionException e = assertThrows(PredictionException.class,
                () -> p.predict(FeatureVector.of(Double.POSITIVE_INFINITY)));
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Should reject blank name and empty weights")
    void testConstructor_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> new LinearRiskPredictor(" ", new double[]{1.0}, 0));
        assertThrows(IllegalArgumentException.class, () -> new LinearRiskPredictor("lin", new double[0], 0));
    }
}

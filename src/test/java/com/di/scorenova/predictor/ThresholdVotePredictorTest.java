package com.di.scorenova.predictor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ThresholdVotePredictor Tests")
class ThresholdVotePredictorTest {

    private final ThresholdVotePredictor predictor =
            new ThresholdVotePredictor("vote", new double[]{45.0, 3.0, 1018.0, 2600.0});

    @Test
    @DisplayName("Should score the fraction of features over their threshold")
    void testPredict_Fraction() {
        assertEquals(0.0, predictor.predict(FeatureVector.of(20, 1, 1000, 1500)).getScore(), 1e-12);
        assertEquals(0.5, predictor.predict(FeatureVector.of(50, 4, 1000, 1500)).getScore(), 1e-12);
        assertEquals(1.0, predictor.predict(FeatureVector.of(50, 4, 1020, 3000)).getScore(), 1e-12);
    }

    @Test
    @DisplayName("Should not report a confidence")
    void testPredict_NoConfidence() {
        assertNull(predictor.predict(FeatureVector.of(50, 4, 1000, 1500)).getConfidence());
    }

    @Test
    @DisplayName("Should only let features with a threshold vote")
    void testPredict_ShortVector() {
        assertEquals(1.0, predictor.predict(FeatureVector.of(50)).getScore(), 1e-12);
    }

    @Test
    @DisplayName("Should fail permanently on NaN")
    void testPredict_NaN() {
        PredictionException e = assertThrows(PredictionException.class,
                () -> predictor.predict(FeatureVector.of(Double.NaN, 1, 1, 1)));
        assertFalse(e.isRetryable());
    }
}

package com.di.scorenova.predictor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FeatureVector Tests")
class FeatureVectorTest {

    @Test
    @DisplayName("Should copy the input array")
    void testOf_DefensiveCopyIn() {
        double[] raw = {1.0, 2.0};
        FeatureVector v = FeatureVector.of(raw);
        raw[0] = 99.0;
        assertEquals(1.0, v.get(0));
    }

    @Test
    @DisplayName("Should copy on read")
    void testToArray_DefensiveCopyOut() {
        FeatureVector v = FeatureVector.of(1.0, 2.0);
        v.toArray()[1] = 99.0;
        assertEquals(2.0, v.get(1));
        assertEquals(2, v.length());
    }

    @Test
    @DisplayName("Should compare by value")
    void testEquals() {
        assertEquals(FeatureVector.of(1.0, 2.0), FeatureVector.of(1.0, 2.0));
        assertEquals(FeatureVector.of(1.0, 2.0).hashCode(), FeatureVector.of(1.0, 2.0).hashCode());
        assertNotEquals(FeatureVector.of(1.0), FeatureVector.of(1.0, 0.0));
    }
}

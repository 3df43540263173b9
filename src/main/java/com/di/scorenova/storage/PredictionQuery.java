package com.di.scorenova.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Filters for {@link LakeStorageConnector#retrievePredictions}. Every filter is
 * optional; date bounds are inclusive and apply to the record timestamp.
 */
@Value
@Builder
public class PredictionQuery {

    public static final int DEFAULT_LIMIT = 1000;

    Instant startDate;
    Instant endDate;

    /** Empty or null matches every equipment id. */
    Set<String> equipmentIds;

    /** Matches records holding a score from any of these predictors. */
    Set<String> modelNames;

    Integer limit;

    public int effectiveLimit() {
        return limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
    }

    public static PredictionQuery all() {
        return PredictionQuery.builder().build();
    }
}

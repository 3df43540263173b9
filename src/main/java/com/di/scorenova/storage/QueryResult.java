package com.di.scorenova.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class QueryResult {

    /** Newest first. */
    List<StoredPredictionRecord> predictions;

    Metadata metadata;

    @Value
    @Builder
    public static class Metadata {
        /** Matches before the limit was applied. */
        int totalRecords;
        int returnedRecords;
        /** Objects skipped because their content could not be parsed. */
        List<String> unreadableObjects;
        PredictionQuery query;
        Instant retrievedAt;
    }
}

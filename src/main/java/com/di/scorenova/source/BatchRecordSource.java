package com.di.scorenova.source;

import com.di.scorenova.pipeline.InputRecord;

import java.util.List;

/**
 * Supplies the records for a scheduled batch.
 */
public interface BatchRecordSource {

    /**
     * @return the next batch; may be empty when there is nothing to score
     */
    List<InputRecord> loadBatch();

    /** Short description for logs and status. */
    String describe();
}

package com.di.scorenova.source;

import com.di.scorenova.pipeline.InputRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates equipment telemetry: one reading per equipment id {@code EQ0001…},
 * spaced an hour apart going back from now. Value ranges:
 * temperature 20–50, vibration 1–4, pressure 1010–1020, rpm 1000–3000, current 10–30.
 */
public class SyntheticRecordSource implements BatchRecordSource {

    private final int    count;
    private final Random random;
    private final Clock  clock;

    public SyntheticRecordSource(int count, Long seed, Clock clock) {
        if (count < 1) {
            throw new IllegalArgumentException("Synthetic batch size must be >= 1, got " + count);
        }
        this.count  = count;
        this.random = seed != null ? new Random(seed) : new Random();
        this.clock  = clock;
    }

    @Override
    public List<InputRecord> loadBatch() {
        Instant now = clock.instant();
        List<InputRecord> out = new ArrayList<>(count);
        synchronized (random) {
            for (int i = 0; i < count; i++) {
                out.add(InputRecord.builder()
                        .equipmentId(String.format("EQ%04d", i + 1))
                        .timestamp(now.minus(Duration.ofHours(i)))
                        .field("temperature", 20 + random.nextDouble() * 30)
                        .field("vibration",   1 + random.nextDouble() * 3)
                        .field("pressure",    1010 + random.nextDouble() * 10)
                        .field("rpm",         1000 + random.nextDouble() * 2000)
                        .field("current",     10 + random.nextDouble() * 20)
                        .build());
            }
        }
        return out;
    }

    @Override
    public String describe() {
        return "synthetic(" + count + ")";
    }
}

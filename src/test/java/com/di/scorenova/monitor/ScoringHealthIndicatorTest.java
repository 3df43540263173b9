package com.di.scorenova.monitor;

import com.di.scorenova.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScoringHealthIndicator Tests")
class ScoringHealthIndicatorTest {

    private MutableClock clock;
    private RunMonitor monitor;
    private ScoringHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-02-01T02:00:00Z");
        monitor = new RunMonitor(new RunMonitorProperties(), null, clock);
        indicator = new ScoringHealthIndicator(monitor);
    }

    private void record(int failed) {
        Instant end = clock.instant();
        monitor.recordRun(RunOutcome.builder().startTime(end.minusSeconds(60)).endTime(end)
                .recordsProcessed(10 - failed).recordsFailed(failed).build());
    }

    @Test
    @DisplayName("Should report UP with run details when healthy")
    void testHealth_Up() {
        record(0);
        Health health = indicator.health();
        assertEquals(Status.UP, health.getStatus());
        assertEquals(1, health.getDetails().get("totalRuns"));
        assertNotNull(health.getDetails().get("lastRunAt"));
    }

    @Test
    @DisplayName("Should report the custom DEGRADED status")
    void testHealth_Degraded() {
        record(0);
        record(1);
        record(1);
        assertEquals("DEGRADED", indicator.health().getStatus().getCode());
    }

    @Test
    @DisplayName("Should report DOWN when runs are stale")
    void testHealth_Down() {
        clock.advance(Duration.ofHours(30));
        Health health = indicator.health();
        assertEquals(Status.DOWN, health.getStatus());
        assertFalse(((java.util.List<?>) health.getDetails().get("issues")).isEmpty());
    }
}

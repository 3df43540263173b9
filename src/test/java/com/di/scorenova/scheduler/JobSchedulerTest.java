package com.di.scorenova.scheduler;

import com.di.scorenova.exception.ValidationException;
import com.di.scorenova.support.MutableClock;
import com.di.scorenova.support.TestMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobScheduler Tests")
class JobSchedulerTest {

    private JobSchedulerProperties props;
    private MutableClock clock;
    private List<Long> sleeps;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        props = new JobSchedulerProperties();
        props.setPollIntervalMs(10);
        clock = MutableClock.at("2024-01-01T03:00:00Z");
        sleeps = new ArrayList<>();
        scheduler = new JobScheduler(props, TestMetrics.collector(), clock, sleeps::add);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    // ============================================================================
    // createSchedule
    // ============================================================================

    @Test
    @DisplayName("Should schedule a daily 02:00 run created at 03:00 for the next day")
    void testCreateSchedule_DailyNextDay() {
        ScheduleSpec spec = scheduler.createSchedule("daily", "02:00", "UTC");

        assertEquals(ScheduleFrequency.DAILY, spec.getFrequency());
        assertEquals("0 0 2 * * *", spec.getCronExpression());
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), spec.getNextRunAt());
        assertTrue(spec.getNextRunAt().isAfter(clock.instant()));
    }

    @Test
    @DisplayName("Should use only the minute for hourly schedules")
    void testCreateSchedule_Hourly() {
        ScheduleSpec spec = scheduler.createSchedule("HOURLY", "17:30", "UTC");
        assertEquals("0 30 * * * *", spec.getCronExpression());
        assertEquals(Instant.parse("2024-01-01T03:30:00Z"), spec.getNextRunAt());
    }

    @Test
    @DisplayName("Should run weekly schedules on Sunday")
    void testCreateSchedule_Weekly() {
        ScheduleSpec spec = scheduler.createSchedule("Weekly", "02:00", "UTC");
        assertEquals(Instant.parse("2024-01-07T02:00:00Z"), spec.getNextRunAt());
    }

    @Test
    @DisplayName("Should interpret the time of day in the schedule's timezone")
    void testCreateSchedule_Timezone() {
        ScheduleSpec spec = scheduler.createSchedule("daily", "02:00", "America/New_York");
        assertEquals(Instant.parse("2024-01-01T07:00:00Z"), spec.getNextRunAt());
    }

    @Test
    @DisplayName("Should default time to 02:00 and timezone to the configured zone")
    void testCreateSchedule_Defaults() {
        ScheduleSpec spec = scheduler.createSchedule("daily", null, null);
        assertEquals("02:00", spec.getTimeOfDay());
        assertEquals("UTC", spec.getTimezone().getId());
    }

    @ParameterizedTest
    @ValueSource(strings = {"25:00", "2:00", "02:60", "0200", "noon", ""})
    @DisplayName("Should reject malformed times of day")
    void testCreateSchedule_InvalidTime(String time) {
        assertThrows(ValidationException.class, () -> scheduler.createSchedule("daily", time, "UTC"));
    }

    @Test
    @DisplayName("Should reject unknown frequencies and timezones")
    void testCreateSchedule_InvalidFrequencyOrZone() {
        assertThrows(ValidationException.class, () -> scheduler.createSchedule("monthly", "02:00", "UTC"));
        assertThrows(ValidationException.class, () -> scheduler.createSchedule(null, "02:00", "UTC"));
        assertThrows(ValidationException.class, () -> scheduler.createSchedule("daily", "02:00", "Mars/Olympus"));
    }

    // ============================================================================
    // Registry
    // ============================================================================

    @Test
    @DisplayName("Should register an enabled, idle schedule with a descriptive id")
    void testSchedule_Registers() {
        String id = scheduler.schedule(scheduler.createSchedule("daily", "02:00", "UTC"), ctx -> { });

        assertTrue(id.matches("schedule_daily_0200_[0-9a-f]{8}"), id);
        ScheduleView view = scheduler.getSchedule(id).orElseThrow();
        assertEquals(ScheduleState.IDLE, view.getState());
        assertTrue(view.isEnabled());
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), view.getNextRunAt());
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), scheduler.getNextRunAt().orElseThrow());
        assertEquals(1, scheduler.getScheduleCount());
    }

    @Test
    @DisplayName("Should remove idempotently")
    void testRemoveSchedule_Idempotent() {
        String id = scheduler.schedule(scheduler.createSchedule("daily", "02:00", "UTC"), ctx -> { });
        assertTrue(scheduler.removeSchedule(id));
        assertFalse(scheduler.removeSchedule(id));
        assertTrue(scheduler.getSchedule(id).isEmpty());
        assertTrue(scheduler.getNextRunAt().isEmpty());
    }

    @Test
    @DisplayName("Should not fire disabled schedules and recompute next run on re-enable")
    void testSetEnabled() {
        String id = scheduler.schedule(scheduler.createSchedule("hourly", "00:00", "UTC"), ctx -> { });
        assertTrue(scheduler.setEnabled(id, false));
        assertEquals(ScheduleState.DISABLED, scheduler.getSchedule(id).orElseThrow().getState());

        clock.advance(Duration.ofHours(5));
        assertEquals(0, scheduler.pollOnce());

        assertTrue(scheduler.setEnabled(id, true));
        assertEquals(Instant.parse("2024-01-01T09:00:00Z"), scheduler.getSchedule(id).orElseThrow().getNextRunAt());
        assertFalse(scheduler.setEnabled("missing", true));
    }

    // ============================================================================
    // Firing
    // ============================================================================

    @Test
    @DisplayName("Should fire once when due and advance the next run strictly past now")
    void testPollOnce_Fires() {
        AtomicInteger runs = new AtomicInteger();
        String id = scheduler.schedule(scheduler.createSchedule("daily", "02:00", "UTC"), ctx -> runs.incrementAndGet());

        assertEquals(0, scheduler.pollOnce());
        clock.set(Instant.parse("2024-01-02T02:00:00Z"));
        assertEquals(1, scheduler.pollOnce());
        assertEquals(ScheduleState.TRIGGERED, scheduler.getSchedule(id).orElseThrow().getState());
        assertEquals(Instant.parse("2024-01-03T02:00:00Z"), scheduler.getSchedule(id).orElseThrow().getNextRunAt());

        assertEquals(1, scheduler.dispatchPending());
        ScheduleView view = scheduler.getSchedule(id).orElseThrow();
        assertEquals(1, runs.get());
        assertEquals(ScheduleState.IDLE, view.getState());
        assertEquals(1, view.getRunCount());
        assertEquals(Boolean.TRUE, view.getLastSuccess());
        assertEquals(1, view.getLastAttempts());
        assertEquals(clock.instant(), view.getLastRun());
    }

    @Test
    @DisplayName("Should skip a due fire while the previous one is still running")
    void testPollOnce_SkipIfRunning() {
        String id = scheduler.schedule(scheduler.createSchedule("hourly", "00:00", "UTC"), ctx -> { });

        clock.set(Instant.parse("2024-01-01T04:00:00Z"));
        assertEquals(1, scheduler.pollOnce());
        clock.set(Instant.parse("2024-01-01T05:00:00Z"));
        assertEquals(0, scheduler.pollOnce());

        assertEquals(1, scheduler.pendingEventCount());
        assertEquals(1, scheduler.getSchedule(id).orElseThrow().getSkippedCount());
        scheduler.dispatchPending();
        assertEquals(1, scheduler.getSchedule(id).orElseThrow().getRunCount());
    }

    @Test
    @DisplayName("Should retry a failing job with backoff and record the attempts")
    void testExecute_RetriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> attempts = new ArrayList<>();
        String id = scheduler.schedule(scheduler.createSchedule("hourly", "00:00", "UTC"), ctx -> {
            attempts.add(ctx.getAttempt());
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("source unavailable");
        });
        clock.set(Instant.parse("2024-01-01T04:00:00Z"));
        scheduler.pollOnce();
        scheduler.dispatchPending();

        ScheduleView view = scheduler.getSchedule(id).orElseThrow();
        assertEquals(Boolean.TRUE, view.getLastSuccess());
        assertEquals(3, view.getLastAttempts());
        assertEquals(List.of(1, 2, 3), attempts);
        assertEquals(List.of(2000L, 4000L), sleeps);
    }

    @Test
    @DisplayName("Should record the last error once retries are exhausted")
    void testExecute_Exhausted() {
        String id = scheduler.schedule(scheduler.createSchedule("hourly", "00:00", "UTC"), ctx -> {
            throw new IllegalStateException("lake offline");
        });
        clock.set(Instant.parse("2024-01-01T04:00:00Z"));
        scheduler.pollOnce();
        scheduler.dispatchPending();

        ScheduleView view = scheduler.getSchedule(id).orElseThrow();
        assertEquals(Boolean.FALSE, view.getLastSuccess());
        assertEquals("lake offline", view.getLastError());
        assertEquals(3, view.getLastAttempts());
        assertEquals(ScheduleState.IDLE, view.getState());
    }

    @Test
    @DisplayName("Should cancel the in-flight token when the schedule is removed")
    void testRemoveSchedule_CancelsInFlight() {
        AtomicBoolean cancelledSeen = new AtomicBoolean();
        String[] id = new String[1];
        id[0] = scheduler.schedule(scheduler.createSchedule("hourly", "00:00", "UTC"), ctx -> {
            scheduler.removeSchedule(id[0]);
            cancelledSeen.set(ctx.getCancellationToken().isCancelled());
        });
        clock.set(Instant.parse("2024-01-01T04:00:00Z"));
        scheduler.pollOnce();
        scheduler.dispatchPending();

        assertTrue(cancelledSeen.get());
        assertEquals(0, scheduler.getScheduleCount());
    }

    // ============================================================================
    // Lifecycle
    // ============================================================================

    @Test
    @DisplayName("Should fire on a worker thread once started")
    void testStart_FiresOnWorker() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        AtomicBoolean onWorker = new AtomicBoolean();
        scheduler.schedule(scheduler.createSchedule("hourly", "00:00", "UTC"), ctx -> {
            onWorker.set(Thread.currentThread().getName().startsWith("scheduler-worker-"));
            fired.countDown();
        });
        clock.set(Instant.parse("2024-01-01T04:00:00Z"));

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertTrue(onWorker.get());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}

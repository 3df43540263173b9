package com.di.scorenova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Carries the SLF4J MDC of the submitting thread ({@code runId} from the
 * orchestrator, {@code scheduleId} from the scheduler) onto scoring workers and
 * scheduler worker threads.
 * <p>
 * Wrapped tasks install the captured entries for their duration and then put back
 * whatever the worker thread had under those keys, so pooled threads never keep a
 * finished run's id.
 * <p>
 * Usage:
 * <ul>
 *   <li>{@code CompletableFuture.supplyAsync(MdcPropagation.wrapSupplier(() -> score(r)), pool)}</li>
 *   <li>{@code new Thread(MdcPropagation.wrapRunnable(() -> execute(event)))}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";
    public static final String SCHEDULE_ID = "scheduleId";

    private MdcPropagation() {
    }

    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> captured = copyMdc();
        return () -> runWithMdcContext(captured, task);
    }

    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> captured = copyMdc();
        return () -> {
            Map<String, String> previous = install(captured);
            try {
                return task.get();
            } finally {
                restore(previous);
            }
        };
    }

    /**
     * Runs {@code task} on the current thread with {@code contextMap} installed.
     */
    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        Map<String, String> previous = install(contextMap);
        try {
            task.run();
        } finally {
            restore(previous);
        }
    }

    /** Snapshot of the current thread's MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    /** Puts {@code entries} into the MDC and returns the values they replaced (null where absent). */
    private static Map<String, String> install(Map<String, String> entries) {
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> previous = new HashMap<>();
        entries.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return previous;
    }

    private static void restore(Map<String, String> previous) {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}

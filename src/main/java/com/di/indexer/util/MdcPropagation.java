package com.di.indexer.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Carries SLF4J MDC (e.g. the {@code window} being scanned) from the ingestion
 * thread into bundle-prefetch workers, so their log lines correlate with the
 * window and submission that scheduled them.
 *
 * <p>Usage: {@code executor.submit(MdcPropagation.wrapCallable(() -> fetch(p)));}
 */
public final class MdcPropagation {

    public static final String UID    = "uid";
    public static final String WINDOW = "window";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Callable that sets it for
     * the duration of the task, clearing it in {@code finally}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs {@code task} with {@code key=value} added to MDC, restoring the
     * previous value afterwards.
     */
    public static <T> T callWith(String key, String value, Supplier<T> task) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        try {
            return task.get();
        } finally {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }

    /** Copy of the current MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}

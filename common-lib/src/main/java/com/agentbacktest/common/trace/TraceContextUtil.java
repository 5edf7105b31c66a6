package com.agentbacktest.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.LocalDate;

/**
 * Names decision cycles and carries their identity (decision id, symbol and trading date)
 * through reactive pipelines and into log lines.
 *
 * <p>A signal cycle is named {@code SYMBOL-yyyy-MM-dd}; a forced exit of the same symbol on
 * the same day is named {@code exit-SYMBOL-yyyy-MM-dd}, so both can appear in one run.
 *
 * <p>Reactor Context is the source of truth inside a pipeline. MDC is only written as a
 * temporary bridge around a log statement, never as a persistent ThreadLocal store,
 * because agent calls hop between bounded-elastic threads.
 *
 * <pre>
 *     return TraceContextUtil.withCycle(cycle, symbol, date);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String DECISION_ID_KEY = "decisionId";
    public static final String SYMBOL_KEY      = "symbol";
    public static final String DATE_KEY        = "tradeDate";

    static final String EXIT_PREFIX = "exit-";
    static final String UNKNOWN     = "unknown";

    private TraceContextUtil() {}

    // ── Naming ─────────────────────────────────────────────────────────────

    public static String decisionId(String symbol, LocalDate date) {
        return symbol + "-" + date;
    }

    public static String exitDecisionId(String symbol, LocalDate date) {
        return EXIT_PREFIX + decisionId(symbol, date);
    }

    public static boolean isExit(String decisionId) {
        return decisionId != null && decisionId.startsWith(EXIT_PREFIX);
    }

    // ── Reactor Context ────────────────────────────────────────────────────

    /**
     * Stores the identity of the cycle deciding {@code symbol} on {@code date} in the
     * Reactor Context of {@code mono}. Call at the end of pipeline assembly:
     * {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withCycle(Mono<T> mono, String symbol, LocalDate date) {
        return mono.contextWrite(ctx -> ctx
            .put(DECISION_ID_KEY, decisionId(symbol, date))
            .put(SYMBOL_KEY, symbol)
            .put(DATE_KEY, date.toString()));
    }

    /** Returns {@code "unknown"} if absent, never {@code null}. */
    public static String getDecisionId(ContextView ctx) {
        return ctx.getOrDefault(DECISION_ID_KEY, UNKNOWN);
    }

    // ── MDC bridge ─────────────────────────────────────────────────────────

    /** Bridges the cycle identity found in {@code ctx} into MDC for {@code logAction} only. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getDecisionId(ctx), ctx.getOrDefault(SYMBOL_KEY, UNKNOWN),
            ctx.getOrDefault(DATE_KEY, UNKNOWN), logAction);
    }

    /**
     * Bridges the cycle identity into MDC for the duration of {@code logAction}. Values
     * present before the call are put back afterwards.
     */
    public static void withMdc(String decisionId, String symbol, String date, Runnable logAction) {
        String previousId = MDC.get(DECISION_ID_KEY);
        String previousSymbol = MDC.get(SYMBOL_KEY);
        String previousDate = MDC.get(DATE_KEY);
        MDC.put(DECISION_ID_KEY, decisionId);
        MDC.put(SYMBOL_KEY, symbol);
        MDC.put(DATE_KEY, date);
        try {
            logAction.run();
        } finally {
            restore(DECISION_ID_KEY, previousId);
            restore(SYMBOL_KEY, previousSymbol);
            restore(DATE_KEY, previousDate);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}

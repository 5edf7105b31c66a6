package com.agentbacktest.engine.orchestrator;

import com.agentbacktest.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.time.LocalDate;
import java.util.function.Consumer;

/**
 * Logs the journey of one decision cycle through the orchestrator phases without
 * touching pipeline behavior.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #DATA_COLLECTED}      snapshot and recent bars gathered</li>
 *   <li>{@link #ANALYSTS_COMPLETED}  the four analyst opinions are in</li>
 *   <li>{@link #DEBATE_SYNTHESIZED}  bull/bear theses merged into a provisional action</li>
 *   <li>{@link #RISK_ASSESSED}       risk metrics and stance scores computed</li>
 *   <li>{@link #DECISION_FINALIZED}  stance chosen, decision assembled</li>
 *   <li>{@link #EXECUTION_SETTLED}   decision filled, rejected or held</li>
 * </ol>
 *
 * <p>Intermediate stages log at DEBUG unless the run is verbose; the settled outcome of
 * every cycle is always logged at INFO.
 * <pre>
 *     .doOnEach(flowLogger.stage(DecisionFlowLogger.RISK_ASSESSED, verbose))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String DATA_COLLECTED     = "DATA_COLLECTED";
    public static final String ANALYSTS_COMPLETED = "ANALYSTS_COMPLETED";
    public static final String DEBATE_SYNTHESIZED = "DEBATE_SYNTHESIZED";
    public static final String RISK_ASSESSED      = "RISK_ASSESSED";
    public static final String DECISION_FINALIZED = "DECISION_FINALIZED";
    public static final String EXECUTION_SETTLED  = "EXECUTION_SETTLED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName}. The cycle identity is read
     * from the Reactor Context carried by the signal and bridged into MDC for the log call
     * only. Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName, boolean verbose) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String decisionId = TraceContextUtil.getDecisionId(signal.getContextView());
            TraceContextUtil.withMdc(signal.getContextView(), () -> logStageLine(stageName, decisionId, verbose));
        };
    }

    /** Logs {@code stageName} for the cycle deciding {@code symbol} on {@code date}. */
    public void logStage(String stageName, String symbol, LocalDate date, boolean verbose) {
        String decisionId = TraceContextUtil.decisionId(symbol, date);
        TraceContextUtil.withMdc(decisionId, symbol, date.toString(),
            () -> logStageLine(stageName, decisionId, verbose));
    }

    /** One INFO line per settled cycle. */
    public void logSettled(DecisionRecord record) {
        String decisionId = record.decision().id();
        TraceContextUtil.withMdc(decisionId, record.symbol(), record.decision().date().toString(), () ->
            log.info("[DecisionFlow] stage={} decisionId={} symbol={} action={} status={} confidence={}",
                     EXECUTION_SETTLED, decisionId, record.symbol(), record.decision().action(),
                     record.status(), String.format("%.3f", record.decision().confidence()))
        );
    }

    private static void logStageLine(String stageName, String decisionId, boolean verbose) {
        if (verbose) {
            log.info("[DecisionFlow] stage={} decisionId={}", stageName, decisionId);
        } else {
            log.debug("[DecisionFlow] stage={} decisionId={}", stageName, decisionId);
        }
    }
}

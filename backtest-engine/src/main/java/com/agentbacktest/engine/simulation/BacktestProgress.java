package com.agentbacktest.engine.simulation;

import com.agentbacktest.engine.orchestrator.DecisionStatus;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Live progress of one run: written by the thread driving the simulation, readable
 * from any thread.
 */
public class BacktestProgress {

    public enum Status { IDLE, RUNNING, COMPLETE, CANCELLED, FAILED }

    private volatile Status    status = Status.IDLE;
    private volatile String    runId;
    private volatile LocalDate currentDate;
    private volatile int       datesDone;
    private volatile int       datesTotal;
    private volatile int       decisions;
    private volatile int       executed;
    private volatile int       rejected;
    private volatile String    errorMessage;
    private volatile Instant   startedAt;

    // ── mutators (simulation thread only) ──────────────────────────────────

    public void start(String runId, int datesTotal, Instant startedAt) {
        this.runId        = runId;
        this.datesTotal   = datesTotal;
        this.startedAt    = startedAt;
        this.status       = Status.RUNNING;
    }

    public void advance(LocalDate date) { this.currentDate = date; }

    public void dateDone()               { this.datesDone++; }

    public void recordDecision(DecisionStatus outcome) {
        this.decisions++;
        if (outcome == DecisionStatus.EXECUTED) this.executed++;
        if (outcome == DecisionStatus.REJECTED) this.rejected++;
    }

    public void complete()               { this.status = Status.COMPLETE; }

    public void cancelled()              { this.status = Status.CANCELLED; }

    public void failed(String message)   { this.errorMessage = message; this.status = Status.FAILED; }

    // ── accessors ──────────────────────────────────────────────────────────

    public Status    getStatus()       { return status; }
    public String    getRunId()        { return runId; }
    public LocalDate getCurrentDate()  { return currentDate; }
    public int       getDatesDone()    { return datesDone; }
    public int       getDatesTotal()   { return datesTotal; }
    public int       getDecisions()    { return decisions; }
    public int       getExecuted()     { return executed; }
    public int       getRejected()     { return rejected; }
    public String    getErrorMessage() { return errorMessage; }
    public Instant   getStartedAt()    { return startedAt; }

    public double getProgressPct() {
        return datesTotal > 0 ? (double) datesDone / datesTotal * 100.0 : 0.0;
    }
}

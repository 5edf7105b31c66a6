package com.agentbacktest.engine.simulation;

/**
 * Receives the result of every finished run, cancelled runs included.
 */
public interface BacktestListener {

    void onComplete(BacktestResult result);
}

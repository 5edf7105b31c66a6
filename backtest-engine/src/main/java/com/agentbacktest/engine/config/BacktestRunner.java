package com.agentbacktest.engine.config;

import com.agentbacktest.engine.simulation.SimulationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs the configured backtest once at startup. Active only in profile {@code backtest}.
 */
@Component
@Profile("backtest")
public class BacktestRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final SimulationEngine engine;
    private final BacktestConfig   config;

    public BacktestRunner(SimulationEngine engine, BacktestConfig config) {
        this.engine = engine;
        this.config = config;
    }

    @Override
    public void run(String... args) {
        log.info("[Runner] Starting configured backtest. symbols={} from={} to={}",
                 config.symbols(), config.startDate(), config.endDate());
        engine.run(config);
    }
}

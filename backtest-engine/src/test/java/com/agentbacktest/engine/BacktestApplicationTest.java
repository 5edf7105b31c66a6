package com.agentbacktest.engine;

import com.agentbacktest.engine.config.BacktestConfig;
import com.agentbacktest.engine.orchestrator.DecisionStatus;
import com.agentbacktest.engine.simulation.BacktestResult;
import com.agentbacktest.engine.simulation.SimulationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "backtest.symbols=AAPL",
    "backtest.start-date=2024-03-04",
    "backtest.end-date=2024-03-15",
    "backtest.data-dir=src/test/resources/marketdata"
})
class BacktestApplicationTest {

    @Autowired
    private SimulationEngine engine;

    @Autowired
    private BacktestConfig config;

    @Test
    void runsConfiguredBacktestOverCsvData() {
        assertEquals(List.of("AAPL"), config.symbols());
        assertEquals(LocalDate.of(2024, 3, 4), config.startDate());

        BacktestResult result = engine.run(config);

        assertFalse(result.cancelled());
        assertEquals(10, result.portfolioHistory().size());
        assertEquals(0, result.count(DecisionStatus.SKIPPED));
        assertTrue(result.finalPortfolio().totalValue() > 0.0);
    }
}

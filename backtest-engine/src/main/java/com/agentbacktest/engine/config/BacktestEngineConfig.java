package com.agentbacktest.engine.config;

import com.agentbacktest.common.provider.MarketDataProvider;
import com.agentbacktest.common.resilience.ResilienceSettings;
import com.agentbacktest.common.risk.RiskThresholds;
import com.agentbacktest.engine.data.CsvMarketDataProvider;
import com.agentbacktest.engine.persistence.AuditStore;
import com.agentbacktest.engine.persistence.JsonLinesAuditStore;
import com.agentbacktest.engine.persistence.NoOpAuditStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

@Configuration
public class BacktestEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngineConfig.class);

    @Value("${backtest.symbols:AAPL}")
    private String symbols;

    @Value("${backtest.start-date:2024-01-02}")
    private String startDate;

    @Value("${backtest.end-date:2024-03-29}")
    private String endDate;

    @Value("${backtest.initial-capital:100000}")
    private double initialCapital;

    @Value("${backtest.commission-rate:0.001}")
    private double commissionRate;

    @Value("${backtest.slippage-rate:0.001}")
    private double slippageRate;

    @Value("${backtest.position.base-size-pct:0.20}")
    private double basePositionSizePct;

    @Value("${backtest.position.min-pct:0.01}")
    private double minPositionPct;

    @Value("${backtest.position.max-pct:0.90}")
    private double maxPositionPct;

    @Value("${backtest.position.max-holding-days:30}")
    private int maxHoldingDays;

    @Value("${backtest.decision.min-confidence:0.30}")
    private double minConfidence;

    @Value("${backtest.decision.min-conviction:0.10}")
    private double minConviction;

    @Value("${backtest.history-lookback:60}")
    private int historyLookback;

    @Value("${backtest.symbol-concurrency:1}")
    private int symbolConcurrency;

    @Value("${backtest.cache.capacity:1000}")
    private int cacheCapacity;

    @Value("${backtest.cache.ttl:PT24H}")
    private String cacheTtl;

    @Value("${backtest.resilience.max-retries:2}")
    private int maxRetries;

    @Value("${backtest.resilience.failure-threshold:5}")
    private int failureThreshold;

    @Value("${backtest.resilience.call-timeout:PT30S}")
    private String callTimeout;

    @Value("${backtest.resilience.base-delay:PT1S}")
    private String baseDelay;

    @Value("${backtest.resilience.max-delay:PT60S}")
    private String maxDelay;

    @Value("${backtest.resilience.cooldown:PT1M}")
    private String cooldown;

    @Value("${backtest.resilience.call-deadline:PT2M}")
    private String callDeadline;

    @Value("${backtest.risk.gap-threshold:0.02}")
    private double gapThreshold;

    @Value("${backtest.risk.high-correlation-threshold:0.7}")
    private double highCorrelationThreshold;

    @Value("${backtest.risk.var-confidence:0.95}")
    private double varConfidence;

    @Value("${backtest.decision-memory:20}")
    private int decisionMemory;

    @Value("${backtest.debug:false}")
    private boolean debug;

    @Value("${backtest.data-dir:data}")
    private String dataDir;

    @Value("${backtest.audit-dir:}")
    private String auditDir;

    @Bean
    public BacktestConfig backtestConfig() {
        ResilienceSettings resilience = new ResilienceSettings(maxRetries, Duration.parse(baseDelay),
            Duration.parse(maxDelay), failureThreshold, Duration.parse(cooldown), Duration.parse(callTimeout),
            Duration.parse(callDeadline));
        RiskThresholds riskThresholds = RiskThresholds.defaults()
            .withGapThreshold(gapThreshold)
            .withHighCorrelationThreshold(highCorrelationThreshold)
            .withVarConfidence(varConfidence);
        List<String> symbolList = Arrays.stream(symbols.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();

        return BacktestConfig.defaults(symbolList, LocalDate.parse(startDate), LocalDate.parse(endDate))
            .initialCapital(initialCapital)
            .commissionRate(commissionRate)
            .slippageRate(slippageRate)
            .basePositionSizePct(basePositionSizePct)
            .minPositionPct(minPositionPct)
            .maxPositionPct(maxPositionPct)
            .maxHoldingDays(maxHoldingDays)
            .minConfidence(minConfidence)
            .minConviction(minConviction)
            .historyLookback(historyLookback)
            .decisionMemory(decisionMemory)
            .symbolConcurrency(symbolConcurrency)
            .cacheCapacity(cacheCapacity)
            .cacheTtl(Duration.parse(cacheTtl))
            .riskThresholds(riskThresholds)
            .resilience(resilience)
            .debug(debug)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MarketDataProvider marketDataProvider() {
        log.info("[Config] Market data directory. dir={}", dataDir);
        return new CsvMarketDataProvider(Path.of(dataDir));
    }

    @Bean
    public AuditStore auditStore(ObjectMapper objectMapper) {
        if (auditDir == null || auditDir.isBlank()) {
            log.info("[Config] No audit directory configured, audit records are discarded.");
            return new NoOpAuditStore();
        }
        log.info("[Config] Audit directory. dir={}", auditDir);
        return new JsonLinesAuditStore(Path.of(auditDir), objectMapper);
    }
}

package com.agentbacktest.engine.data;

import com.agentbacktest.analysis.indicator.TechnicalIndicators;
import com.agentbacktest.common.model.MarketSnapshot;
import com.agentbacktest.common.provider.MarketDataProvider;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads daily bars from {@code <directory>/<SYMBOL>.csv}.
 *
 * <p>Required header columns: {@code date,open,high,low,close,volume}. Optional numeric
 * columns {@code sentiment}, {@code news_impact} and {@code pe_ratio} are copied into the
 * snapshot's indicators. RSI(14), MACD, MACD signal, SMA20 and SMA50 are derived from the
 * closes up to and including each bar, so no bar sees later data.
 *
 * <p>Each file is parsed once on first access. A missing file means the symbol has no data.
 * Bars rejected by {@link BarValidator} are dropped with a warning, so their dates have no
 * data and they take no part in indicator derivation.
 */
public class CsvMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvMarketDataProvider.class);

    private static final int INDICATOR_WINDOW = 200;
    private static final List<String> PASS_THROUGH = List.of(
        MarketSnapshot.SENTIMENT, MarketSnapshot.NEWS_IMPACT, MarketSnapshot.PE_RATIO);

    private final Path directory;
    private final CsvMapper csvMapper = new CsvMapper();
    private final Map<String, NavigableMap<LocalDate, MarketSnapshot>> bars = new ConcurrentHashMap<>();

    public CsvMarketDataProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<MarketSnapshot> get(String symbol, LocalDate date) {
        return Optional.ofNullable(barsOf(symbol).get(date));
    }

    @Override
    public List<MarketSnapshot> history(String symbol, LocalDate date, int lookback) {
        if (lookback <= 0) return List.of();
        List<MarketSnapshot> newestFirst = new ArrayList<>(lookback);
        for (MarketSnapshot bar : barsOf(symbol).headMap(date, true).descendingMap().values()) {
            if (newestFirst.size() == lookback) break;
            newestFirst.add(bar);
        }
        Collections.reverse(newestFirst);
        return Collections.unmodifiableList(newestFirst);
    }

    private NavigableMap<LocalDate, MarketSnapshot> barsOf(String symbol) {
        return bars.computeIfAbsent(symbol, this::load);
    }

    private NavigableMap<LocalDate, MarketSnapshot> load(String symbol) {
        Path file = directory.resolve(symbol + ".csv");
        if (!Files.isRegularFile(file)) {
            log.warn("[MarketData] No data file. symbol={} file={}", symbol, file);
            return Collections.emptyNavigableMap();
        }
        NavigableMap<LocalDate, MarketSnapshot> raw = new TreeMap<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows =
                 csvMapper.readerFor(Map.class).with(schema).readValues(reader)) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                MarketSnapshot bar = toSnapshot(symbol, rows.next(), file, line);
                Optional<String> defect = BarValidator.defect(bar);
                if (defect.isPresent()) {
                    log.warn("[MarketData] Invalid bar dropped. symbol={} date={} line={} reason={}",
                             symbol, bar.date(), line, defect.get());
                    continue;
                }
                raw.put(bar.date(), bar);
            }
        } catch (IOException e) {
            throw new MarketDataException("Could not read market data file " + file, e);
        }
        NavigableMap<LocalDate, MarketSnapshot> enriched = withIndicators(raw);
        log.info("[MarketData] Loaded bars. symbol={} count={} first={} last={}", symbol, enriched.size(),
                 enriched.isEmpty() ? null : enriched.firstKey(), enriched.isEmpty() ? null : enriched.lastKey());
        return Collections.unmodifiableNavigableMap(enriched);
    }

    private static MarketSnapshot toSnapshot(String symbol, Map<String, String> row, Path file, int line) {
        try {
            LocalDate date = LocalDate.parse(required(row, "date"));
            Map<String, Double> extra = new HashMap<>();
            for (String column : PASS_THROUGH) {
                String value = row.get(column);
                if (value != null && !value.isBlank()) extra.put(column, Double.parseDouble(value.trim()));
            }
            return new MarketSnapshot(symbol, date,
                Double.parseDouble(required(row, "open")),
                Double.parseDouble(required(row, "high")),
                Double.parseDouble(required(row, "low")),
                Double.parseDouble(required(row, "close")),
                (long) Double.parseDouble(required(row, "volume")),
                extra);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new MarketDataException("Malformed row " + line + " in " + file + ": " + e.getMessage(), e);
        }
    }

    private static String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new NumberFormatException("missing column '" + column + "'");
        }
        return value.trim();
    }

    private static NavigableMap<LocalDate, MarketSnapshot> withIndicators(NavigableMap<LocalDate, MarketSnapshot> raw) {
        NavigableMap<LocalDate, MarketSnapshot> out = new TreeMap<>();
        List<Double> closesNewestFirst = new ArrayList<>();
        for (MarketSnapshot bar : raw.values()) {
            closesNewestFirst.add(0, bar.close());
            if (closesNewestFirst.size() > INDICATOR_WINDOW) {
                closesNewestFirst.remove(closesNewestFirst.size() - 1);
            }
            Map<String, Double> indicators = new HashMap<>(bar.indicators());
            putIfDefined(indicators, MarketSnapshot.RSI, TechnicalIndicators.rsi(closesNewestFirst, 14));
            putIfDefined(indicators, MarketSnapshot.MACD, TechnicalIndicators.macd(closesNewestFirst));
            putIfDefined(indicators, MarketSnapshot.MACD_SIGNAL, TechnicalIndicators.macdSignal(closesNewestFirst));
            putIfDefined(indicators, MarketSnapshot.SMA_20, TechnicalIndicators.sma(closesNewestFirst, 20));
            putIfDefined(indicators, MarketSnapshot.SMA_50, TechnicalIndicators.sma(closesNewestFirst, 50));
            out.put(bar.date(), bar.withIndicators(indicators));
        }
        return out;
    }

    private static void putIfDefined(Map<String, Double> indicators, String key, double value) {
        if (Double.isFinite(value)) indicators.put(key, value);
    }
}

package com.agentbacktest.engine.position;

import com.agentbacktest.common.history.BoundedHistory;
import com.agentbacktest.common.model.OrderKind;
import com.agentbacktest.common.model.RecentPerformance;
import com.agentbacktest.common.model.RiskAssessment;
import com.agentbacktest.common.model.TradeAction;
import com.agentbacktest.common.model.TradingDecision;
import com.agentbacktest.common.trace.TraceContextUtil;
import com.agentbacktest.engine.config.BacktestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of cash, open positions and the transaction log of one run.
 *
 * <p>Every public method runs under one lock, so executions coming from concurrent
 * decision cycles are applied one at a time. A transaction is validated completely
 * before anything is committed: a rejected transaction leaves cash, positions and the
 * transaction log exactly as they were.
 *
 * <p>Costs are charged on the notional at the fill price:
 * <pre>
 *   commission = notional × commissionRate
 *   slippage   = notional × slippageRate
 *   BUY  total    = notional + commission + slippage
 *   SELL proceeds = notional − commission − slippage
 * </pre>
 */
public class PositionManager {

    private static final Logger log = LoggerFactory.getLogger(PositionManager.class);

    /** Tolerance for float residue when comparing cash and quantities. */
    private static final double EPSILON = 1e-9;

    static final String SIGNAL_FILL   = "Signal fill";
    static final String STOP_LOSS     = "Stop loss triggered";
    static final String TAKE_PROFIT   = "Take profit triggered";
    static final String MAX_HOLDING   = "Maximum holding period reached";

    private final BacktestConfig config;
    private final ReentrantLock  lock = new ReentrantLock();

    private final Map<String, OpenPosition>       positions = new TreeMap<>();
    private final BoundedHistory<Transaction>     transactions;
    private final BoundedHistory<ClosedPosition>  closedPositions;
    private final BoundedHistory<PortfolioState>  portfolioHistory;

    private double cash;
    private double realizedPnl;

    public PositionManager(BacktestConfig config) {
        this.config           = config;
        this.cash             = config.initialCapital();
        this.transactions     = new BoundedHistory<>(config.transactionCapacity());
        this.closedPositions  = new BoundedHistory<>(config.transactionCapacity());
        this.portfolioHistory = new BoundedHistory<>(config.transactionCapacity());
    }

    // ── Execution ──────────────────────────────────────────────────────────

    /**
     * Fills {@code decision} for its requested quantity at {@code fillPrice}.
     *
     * @return a filled result, or a rejection when a business rule is broken
     * @throws IllegalArgumentException for HOLD decisions or a non-positive price
     */
    public ExecutionResult executeTransaction(TradingDecision decision, double fillPrice) {
        return execute(decision, fillPrice, SIGNAL_FILL);
    }

    /**
     * Marks the symbol to {@code price}, sizes the decision with {@link #sizeFor} against
     * the current portfolio and its embedded risk assessment, then executes it. Sizing and
     * execution happen under the same lock acquisition.
     */
    public ExecutionResult sizeAndExecute(TradingDecision decision, double price) {
        lock.lock();
        try {
            markToMarket(decision.symbol(), price);
            PortfolioState state = portfolioState(decision.date());
            double quantity = sizeFor(decision, state, decision.riskAssessment(), price);
            if (decision.action() == TradeAction.SELL && quantity <= 0.0) {
                String message = "No position to sell in " + decision.symbol();
                log.info("[PositionManager] Rejected. decisionId={} symbol={} reason={} detail={}",
                         decision.id(), decision.symbol(), RejectionReason.INSUFFICIENT_POSITION, message);
                return ExecutionResult.rejected(decision, RejectionReason.INSUFFICIENT_POSITION, message);
            }
            return execute(decision.withQuantity(quantity), price, SIGNAL_FILL);
        } finally {
            lock.unlock();
        }
    }

    private ExecutionResult execute(TradingDecision decision, double fillPrice, String note) {
        if (decision.action() == TradeAction.HOLD) {
            throw new IllegalArgumentException("HOLD decisions are not executable. decisionId=" + decision.id());
        }
        if (!(fillPrice > 0.0) || Double.isInfinite(fillPrice)) {
            throw new IllegalArgumentException("Fill price must be positive, was " + fillPrice);
        }
        lock.lock();
        try {
            Transaction tx = decision.action() == TradeAction.BUY
                ? buy(decision, fillPrice, note)
                : sell(decision, fillPrice, note);
            transactions.append(tx);
            log.info("[PositionManager] Filled. decisionId={} symbol={} action={} qty={} price={} total={} cash={}",
                     tx.decisionId(), tx.symbol(), tx.action(), tx.quantity(), tx.price(), tx.totalCost(), cash);
            return ExecutionResult.filled(decision, tx);
        } catch (TransactionRejectedException e) {
            log.info("[PositionManager] Rejected. decisionId={} symbol={} reason={} detail={}",
                     decision.id(), decision.symbol(), e.getReason(), e.getMessage());
            return ExecutionResult.rejected(decision, e.getReason(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private Transaction buy(TradingDecision decision, double price, String note) {
        double quantity = requirePositiveQuantity(decision);
        double notional   = quantity * price;
        double commission = notional * config.commissionRate();
        double slippage   = notional * config.slippageRate();
        double total      = notional + commission + slippage;
        if (total > cash + EPSILON) {
            throw new InsufficientFundsException(total, cash);
        }

        // validated; commit
        cash = Math.max(0.0, cash - total);
        OpenPosition position = positions.get(decision.symbol());
        if (position == null) {
            position = new OpenPosition();
            position.setSymbol(decision.symbol());
            position.setEntryDate(decision.date());
            position.setEntryPrice(price);
            position.setQuantity(quantity);
            positions.put(decision.symbol(), position);
        } else {
            double combined = position.getQuantity() + quantity;
            position.setEntryPrice((position.getQuantity() * position.getEntryPrice() + notional) / combined);
            position.setQuantity(combined);
        }
        position.setStopLossPct(decision.stopLossPct());
        position.setTakeProfitPct(decision.takeProfitPct());
        position.setMarkPrice(price);

        return new Transaction(decision.date(), decision.symbol(), TradeAction.BUY, quantity, price,
            commission, slippage, total, decision.id(), note);
    }

    private Transaction sell(TradingDecision decision, double price, String note) {
        double requested = requirePositiveQuantity(decision);
        OpenPosition position = positions.get(decision.symbol());
        double held = position == null ? 0.0 : position.getQuantity();
        if (requested > held + EPSILON) {
            throw new InsufficientPositionException(decision.symbol(), requested, held);
        }
        double quantity   = Math.min(requested, held);
        double notional   = quantity * price;
        double commission = notional * config.commissionRate();
        double slippage   = notional * config.slippageRate();
        double proceeds   = notional - commission - slippage;
        double pnl        = proceeds - quantity * position.getEntryPrice();

        // validated; commit
        cash += proceeds;
        realizedPnl += pnl;
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        position.setMarkPrice(price);
        double remaining = held - quantity;
        if (remaining <= EPSILON) {
            positions.remove(decision.symbol());
            closedPositions.append(new ClosedPosition(decision.symbol(), position.getEntryPrice(),
                position.getEntryDate(), price, decision.date(), position.getRealizedPnl(), note));
            log.debug("[PositionManager] Position closed. symbol={} pnl={} note={}",
                      decision.symbol(), position.getRealizedPnl(), note);
        } else {
            position.setQuantity(remaining);
        }

        return new Transaction(decision.date(), decision.symbol(), TradeAction.SELL, quantity, price,
            commission, slippage, proceeds, decision.id(), note);
    }

    private static double requirePositiveQuantity(TradingDecision decision) {
        double quantity = decision.quantity();
        if (!(quantity > EPSILON) || Double.isInfinite(quantity)) {
            throw new TransactionRejectedException(RejectionReason.ZERO_QUANTITY,
                "Quantity must be positive, was " + quantity);
        }
        return quantity;
    }

    // ── Sizing ─────────────────────────────────────────────────────────────

    /**
     * Quantity to trade for {@code decision}.
     *
     * <p>BUY: the requested quantity, or {@code positionSizePct × totalValue / price} when
     * none was requested, scaled by the risk adjustment; the resulting notional is then
     * clamped to {@code [minPositionPct, maxPositionPct] × totalValue}.
     * SELL: the requested quantity capped at the held quantity, or all of it.
     * HOLD or an unusable price: zero.
     */
    public double sizeFor(TradingDecision decision, PortfolioState state, RiskAssessment risk, double price) {
        if (!(price > 0.0)) return 0.0;
        return switch (decision.action()) {
            case HOLD -> 0.0;
            case SELL -> {
                double held = state.quantity(decision.symbol());
                if (held <= 0.0) yield 0.0;
                yield decision.quantity() > 0.0 ? Math.min(decision.quantity(), held) : held;
            }
            case BUY -> {
                double total = state.totalValue();
                double notional = decision.quantity() > 0.0
                    ? decision.quantity() * price
                    : decision.positionSizePct() * total;
                if (!(total > 0.0) || !(notional > 0.0)) yield 0.0;
                double adjustment = risk == null ? 1.0 : risk.positionSizeAdjustment();
                notional *= adjustment;
                notional = Math.max(config.minPositionPct() * total,
                           Math.min(config.maxPositionPct() * total, notional));
                yield notional / price;
            }
        };
    }

    // ── Valuation & exits ──────────────────────────────────────────────────

    public void markToMarket(String symbol, double price) {
        if (!(price > 0.0)) return;
        lock.lock();
        try {
            OpenPosition position = positions.get(symbol);
            if (position != null) position.setMarkPrice(price);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force-closes every position that breached its stop-loss or take-profit percentage,
     * or has been held longer than {@code maxHoldingDays}. Each exit is a full SELL at the
     * position's mark price, with the reason as transaction note.
     */
    public List<ExecutionResult> checkExits(LocalDate date) {
        lock.lock();
        try {
            List<ExecutionResult> exits = new ArrayList<>();
            for (OpenPosition position : new ArrayList<>(positions.values())) {
                String reason = exitReason(position, date);
                if (reason == null) continue;
                TradingDecision forced = new TradingDecision(
                    TraceContextUtil.exitDecisionId(position.getSymbol(), date), date, position.getSymbol(),
                    TradeAction.SELL, position.getQuantity(), OrderKind.MARKET, 1.0, reason,
                    0.0, position.getStopLossPct(), position.getTakeProfitPct(),
                    RiskAssessment.neutral(), List.of());
                log.info("[PositionManager] Forced exit. symbol={} reason={} mark={} entry={}",
                         position.getSymbol(), reason, position.getMarkPrice(), position.getEntryPrice());
                exits.add(execute(forced, position.getMarkPrice(), reason));
            }
            return exits;
        } finally {
            lock.unlock();
        }
    }

    private String exitReason(OpenPosition position, LocalDate date) {
        double entry = position.getEntryPrice();
        double change = entry > 0.0 ? (position.getMarkPrice() - entry) / entry : 0.0;
        if (position.getStopLossPct() > 0.0 && change <= -position.getStopLossPct()) return STOP_LOSS;
        if (position.getTakeProfitPct() > 0.0 && change >= position.getTakeProfitPct()) return TAKE_PROFIT;
        if (ChronoUnit.DAYS.between(position.getEntryDate(), date) > config.maxHoldingDays()) return MAX_HOLDING;
        return null;
    }

    // ── Snapshots ──────────────────────────────────────────────────────────

    public PortfolioState portfolioState(LocalDate date) {
        lock.lock();
        try {
            Map<String, Position> view = new LinkedHashMap<>();
            double positionsValue = 0.0;
            double unrealized = 0.0;
            for (OpenPosition p : positions.values()) {
                Position snapshot = p.toSnapshot();
                view.put(p.getSymbol(), snapshot);
                positionsValue += snapshot.marketValue();
                unrealized += snapshot.unrealizedPnl();
            }
            double total = cash + positionsValue;
            double exposure = total > 0.0 ? positionsValue / total : 0.0;
            double totalReturn = (total - config.initialCapital()) / config.initialCapital();
            return new PortfolioState(date, cash, view, total, exposure, realizedPnl, unrealized, totalReturn);
        } finally {
            lock.unlock();
        }
    }

    /** Takes a snapshot and appends it to the portfolio history. */
    public PortfolioState recordSnapshot(LocalDate date) {
        PortfolioState state = portfolioState(date);
        portfolioHistory.append(state);
        return state;
    }

    /**
     * @throws IllegalStateException when cash went negative, a held quantity is not
     *                               positive, or a value is not finite
     */
    public void verifyInvariants() {
        lock.lock();
        try {
            if (cash < -EPSILON || !Double.isFinite(cash)) {
                throw new IllegalStateException("Cash invariant broken: cash=" + cash);
            }
            for (OpenPosition p : positions.values()) {
                if (!(p.getQuantity() > 0.0) || !Double.isFinite(p.getQuantity() * p.getMarkPrice())) {
                    throw new IllegalStateException("Position invariant broken: " + p);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    // ── Queries ────────────────────────────────────────────────────────────

    public double quantity(String symbol) {
        lock.lock();
        try {
            OpenPosition p = positions.get(symbol);
            return p == null ? 0.0 : p.getQuantity();
        } finally {
            lock.unlock();
        }
    }

    public List<String> heldSymbols() {
        lock.lock();
        try {
            return List.copyOf(positions.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Summary of the last {@code window} closed positions of {@code symbol}.
     * {@link RecentPerformance#none()} when the symbol has not closed a position yet.
     */
    public RecentPerformance recentPerformance(String symbol, int window) {
        List<ClosedPosition> closed = new ArrayList<>();
        lock.lock();
        try {
            for (ClosedPosition c : closedPositions.all()) {
                if (c.symbol().equals(symbol)) closed.add(c);
            }
        } finally {
            lock.unlock();
        }
        List<ClosedPosition> recent = closed.subList(Math.max(0, closed.size() - Math.max(0, window)), closed.size());
        if (recent.isEmpty()) return RecentPerformance.none();

        int wins = 0;
        double returns = 0.0;
        double pnl = 0.0;
        for (ClosedPosition c : recent) {
            if (c.realizedPnl() > 0.0) wins++;
            returns += c.exitPrice() / c.entryPrice() - 1.0;
            pnl += c.realizedPnl();
        }
        int n = recent.size();
        return new RecentPerformance(n, (double) wins / n, returns / n, pnl);
    }

    /** Weight of the largest position in total portfolio value, 0 when flat. */
    public double largestPositionWeight() {
        PortfolioState state = portfolioState(null);
        if (!(state.totalValue() > 0.0)) return 0.0;
        return state.positions().values().stream()
            .mapToDouble(Position::marketValue)
            .max()
            .orElse(0.0) / state.totalValue();
    }

    public BoundedHistory<Transaction> transactions() {
        return transactions;
    }

    public BoundedHistory<ClosedPosition> closedPositions() {
        return closedPositions;
    }

    public BoundedHistory<PortfolioState> portfolioHistory() {
        return portfolioHistory;
    }
}

package com.agentbacktest.engine.position;

import java.time.LocalDate;

/** A position whose quantity reached zero, archived with its lifetime P&amp;L. */
public record ClosedPosition(
    String symbol,
    double entryPrice,
    LocalDate entryDate,
    double exitPrice,
    LocalDate exitDate,
    double realizedPnl,
    String exitNote
) {}

package com.agentbacktest.engine.simulation;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Monday to Friday, no holiday calendar. A weekday without a bar for a symbol simply
 * produces a SKIPPED decision for it.
 */
public final class TradingCalendar {

    private TradingCalendar() {}

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /** Trading days from {@code start} to {@code end}, both inclusive, in order. */
    public static List<LocalDate> tradingDays(LocalDate start, LocalDate end) {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (isTradingDay(d)) days.add(d);
        }
        return days;
    }
}

package com.qf2.trader.compliance;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable store of {@link AssetComplianceState} plus the global daily counter. Reservations stand
 * for approved intents that have not filled yet so they count toward the daily caps within a cycle.
 */
public class ComplianceStateStore {

    private final Map<String, AssetComplianceState> states = new TreeMap<>();
    private final Map<String, Integer> reservations = new HashMap<>();
    private LocalDate totalDay;
    private int totalToday;
    private int reservedTotal;

    public synchronized AssetComplianceState get(String asset) {
        return states.getOrDefault(asset, AssetComplianceState.empty(asset));
    }

    public synchronized void put(AssetComplianceState state) {
        states.put(state.asset(), state);
    }

    public synchronized Map<String, AssetComplianceState> snapshot() {
        return Map.copyOf(states);
    }

    public synchronized int tradesToday(String asset, LocalDate day) {
        return get(asset).tradesOn(day) + reservations.getOrDefault(asset, 0);
    }

    public synchronized int totalTradesToday(LocalDate day) {
        return (day.equals(totalDay) ? totalToday : 0) + reservedTotal;
    }

    synchronized void countTrade(LocalDate day) {
        if (!day.equals(totalDay)) {
            totalDay = day;
            totalToday = 0;
        }
        totalToday++;
    }

    public synchronized void reserve(String asset) {
        reservations.merge(asset, 1, Integer::sum);
        reservedTotal++;
    }

    /**
     * Drops one reservation for the asset; no-op when none is held.
     */
    public synchronized void release(String asset) {
        Integer held = reservations.get(asset);
        if (held == null) {
            return;
        }
        if (held <= 1) {
            reservations.remove(asset);
        } else {
            reservations.put(asset, held - 1);
        }
        reservedTotal--;
    }

    public synchronized void clearReservations() {
        reservations.clear();
        reservedTotal = 0;
    }
}

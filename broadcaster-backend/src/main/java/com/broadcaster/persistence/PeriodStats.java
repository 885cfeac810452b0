package com.broadcaster.persistence;

/**
 * Closed-trade statistics over one look-back window.
 *
 * @param winRate percentage of trades with positive realised pnl, 0 when there are none
 */
public record PeriodStats(
    String period,
    double totalPnl,
    double totalVolume,
    int tradesCount,
    int wins,
    int losses,
    double winRate
) {
    public static PeriodStats empty(String period) {
        return new PeriodStats(period, 0, 0, 0, 0, 0, 0);
    }
}

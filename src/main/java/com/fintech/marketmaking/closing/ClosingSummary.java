package com.fintech.marketmaking.closing;

/**
 * Counters describing a closing-auction run.
 *
 * @param auctionEntries Auction entry fills
 * @param buyEntries Entry fills on the buy side
 * @param sellEntries Entry fills on the sell side
 * @param vwapExits Exit fills at the VWAP target
 * @param stopLosses Stop-loss liquidation fills
 * @param exitFlattens Exits forced closed at a later closing print
 * @param filteredSellEntries Sell entries skipped by the uptrend filter
 * @param filteredBuyEntries Buy entries skipped by the downtrend filter
 * @param openExitOrders Exit orders still working at end of stream
 */
public record ClosingSummary(
    int auctionEntries,
    int buyEntries,
    int sellEntries,
    int vwapExits,
    int stopLosses,
    int exitFlattens,
    int filteredSellEntries,
    int filteredBuyEntries,
    int openExitOrders
) {
}

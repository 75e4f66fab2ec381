package com.fintech.marketdata.service;

import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;

/**
 * Rows returned for one range query.
 *
 * @param key Series that was queried
 * @param dataset Requested slice, never empty
 * @param fetched Whether the query had to call upstream
 */
public record SeriesQueryResult(SeriesKey key, SeriesDataset dataset, boolean fetched) {
}

package com.fintech.marketdata.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.marketdata.domain.Observation;
import com.fintech.marketdata.domain.SeriesDataset;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Response of {@code GET /data}: the requested rows of one series in split layout.
 *
 * Example response:
 * {
 *   "asset_id": "AAPL",
 *   "data": {
 *     "index": ["2023-01-03", "2023-01-04"],
 *     "columns": ["Open", "High", "Low", "Close", "Adj Close", "Volume"],
 *     "data": [[130.28, 130.9, 124.17, 125.07, 124.22, 112117500], ...]
 *   }
 * }
 */
@Schema(description = "Series rows for the requested range")
public record DataResponse(
    @JsonProperty("asset_id")
    @Schema(description = "Series key as requested", example = "AAPL")
    String assetId,

    @Schema(description = "Rows in split layout: index, columns and row values")
    SplitFrame data
) {

    public static DataResponse of(String assetId, SeriesDataset dataset) {
        return new DataResponse(assetId, SplitFrame.fromDataset(dataset));
    }

    /**
     * Columnar table: one index entry (ISO date) and one row of values per observation.
     */
    @Schema(description = "Split-oriented table")
    public record SplitFrame(
        @Schema(description = "Observation dates (ISO yyyy-MM-dd)", example = "[\"2023-01-03\"]")
        List<String> index,

        @Schema(description = "Column names", example = "[\"Open\", \"High\", \"Low\", \"Close\", \"Adj Close\", \"Volume\"]")
        List<String> columns,

        @Schema(description = "Row values aligned with columns; null for missing values")
        List<List<Double>> data
    ) {

        public static SplitFrame fromDataset(SeriesDataset dataset) {
            int size = dataset.size();
            List<String> index = new ArrayList<>(size);
            List<List<Double>> rows = new ArrayList<>(size);

            for (Observation observation : dataset.observations()) {
                LocalDate date = observation.date();
                index.add(date.toString());
                rows.add(observation.values());
            }
            return new SplitFrame(index, dataset.columns(), rows);
        }
    }
}

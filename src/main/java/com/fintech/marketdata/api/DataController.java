package com.fintech.marketdata.api;

import com.fintech.marketdata.service.SeriesQueryResult;
import com.fintech.marketdata.service.SeriesQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Range queries over equity and macro time series.
 */
@RestController
@Validated
@Tag(name = "Series Data", description = "Daily equity history and FRED macro series")
public class DataController {

    private static final Logger log = LoggerFactory.getLogger(DataController.class);

    private final SeriesQueryService queryService;

    public DataController(SeriesQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /data
     *
     * @param assetId Ticker (e.g. "AAPL") or macro key with the M_ prefix (e.g. "M_CPIAUCSL")
     * @param startDate First date, yyyy-MM-dd, inclusive
     * @param endDate Last date, yyyy-MM-dd, inclusive
     * @return Rows in range, fetched from upstream first if the cache does not cover them
     */
    @Operation(
        summary = "Get series data for a date range",
        description = """
            Returns daily observations of one series between two dates (both inclusive).
            
            Keys starting with **M_** are FRED macro series (the rest of the key is the FRED id);
            anything else is an instrument ticker served from Yahoo Finance.
            
            The first request for a range the cache does not cover fetches it from upstream,
            merges it into the cache and queues a compressed CSV backup of the whole series.
            
            **Example Request:**
            ```
            GET /data?asset_id=AAPL&start_date=2023-01-03&end_date=2023-01-10
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Rows found for the range",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = DataResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "asset_id": "AAPL",
                          "data": {
                            "index": ["2023-01-03", "2023-01-04"],
                            "columns": ["Open", "High", "Low", "Close", "Adj Close", "Volume"],
                            "data": [
                              [130.28, 130.9, 124.17, 125.07, 124.22, 112117500],
                              [126.89, 128.66, 125.08, 126.36, 125.5, 89113600]
                            ]
                          }
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed or inverted dates",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class),
                examples = @ExampleObject(
                    name = "Invalid Range",
                    value = """
                        {
                          "status": 400,
                          "error": "INVALID_RANGE",
                          "message": "start_date must be before end_date",
                          "path": "/data",
                          "timestamp": "2024-05-02T10:30:00Z"
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Upstream has no such series, the fetch failed, or no rows fall in the range",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class)
            )
        )
    })
    @GetMapping("/data")
    public ResponseEntity<DataResponse> getData(
            @Parameter(description = "Ticker or M_-prefixed FRED series", example = "AAPL", required = true)
            @RequestParam("asset_id")
            @NotBlank(message = "asset_id is required and cannot be blank")
            @Size(max = 64, message = "asset_id must be at most 64 characters")
            String assetId,

            @Parameter(description = "Start date (yyyy-MM-dd)", example = "2023-01-03", required = true)
            @RequestParam("start_date")
            @NotBlank(message = "start_date is required")
            String startDate,

            @Parameter(description = "End date (yyyy-MM-dd)", example = "2023-01-10", required = true)
            @RequestParam("end_date")
            @NotBlank(message = "end_date is required")
            String endDate) {

        SeriesQueryResult result = queryService.query(assetId, startDate, endDate);

        log.debug("Data query: asset_id={}, start={}, end={}, rows={}, fetched={}",
            assetId, startDate, endDate, result.dataset().size(), result.fetched());

        return ResponseEntity.ok(DataResponse.of(result.key().value(), result.dataset()));
    }
}

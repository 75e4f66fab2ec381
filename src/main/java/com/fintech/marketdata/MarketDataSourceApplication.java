package com.fintech.marketdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Market data source service: cached equity and macro time series with
 * per-key serialized upstream fetches and asynchronous blob backups.
 */
@SpringBootApplication
public class MarketDataSourceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataSourceApplication.class, args);
    }
}

package com.fintech.marketdata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized configuration for the market data source service.
 * Maps to 'market-data.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "market-data")
public class MarketDataProperties {

    private Routing routing = new Routing();
    private Upstream upstream = new Upstream();
    private Backup backup = new Backup();

    @Data
    public static class Routing {
        private String macroPrefix = "M_";
    }

    @Data
    public static class Upstream {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        private String userAgent = "Mozilla/5.0 (compatible; market-data-source-service/1.0)";
        private Provider yahoo = new Provider("https://query1.finance.yahoo.com");
        private Provider fred = new Provider("https://fred.stlouisfed.org");

        @Data
        public static class Provider {
            private String baseUrl;

            public Provider() {
            }

            public Provider(String baseUrl) {
                this.baseUrl = baseUrl;
            }
        }
    }

    @Data
    public static class Backup {
        private boolean enabled = true;
        private String store = "azure";  // azure | filesystem
        private String blobSuffix = ".csv.gz";
        private int bufferSize = 1024;   // Must be a power of two
        private int workers = 2;         // Keys are sharded across workers
        private FileSystem filesystem = new FileSystem();
        private Azure azure = new Azure();

        @Data
        public static class FileSystem {
            private String directory = "backups";
        }

        @Data
        public static class Azure {
            private String connectionString;
            private String containerName = "data";
        }
    }
}

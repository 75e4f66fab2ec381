package com.fintech.marketdata.backup;

import com.azure.core.util.BinaryData;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobStorageException;
import com.fintech.marketdata.config.MarketDataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Stores blobs in an Azure Blob Storage container.
 *
 * <p>Configured from {@code market-data.backup.azure.connection-string} and
 * {@code container-name}; the container is created on startup if it does not exist.
 */
@Component
@ConditionalOnExpression("${market-data.backup.enabled:true} and '${market-data.backup.store:azure}' == 'azure'")
public class AzureBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(AzureBlobStore.class);

    private final BlobContainerClient container;

    @Autowired
    public AzureBlobStore(MarketDataProperties properties) {
        MarketDataProperties.Backup.Azure azure = properties.getBackup().getAzure();
        if (azure.getConnectionString() == null || azure.getConnectionString().isBlank()) {
            throw new IllegalStateException(
                "market-data.backup.azure.connection-string must be set when backups go to Azure "
                    + "(or set market-data.backup.store=filesystem)"
            );
        }

        this.container = new BlobServiceClientBuilder()
            .connectionString(azure.getConnectionString())
            .buildClient()
            .getBlobContainerClient(azure.getContainerName());

        if (!container.exists()) {
            container.create();
            log.info("Created blob container {}", azure.getContainerName());
        }
        log.info("Azure blob store ready: container={}", azure.getContainerName());
    }

    AzureBlobStore(BlobContainerClient container) {
        this.container = container;
    }

    @Override
    public void writeBlob(String name, byte[] content) throws IOException {
        try {
            container.getBlobClient(name).upload(BinaryData.fromBytes(content), true);
        } catch (BlobStorageException e) {
            throw new IOException(
                String.format("Upload of %s to container %s failed with status %d",
                    name, container.getBlobContainerName(), e.getStatusCode()),
                e
            );
        }
    }

    @Override
    public String describe() {
        return "azure:" + container.getBlobContainerName();
    }
}

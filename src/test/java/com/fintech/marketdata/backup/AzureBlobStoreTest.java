package com.fintech.marketdata.backup;

import com.azure.core.util.BinaryData;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.models.BlobStorageException;
import com.fintech.marketdata.config.MarketDataProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AzureBlobStore Tests")
class AzureBlobStoreTest {

    private BlobContainerClient container;
    private BlobClient blob;
    private AzureBlobStore store;

    @BeforeEach
    void setUp() {
        container = mock(BlobContainerClient.class);
        blob = mock(BlobClient.class);
        when(container.getBlobClient("AAPL.csv.gz")).thenReturn(blob);
        when(container.getBlobContainerName()).thenReturn("data");
        store = new AzureBlobStore(container);
    }

    @Test
    @DisplayName("Should upload the payload with overwrite enabled")
    void testUploadOverwrites() throws IOException {
        store.writeBlob("AAPL.csv.gz", new byte[] {7, 8, 9});

        ArgumentCaptor<BinaryData> captor = ArgumentCaptor.forClass(BinaryData.class);
        verify(blob).upload(captor.capture(), eq(true));
        assertThat(captor.getValue().toBytes()).containsExactly(7, 8, 9);
        assertThat(store.describe()).isEqualTo("azure:data");
    }

    @Test
    @DisplayName("Storage errors should surface as IOException")
    void testStorageError() {
        BlobStorageException failure = mock(BlobStorageException.class);
        when(failure.getStatusCode()).thenReturn(403);
        doThrow(failure).when(blob).upload(any(BinaryData.class), anyBoolean());

        assertThatThrownBy(() -> store.writeBlob("AAPL.csv.gz", new byte[] {1}))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("AAPL.csv.gz")
            .hasMessageContaining("403")
            .satisfies(e -> assertThat(e.getCause()).isSameAs(failure));
    }

    @Test
    @DisplayName("Should refuse to start without a connection string")
    void testMissingConnectionString() {
        MarketDataProperties properties = new MarketDataProperties();

        assertThatThrownBy(() -> new AzureBlobStore(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("connection-string");
    }
}

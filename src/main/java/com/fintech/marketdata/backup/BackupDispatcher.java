package com.fintech.marketdata.backup;

import com.fintech.marketdata.config.MarketDataProperties;
import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous backup of merged series to the {@link BlobStore}.
 *
 * <p>{@link #dispatch} only claims a slot in an LMAX Disruptor ring buffer and returns;
 * it never waits for capacity. When the buffer is full the snapshot is dropped and
 * counted. A later merge of the same key dispatches a complete snapshot again.
 *
 * <p>Worker threads each own a shard of the key space ({@code hash(key) mod workers}),
 * so the snapshots of one key are written one at a time, in dispatch order, while
 * different keys back up in parallel.
 *
 * <p>Serialization, compression and upload errors are logged and counted here. They
 * never propagate to the request that triggered the backup.
 */
@Component
public class BackupDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BackupDispatcher.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final BlobStore blobStore;
    private final SeriesCsvEncoder encoder;
    private final MarketDataProperties.Backup config;
    private final MeterRegistry meterRegistry;

    private final AtomicLong dispatched = new AtomicLong(0);
    private final AtomicLong succeeded = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);

    private Disruptor<BackupSlot> disruptor;
    private volatile RingBuffer<BackupSlot> ringBuffer;
    private int workers;

    @Autowired
    public BackupDispatcher(
            ObjectProvider<BlobStore> blobStore,
            SeriesCsvEncoder encoder,
            MarketDataProperties properties,
            MeterRegistry meterRegistry) {
        this(blobStore.getIfAvailable(), encoder, properties.getBackup(), meterRegistry);
    }

    public BackupDispatcher(
            BlobStore blobStore,
            SeriesCsvEncoder encoder,
            MarketDataProperties.Backup config,
            MeterRegistry meterRegistry) {
        if (config.isEnabled() && blobStore == null) {
            throw new IllegalStateException("Backups are enabled but no blob store is configured");
        }
        this.blobStore = blobStore;
        this.encoder = encoder;
        this.config = config;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("marketdata.backup.dispatched", dispatched);
        meterRegistry.gauge("marketdata.backup.succeeded", succeeded);
        meterRegistry.gauge("marketdata.backup.failed", failed);
        meterRegistry.gauge("marketdata.backup.dropped", dropped);
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Series backups are disabled");
            return;
        }

        int bufferSize = config.getBufferSize();
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1) {
            throw new IllegalArgumentException("Backup buffer size must be a power of two, got " + bufferSize);
        }
        workers = Math.max(1, config.getWorkers());

        EventFactory<BackupSlot> eventFactory = BackupSlot::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("series-backup-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,  // Request threads publish concurrently
            new BlockingWaitStrategy()
        );

        @SuppressWarnings("unchecked")
        EventHandler<BackupSlot>[] handlers = new EventHandler[workers];
        for (int i = 0; i < workers; i++) {
            final int shard = i;
            handlers[i] = (slot, sequence, endOfBatch) -> {
                if (slot.shard == shard && slot.key != null) {
                    write(slot.key, slot.dataset);
                }
            };
        }
        // Drop the dataset reference once every worker has seen the slot
        EventHandler<BackupSlot> release = (slot, sequence, endOfBatch) -> slot.clear();
        disruptor.handleEventsWith(handlers).then(release);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<BackupSlot>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, BackupSlot slot) {
                failed.incrementAndGet();
                log.error("Unhandled error in backup worker at sequence {} for {}", sequence, slot.key, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during backup dispatcher startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during backup dispatcher shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Backup dispatcher started: store={}, bufferSize={}, workers={}",
            blobStore.describe(), bufferSize, workers);
    }

    /**
     * Queues a snapshot of {@code dataset} for upload as {@code <key><suffix>}.
     * Returns immediately.
     *
     * @return true if queued, false if backups are disabled or the buffer is full
     */
    public boolean dispatch(SeriesKey key, SeriesDataset dataset) {
        if (ringBuffer == null) {
            return false;
        }

        try {
            long sequence = ringBuffer.tryNext();
            try {
                BackupSlot slot = ringBuffer.get(sequence);
                slot.key = key;
                slot.dataset = dataset;
                slot.shard = Math.floorMod(key.hashCode(), workers);
            } finally {
                ringBuffer.publish(sequence);
            }
            dispatched.incrementAndGet();
            return true;

        } catch (InsufficientCapacityException e) {
            dropped.incrementAndGet();
            log.warn("Backup buffer full - dropping snapshot of {} ({} rows)", key, dataset.size());
            return false;
        }
    }

    public String blobName(SeriesKey key) {
        return key.value() + config.getBlobSuffix();
    }

    private void write(SeriesKey key, SeriesDataset dataset) {
        String blobName = blobName(key);
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";

        try {
            byte[] payload = encoder.encode(dataset);
            blobStore.writeBlob(blobName, payload);
            succeeded.incrementAndGet();
            log.info("Backed up {} ({} rows, {} bytes) to {}/{}",
                key, dataset.size(), payload.length, blobStore.describe(), blobName);

        } catch (Exception e) {
            outcome = "error";
            failed.incrementAndGet();
            log.error("Backup of {} to {}/{} failed: {}", key, blobStore.describe(), blobName, e.getMessage(), e);

        } finally {
            sample.stop(meterRegistry.timer("marketdata.backup.time", "outcome", outcome));
        }
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor == null) {
            return;
        }
        log.info("Shutting down backup dispatcher, draining pending backups...");
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("Backup dispatcher shutdown complete");
        } catch (TimeoutException e) {
            log.warn("Pending backups not drained within {}s, halting", SHUTDOWN_TIMEOUT_SECONDS);
            disruptor.halt();
        }
        ringBuffer = null;
    }

    /**
     * Pre-allocated ring buffer entry.
     */
    private static class BackupSlot {
        SeriesKey key;
        SeriesDataset dataset;
        int shard;

        void clear() {
            key = null;
            dataset = null;
        }
    }

    public boolean isEnabled() {
        return ringBuffer != null;
    }

    public long getDispatched() {
        return dispatched.get();
    }

    public long getSucceeded() {
        return succeeded.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getDropped() {
        return dropped.get();
    }
}

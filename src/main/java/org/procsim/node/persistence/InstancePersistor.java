package org.procsim.node.persistence;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import org.procsim.node.api.resources.IMonitorable;
import org.procsim.node.api.resources.OperationalError;
import org.procsim.node.api.resources.records.IRecordStore;
import org.procsim.node.api.resources.records.LifecycleRecord;
import org.procsim.node.registry.IInstanceLifecycleListener;
import org.procsim.node.registry.InstanceEvent;
import org.procsim.node.registry.InstanceRegistry;
import org.procsim.node.utils.monitoring.OperationalErrorLog;
import org.procsim.runtime.api.IUpdateNotifier;
import org.procsim.runtime.api.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Keeps the record store in line with the instance registry and recreates persisted
 * instances on startup.
 * <p>
 * <strong>Lifecycle events:</strong> creations, updates and deletions are written to the
 * store on a dedicated single writer thread, in the order they happened. Store failures
 * are logged and recorded as operational errors; they never affect the live instance.
 * <p>
 * <strong>Restore:</strong> every stored id gets one attempt, which is not charged to any
 * budget. Each failed attempt that is re-enqueued for a later retry (after
 * {@code restoreBackoff}) consumes one unit of {@code maxRestoreAttempts}, shared by all
 * records. The ceiling therefore bounds retries, not attempts: a restore of N records makes
 * at most N + maxRestoreAttempts attempts. Records that fail once the budget is spent are
 * purged from the store.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>maxRestoreAttempts</b>: retries (re-enqueues after a failure) shared by all records of one restore; first attempts are not counted (default: 10).</li>
 *   <li><b>restoreBackoff</b>: pause after each failed attempt (default: 500 ms).</li>
 *   <li><b>flushTimeout</b>: how long {@link #close()} waits for pending writes (default: 5 s).</li>
 * </ul>
 */
public class InstancePersistor implements IInstanceLifecycleListener, IMonitorable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstancePersistor.class);

    private final IRecordStore store;
    private final InstanceRegistry registry;
    private final int maxRestoreAttempts;
    private final Duration restoreBackoff;
    private final Duration flushTimeout;
    private final ExecutorService writer;
    private final Map<String, Subscription> updateSubscriptions = new ConcurrentHashMap<>();
    private final OperationalErrorLog errors = new OperationalErrorLog(1000);

    private final AtomicLong recordsWritten = new AtomicLong();
    private final AtomicLong recordsDeleted = new AtomicLong();
    private final AtomicLong storeFailures = new AtomicLong();
    private final AtomicLong recordsRestored = new AtomicLong();
    private final AtomicLong recordsPurged = new AtomicLong();

    private Subscription registrySubscription;

    public InstancePersistor(IRecordStore store, InstanceRegistry registry, Config options) {
        this.store = store;
        this.registry = registry;
        this.maxRestoreAttempts = options.hasPath("maxRestoreAttempts") ? options.getInt("maxRestoreAttempts") : 10;
        this.restoreBackoff = options.hasPath("restoreBackoff") ? options.getDuration("restoreBackoff") : Duration.ofMillis(500);
        this.flushTimeout = options.hasPath("flushTimeout") ? options.getDuration("flushTimeout") : Duration.ofSeconds(5);
        if (maxRestoreAttempts < 0) {
            throw new IllegalArgumentException("maxRestoreAttempts cannot be negative: " + maxRestoreAttempts);
        }
        if (restoreBackoff.isNegative()) {
            throw new IllegalArgumentException("restoreBackoff cannot be negative: " + restoreBackoff);
        }
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "record-writer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Subscribes to the registry's lifecycle events. Safe to call more than once.
     * <p>
     * A failure is logged and leaves the node running without persistence.
     *
     * @return {@code true} if events are being persisted.
     */
    public synchronized boolean initialize() {
        if (registrySubscription != null) {
            return true;
        }
        try {
            registrySubscription = registry.addListener(this);
            log.info("Persisting instance lifecycle to record store '{}'", store.getResourceName());
            return true;
        } catch (RuntimeException e) {
            log.error("Could not initialize persist-layer because: {}", e.getMessage());
            log.debug("Exception details:", e);
            errors.record("INIT_FAILED", "Could not subscribe to lifecycle events", e.getMessage());
            return false;
        }
    }

    public synchronized boolean isInitialized() {
        return registrySubscription != null;
    }

    @Override
    public void onCreated(InstanceEvent event) {
        log.info("Persisting new instance: {} ({})", event.id(), event.className());
        LifecycleRecord record = new LifecycleRecord(event.id(), event.className(), event.args());
        submit("persisting new instance", event.id(), event.className(), s -> {
            s.setItem(record, record.className());
            recordsWritten.incrementAndGet();
        });

        if (event.instance() instanceof IUpdateNotifier notifier) {
            try {
                Subscription subscription = notifier.onUpdate(data -> {
                    log.info("Persisting update for: {} ({})", event.id(), event.className());
                    LifecycleRecord updated = record.withArgs(Collections.singletonList(data));
                    submit("persisting update", event.id(), event.className(), s -> {
                        s.setItem(updated, updated.className());
                        recordsWritten.incrementAndGet();
                    });
                });
                Subscription previous = updateSubscriptions.put(event.id(), subscription);
                if (previous != null) {
                    previous.cancel();
                }
            } catch (RuntimeException e) {
                log.warn("Cannot follow updates of {} ({}): {}", event.id(), event.className(), e.getMessage());
                errors.record("UPDATE_SUBSCRIPTION_FAILED", "Cannot follow instance updates",
                        "Instance: " + event.id() + " (" + event.className() + ")");
            }
        }
    }

    @Override
    public void onDeleted(InstanceEvent event) {
        Subscription subscription = updateSubscriptions.remove(event.id());
        if (subscription != null) {
            subscription.cancel();
        }
        log.info("Deleting persisted instance: {} ({})", event.id(), event.className());
        submit("deleting persisted instance", event.id(), event.className(), s -> {
            s.removeItem(event.id());
            recordsDeleted.incrementAndGet();
        });
    }

    /**
     * Recreates every persisted instance through the registry.
     * <p>
     * Runs synchronously on the calling thread. Records are processed one at a time in
     * store order; each id is attempted once, failed ids are appended to the end of the
     * work list while retries remain. Only these re-enqueues count against
     * {@code maxRestoreAttempts}. When the list is exhausted, ids that never succeeded
     * are purged from the store; a failed purge is logged and does not stop the others.
     *
     * @return what was restored and what was purged.
     * @throws InterruptedException if interrupted during a backoff pause. Nothing is purged then.
     */
    public RestoreReport restore() throws InterruptedException {
        initialize();

        List<String> workList;
        try {
            workList = new ArrayList<>(store.keys());
        } catch (IOException e) {
            log.error("Cannot list persisted instances, nothing restored: {}", e.getMessage());
            log.debug("Exception details:", e);
            errors.record("RESTORE_LIST_FAILED", "Cannot list persisted instances", e.getMessage());
            return RestoreReport.empty();
        }
        if (workList.isEmpty()) {
            log.info("No persisted instances to restore");
            return RestoreReport.empty();
        }
        log.info("Restoring {} persisted instance(s)", workList.size());

        List<String> restored = new ArrayList<>();
        List<String> broken = new ArrayList<>();
        Map<String, String> lastFailure = new LinkedHashMap<>();
        int retries = 0;

        for (int head = 0; head < workList.size(); head++) {
            String id = workList.get(head);
            if (registry.contains(id)) {
                restored.add(id);
                continue;
            }
            String className = "?";
            try {
                LifecycleRecord record = store.getItem(id);
                className = record.className();
                log.info("Restoring persisted instance: {} ({})", id, className);
                registry.create(record.className(), record.args(), id);
                restored.add(id);
                recordsRestored.incrementAndGet();
            } catch (Exception e) {
                log.warn("Failed to restore persisted instance: {} ({}) because: {}", id, className, e.getMessage());
                log.debug("Exception details:", e);
                lastFailure.put(id, e.getMessage());
                if (retries < maxRestoreAttempts) {
                    retries++;
                    log.debug("Retry {}/{} scheduled for {}", retries, maxRestoreAttempts, id);
                    workList.add(id);
                    if (!restoreBackoff.isZero()) {
                        Thread.sleep(restoreBackoff.toMillis());
                    }
                } else {
                    broken.add(id);
                }
            }
        }

        List<String> purged = new ArrayList<>();
        List<String> purgeFailed = new ArrayList<>();
        for (String id : broken) {
            log.warn("Purging broken record {} after exhausting restore attempts (last failure: {})", id, lastFailure.get(id));
            try {
                store.removeItem(id);
                purged.add(id);
                recordsPurged.incrementAndGet();
            } catch (Exception e) {
                purgeFailed.add(id);
                log.warn("Failed to purge broken record {}: {}", id, e.getMessage());
                errors.record("PURGE_FAILED", "Failed to purge broken record", "Instance: " + id + ", cause: " + e.getMessage());
            }
        }

        log.info("Restore finished: {} restored, {} purged, {} purge failure(s), {} retr{}",
                restored.size(), purged.size(), purgeFailed.size(), retries, retries == 1 ? "y" : "ies");
        return new RestoreReport(restored, purged, purgeFailed, retries);
    }

    /**
     * Waits until all lifecycle writes submitted so far have been applied.
     *
     * @return {@code true} if the writer caught up within the timeout.
     */
    public boolean flush(Duration timeout) {
        try {
            writer.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            return writer.isTerminated();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Pending record writes did not complete within {}", timeout);
            return false;
        }
    }

    /**
     * Unsubscribes from the registry and drains pending writes.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (registrySubscription != null) {
                registrySubscription.cancel();
                registrySubscription = null;
            }
        }
        updateSubscriptions.values().forEach(Subscription::cancel);
        updateSubscriptions.clear();

        writer.shutdown();
        try {
            if (!writer.awaitTermination(flushTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Record writer did not finish within {}, dropping pending writes", flushTimeout);
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        log.debug("Instance persistor closed");
    }

    private void submit(String action, String id, String className, StoreOperation operation) {
        try {
            writer.execute(() -> {
                try {
                    operation.apply(store);
                } catch (IOException | RuntimeException e) {
                    storeFailures.incrementAndGet();
                    log.warn("Failed {} {} ({}), because {}", action, id, className, e.getMessage());
                    log.debug("Exception details:", e);
                    errors.record("STORE_FAILED", "Failed " + action, "Instance: " + id + " (" + className + "), cause: " + e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            storeFailures.incrementAndGet();
            log.warn("Persistor is closed, skipped {} {} ({})", action, id, className);
            errors.record("STORE_FAILED", "Persistor closed", "Skipped " + action + " for " + id);
        }
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        metrics.put("records_written", recordsWritten.get());
        metrics.put("records_deleted", recordsDeleted.get());
        metrics.put("store_failures", storeFailures.get());
        metrics.put("records_restored", recordsRestored.get());
        metrics.put("records_purged", recordsPurged.get());
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return errors.snapshot();
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @FunctionalInterface
    private interface StoreOperation {
        void apply(IRecordStore store) throws IOException;
    }
}

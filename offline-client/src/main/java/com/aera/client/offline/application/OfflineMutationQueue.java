package com.aera.client.offline.application;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aera.client.offline.domain.ConflictStrategy;
import com.aera.client.offline.domain.MutationKind;
import com.aera.client.offline.domain.MutationState;
import com.aera.client.offline.domain.QueuedMutation;
import com.aera.client.offline.domain.RemoteResource;
import com.aera.client.offline.domain.SyncOutcome;
import com.aera.client.offline.domain.SyncResult;

/**
 * Device-side queue of writes made while offline. Mutations are replayed in
 * (timestamp, sequence) order; a failed mutation blocks later ones for the same resource
 * until the next pass.
 *
 * <p>Every change is saved to the {@link MutationStore} before it becomes visible; a failed save
 * leaves the queue as it was and rethrows.
 */
public class OfflineMutationQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OfflineMutationQueue.class);

    static final int DEFAULT_MAX_ATTEMPTS = 3;
    static final int DEFAULT_HISTORY_LIMIT = 200;
    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final MutationStore store;
    private final RemoteResourceGateway gateway;
    private final ConnectivityMonitor connectivity;
    private final ConflictResolver resolver;
    private final Clock clock;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Runnable reconnectListener = this::triggerSync;
    private final int maxAttempts;
    private final int historyLimit;

    private final Object monitor = new Object();
    private final List<QueuedMutation> pending = new ArrayList<>();
    private final List<QueuedMutation> failed = new ArrayList<>();
    private final Deque<SyncOutcome> history = new ArrayDeque<>();
    private final List<SyncListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean syncing = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private long nextSequence;

    private OfflineMutationQueue(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
        this.connectivity = Objects.requireNonNull(builder.connectivity, "connectivity");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.resolver = builder.resolver != null ? builder.resolver : new ConflictResolver(clock);
        this.ownedExecutor = builder.executor == null ? defaultExecutor() : null;
        this.executor = builder.executor != null ? builder.executor : ownedExecutor;
        this.maxAttempts = builder.maxAttempts;
        this.historyLimit = builder.historyLimit;

        restore(store.load());
        connectivity.addReconnectListener(reconnectListener);
    }

    public static Builder builder() {
        return new Builder();
    }

    public QueuedMutation enqueue(
            MutationKind kind,
            String resourceType,
            String resourceId,
            Map<String, Object> payload,
            ConflictStrategy strategy
    ) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(strategy, "strategy");
        if (kind != MutationKind.CREATE && (resourceId == null || resourceId.isBlank())) {
            throw new IllegalArgumentException(kind + " requires a resource id");
        }
        Map<String, Object> body = payload == null ? Map.of() : payload;
        Instant now = clock.instant();

        QueuedMutation result;
        synchronized (monitor) {
            QueuedMutation replaceable = kind == MutationKind.UPDATE
                    ? findReplaceableUpdate(resourceType, resourceId).orElse(null)
                    : null;
            if (replaceable != null) {
                commit(() -> {
                    replaceable.replacePayload(body, now, strategy);
                    pending.sort(QueuedMutation.REPLAY_ORDER);
                });
                result = replaceable.copy();
                log.debug("Replaced pending update {}", replaceable);
            } else {
                UUID id = UUID.randomUUID();
                String targetId = resourceId != null ? resourceId : id.toString();
                QueuedMutation created =
                        new QueuedMutation(id, now, nextSequence, kind, resourceType, targetId, body, strategy);
                commit(() -> {
                    nextSequence++;
                    pending.add(created);
                    pending.sort(QueuedMutation.REPLAY_ORDER);
                });
                result = created.copy();
                log.debug("Enqueued {}", created);
            }
        }

        if (connectivity.isOnline()) {
            triggerSync();
        }
        return result;
    }

    public boolean cancel(UUID mutationId) {
        synchronized (monitor) {
            Optional<QueuedMutation> match = find(pending, mutationId);
            if (match.isEmpty() || match.get().getState() != MutationState.PENDING) {
                return false;
            }
            QueuedMutation mutation = match.get();
            commit(() -> pending.remove(mutation));
            log.debug("Cancelled {}", mutation);
            return true;
        }
    }

    public SyncReport sync() {
        int queued = pendingCount();
        if (queued == 0 || !connectivity.isOnline()) {
            return SyncReport.notStarted(queued);
        }
        if (!syncing.compareAndSet(false, true)) {
            return SyncReport.notStarted(pendingCount());
        }
        try {
            return drain();
        } finally {
            releaseInFlight();
            syncing.set(false);
        }
    }

    public List<QueuedMutation> pending() {
        synchronized (monitor) {
            return pending.stream().map(QueuedMutation::copy).toList();
        }
    }

    public List<QueuedMutation> failedMutations() {
        synchronized (monitor) {
            return failed.stream().map(QueuedMutation::copy).toList();
        }
    }

    public boolean retryFailed(UUID mutationId) {
        synchronized (monitor) {
            Optional<QueuedMutation> match = find(failed, mutationId);
            if (match.isEmpty()) {
                return false;
            }
            QueuedMutation mutation = match.get();
            commit(() -> {
                failed.remove(mutation);
                mutation.requeue();
                pending.add(mutation);
                pending.sort(QueuedMutation.REPLAY_ORDER);
            });
        }
        if (connectivity.isOnline()) {
            triggerSync();
        }
        return true;
    }

    public boolean discardFailed(UUID mutationId) {
        synchronized (monitor) {
            Optional<QueuedMutation> match = find(failed, mutationId);
            if (match.isEmpty()) {
                return false;
            }
            QueuedMutation mutation = match.get();
            commit(() -> failed.remove(mutation));
            return true;
        }
    }

    public List<SyncOutcome> history() {
        synchronized (monitor) {
            return List.copyOf(history);
        }
    }

    public void addListener(SyncListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SyncListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stops reacting to reconnects and, when the queue created its own sync thread, waits for a
     * running sync to finish before shutting it down. Queued mutations stay in the store.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connectivity.removeReconnectListener(reconnectListener);
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Sync thread did not stop within {}s, interrupting", CLOSE_TIMEOUT_SECONDS);
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void triggerSync() {
        if (closed.get()) {
            log.debug("Queue closed, background sync not scheduled");
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    sync();
                } catch (RuntimeException ex) {
                    log.error("Background sync failed", ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("Background sync rejected, executor is shut down", ex);
        }
    }

    private SyncReport drain() {
        List<SyncOutcome> outcomes = new ArrayList<>();
        Set<UUID> attempted = new HashSet<>();
        Set<String> blocked = new HashSet<>();

        while (true) {
            QueuedMutation next;
            synchronized (monitor) {
                next = pending.stream()
                        .filter(mutation -> mutation.getState() == MutationState.PENDING)
                        .filter(mutation -> !attempted.contains(mutation.getId()))
                        .filter(mutation -> !blocked.contains(resourceKey(mutation)))
                        .findFirst()
                        .orElse(null);
                if (next == null) {
                    break;
                }
                QueuedMutation selected = next;
                commit(selected::markInFlight);
                next = selected.copy();
            }
            attempted.add(next.getId());

            SyncOutcome outcome = replay(next);
            if (outcome.result() == SyncResult.RETRY_SCHEDULED || outcome.result() == SyncResult.DEAD_LETTERED) {
                blocked.add(resourceKey(next));
            }
            outcomes.add(outcome);
            publish(outcome);
        }

        int remaining = pendingCount();
        if (!outcomes.isEmpty()) {
            log.info("Sync pass finished: {} processed, {} retry scheduled, {} dead-lettered, {} remaining",
                    outcomes.size(),
                    outcomes.stream().filter(o -> o.result() == SyncResult.RETRY_SCHEDULED).count(),
                    outcomes.stream().filter(o -> o.result() == SyncResult.DEAD_LETTERED).count(),
                    remaining);
        }
        return new SyncReport(true, outcomes, remaining);
    }

    private SyncOutcome replay(QueuedMutation mutation) {
        Decision decision;
        try {
            decision = switch (mutation.getKind()) {
                case CREATE -> replayCreate(mutation);
                case UPDATE -> replayUpdate(mutation);
                case DELETE -> replayDelete(mutation);
            };
        } catch (RemoteCallException ex) {
            return fail(mutation, ex.isRetryable(), describe(ex));
        } catch (RuntimeException ex) {
            return fail(mutation, false, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
        log.debug("Replayed {} -> {}", mutation, decision.result());
        return complete(mutation, decision);
    }

    private Decision replayCreate(QueuedMutation mutation) {
        if (gateway.exists(mutation.getResourceType(), mutation.getResourceId())) {
            return new Decision(SyncResult.SKIPPED_EXISTING, "already on server");
        }
        gateway.create(mutation.getResourceType(), mutation.getResourceId(), mutation.getPayload());
        return new Decision(SyncResult.APPLIED, null);
    }

    private Decision replayUpdate(QueuedMutation mutation) {
        Optional<RemoteResource> current = gateway.fetch(mutation.getResourceType(), mutation.getResourceId());
        if (current.isEmpty()) {
            if (mutation.getStrategy() == ConflictStrategy.CLIENT_WINS) {
                gateway.create(mutation.getResourceType(), mutation.getResourceId(), mutation.getPayload());
                return new Decision(SyncResult.CLIENT_OVERWROTE, "recreated missing resource");
            }
            return new Decision(SyncResult.SERVER_MISSING, "resource no longer exists");
        }

        RemoteResource server = current.get();
        if (server.lastModified() == null || !server.lastModified().isAfter(mutation.getEnqueuedAt())) {
            gateway.update(mutation.getResourceType(), mutation.getResourceId(), mutation.getPayload());
            return new Decision(SyncResult.APPLIED, null);
        }

        ConflictResolver.Resolution resolution =
                resolver.resolve(server.fields(), mutation.getPayload(), mutation.getStrategy());
        if (resolution.applyToServer()) {
            gateway.update(mutation.getResourceType(), mutation.getResourceId(), resolution.payload());
        }
        return new Decision(resolution.outcome(), "server modified at " + server.lastModified());
    }

    private Decision replayDelete(QueuedMutation mutation) {
        gateway.delete(mutation.getResourceType(), mutation.getResourceId());
        return new Decision(SyncResult.APPLIED, null);
    }

    private SyncOutcome complete(QueuedMutation sent, Decision decision) {
        synchronized (monitor) {
            commit(() -> find(pending, sent.getId()).ifPresent(mutation -> {
                mutation.markDone();
                pending.remove(mutation);
            }));
            return record(sent, decision.result(), decision.detail());
        }
    }

    private SyncOutcome fail(QueuedMutation sent, boolean retryable, String error) {
        synchronized (monitor) {
            QueuedMutation mutation = find(pending, sent.getId())
                    .orElseThrow(() -> new IllegalStateException("In-flight mutation vanished: " + sent.getId()));
            boolean deadLetter = !retryable || mutation.getRetryCount() + 1 >= maxAttempts;
            commit(() -> {
                if (retryable) {
                    mutation.scheduleRetry(error);
                }
                if (deadLetter) {
                    mutation.markFailed(error);
                    pending.remove(mutation);
                    failed.add(mutation);
                }
            });
            if (deadLetter) {
                log.warn("Dead-lettered {}: {}", mutation, error);
                return record(mutation, SyncResult.DEAD_LETTERED, error);
            }
            return record(mutation, SyncResult.RETRY_SCHEDULED, error);
        }
    }

    private SyncOutcome record(QueuedMutation mutation, SyncResult result, String detail) {
        SyncOutcome outcome = new SyncOutcome(
                mutation.getId(),
                mutation.getKind(),
                mutation.getResourceType(),
                mutation.getResourceId(),
                result,
                detail,
                clock.instant()
        );
        history.addLast(outcome);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
        return outcome;
    }

    private void publish(SyncOutcome outcome) {
        for (SyncListener listener : listeners) {
            try {
                listener.onOutcome(outcome);
            } catch (RuntimeException ex) {
                log.warn("Sync listener {} failed for {}", listener, outcome.mutationId(), ex);
            }
        }
    }

    private Optional<QueuedMutation> findReplaceableUpdate(String resourceType, String resourceId) {
        QueuedMutation latest = null;
        for (QueuedMutation mutation : pending) {
            if (mutation.targets(resourceType, resourceId)) {
                latest = mutation;
            }
        }
        if (latest != null
                && latest.getKind() == MutationKind.UPDATE
                && latest.getState() == MutationState.PENDING) {
            return Optional.of(latest);
        }
        return Optional.empty();
    }

    private void restore(QueueSnapshot snapshot) {
        synchronized (monitor) {
            long maxSequence = -1;
            for (QueuedMutation mutation : snapshot.pending()) {
                QueuedMutation restored = mutation.copy();
                restored.resetInFlight();
                pending.add(restored);
                maxSequence = Math.max(maxSequence, restored.getSequence());
            }
            for (QueuedMutation mutation : snapshot.failed()) {
                failed.add(mutation.copy());
                maxSequence = Math.max(maxSequence, mutation.getSequence());
            }
            pending.sort(QueuedMutation.REPLAY_ORDER);
            nextSequence = Math.max(snapshot.nextSequence(), maxSequence + 1);
            if (!pending.isEmpty() || !failed.isEmpty()) {
                log.info("Restored offline queue: {} pending, {} failed", pending.size(), failed.size());
            }
        }
    }

    /**
     * Applies {@code change} and saves the result. On any failure the in-memory queue is restored
     * to its state before the change. Callers hold the monitor.
     */
    private void commit(Runnable change) {
        List<QueuedMutation> pendingBefore = pending.stream().map(QueuedMutation::copy).toList();
        List<QueuedMutation> failedBefore = failed.stream().map(QueuedMutation::copy).toList();
        long sequenceBefore = nextSequence;
        try {
            change.run();
            persist();
        } catch (RuntimeException ex) {
            pending.clear();
            pending.addAll(pendingBefore);
            failed.clear();
            failed.addAll(failedBefore);
            nextSequence = sequenceBefore;
            throw ex;
        }
    }

    // a pass aborted by a store failure can leave its current mutation IN_FLIGHT
    private void releaseInFlight() {
        synchronized (monitor) {
            for (QueuedMutation mutation : pending) {
                if (mutation.getState() == MutationState.IN_FLIGHT) {
                    mutation.resetInFlight();
                    log.warn("Sync pass aborted, {} returned to pending", mutation);
                }
            }
        }
    }

    private void persist() {
        store.save(new QueueSnapshot(
                pending.stream().map(QueuedMutation::copy).toList(),
                failed.stream().map(QueuedMutation::copy).toList(),
                nextSequence
        ));
    }

    private int pendingCount() {
        synchronized (monitor) {
            return pending.size();
        }
    }

    private static Optional<QueuedMutation> find(List<QueuedMutation> mutations, UUID mutationId) {
        return mutations.stream().filter(mutation -> mutation.getId().equals(mutationId)).findFirst();
    }

    private static String resourceKey(QueuedMutation mutation) {
        return mutation.getResourceType() + "/" + mutation.getResourceId();
    }

    private static String describe(RemoteCallException ex) {
        return ex.getStatus() == RemoteCallException.NO_RESPONSE
                ? ex.getMessage()
                : ex.getStatus() + " " + ex.getMessage();
    }

    private static ExecutorService defaultExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "offline-sync");
            thread.setDaemon(true);
            return thread;
        });
    }

    private record Decision(SyncResult result, String detail) {
    }

    public static final class Builder {

        private MutationStore store;
        private RemoteResourceGateway gateway;
        private ConnectivityMonitor connectivity;
        private ConflictResolver resolver;
        private Clock clock;
        private Executor executor;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private int historyLimit = DEFAULT_HISTORY_LIMIT;

        private Builder() {
        }

        public Builder store(MutationStore store) {
            this.store = store;
            return this;
        }

        public Builder gateway(RemoteResourceGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder connectivity(ConnectivityMonitor connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder resolver(ConflictResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Executor for syncs triggered by reconnect or enqueue. Defaults to a single daemon thread
         * owned by the queue and stopped by {@link OfflineMutationQueue#close()}; a supplied
         * executor is left running.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            if (historyLimit < 1) {
                throw new IllegalArgumentException("historyLimit must be at least 1");
            }
            this.historyLimit = historyLimit;
            return this;
        }

        public OfflineMutationQueue build() {
            return new OfflineMutationQueue(this);
        }
    }
}

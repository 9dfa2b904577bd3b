package com.aera.client.offline.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A write captured on the device. The id doubles as the idempotency key on replay and,
 * for CREATE without an explicit resource id, as the client-assigned resource id.
 */
public final class QueuedMutation {

    /** Replay order: logical timestamp, then enqueue sequence. */
    public static final Comparator<QueuedMutation> REPLAY_ORDER = Comparator
            .comparing(QueuedMutation::getEnqueuedAt)
            .thenComparingLong(QueuedMutation::getSequence);

    private final UUID id;
    private final long sequence;
    private final MutationKind kind;
    private final String resourceType;
    private final String resourceId;
    private Instant enqueuedAt;
    private Map<String, Object> payload;
    private ConflictStrategy strategy;
    private int retryCount;
    private MutationState state;
    private String lastError;

    public QueuedMutation(
            UUID id,
            Instant enqueuedAt,
            long sequence,
            MutationKind kind,
            String resourceType,
            String resourceId,
            Map<String, Object> payload,
            ConflictStrategy strategy
    ) {
        this(id, enqueuedAt, sequence, kind, resourceType, resourceId, payload, strategy, 0, MutationState.PENDING, null);
    }

    @JsonCreator
    public QueuedMutation(
            @JsonProperty("id") UUID id,
            @JsonProperty("enqueuedAt") Instant enqueuedAt,
            @JsonProperty("sequence") long sequence,
            @JsonProperty("kind") MutationKind kind,
            @JsonProperty("resourceType") String resourceType,
            @JsonProperty("resourceId") String resourceId,
            @JsonProperty("payload") Map<String, Object> payload,
            @JsonProperty("strategy") ConflictStrategy strategy,
            @JsonProperty("retryCount") int retryCount,
            @JsonProperty("state") MutationState state,
            @JsonProperty("lastError") String lastError
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        this.sequence = sequence;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
        this.resourceId = resourceId;
        this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        this.strategy = strategy == null ? ConflictStrategy.SERVER_WINS : strategy;
        this.retryCount = retryCount;
        this.state = state == null ? MutationState.PENDING : state;
        this.lastError = lastError;
    }

    public QueuedMutation copy() {
        return new QueuedMutation(id, enqueuedAt, sequence, kind, resourceType, resourceId, payload, strategy,
                retryCount, state, lastError);
    }

    public boolean targets(String type, String resource) {
        return resourceType.equals(type) && Objects.equals(resourceId, resource);
    }

    /**
     * Folds a newer UPDATE into this one. Identity and sequence are kept.
     */
    public void replacePayload(Map<String, Object> newPayload, Instant newTimestamp, ConflictStrategy newStrategy) {
        requireState(MutationState.PENDING);
        this.payload = new LinkedHashMap<>(newPayload);
        this.enqueuedAt = newTimestamp;
        this.strategy = newStrategy;
        this.retryCount = 0;
        this.lastError = null;
    }

    public void markInFlight() {
        requireState(MutationState.PENDING);
        this.state = MutationState.IN_FLIGHT;
    }

    public void markDone() {
        requireState(MutationState.IN_FLIGHT);
        this.state = MutationState.DONE;
        this.lastError = null;
    }

    public void scheduleRetry(String error) {
        requireState(MutationState.IN_FLIGHT);
        this.retryCount++;
        this.lastError = error;
        this.state = MutationState.PENDING;
    }

    public void markFailed(String error) {
        this.lastError = error;
        this.state = MutationState.FAILED;
    }

    /**
     * Crash recovery: an interrupted send is retried.
     */
    public void resetInFlight() {
        if (state == MutationState.IN_FLIGHT) {
            state = MutationState.PENDING;
        }
    }

    public void requeue() {
        requireState(MutationState.FAILED);
        this.state = MutationState.PENDING;
        this.retryCount = 0;
        this.lastError = null;
    }

    private void requireState(MutationState expected) {
        if (state != expected) {
            throw new IllegalStateException("Mutation " + id + " is " + state + ", expected " + expected);
        }
    }

    public UUID getId() {
        return id;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public long getSequence() {
        return sequence;
    }

    public MutationKind getKind() {
        return kind;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public ConflictStrategy getStrategy() {
        return strategy;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public MutationState getState() {
        return state;
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return kind + " " + resourceType + "/" + resourceId + " (" + id + ", " + state + ", retries=" + retryCount + ")";
    }
}

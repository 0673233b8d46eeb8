package com.prospectenhancer.enhancement.queue;

import com.prospectenhancer.domain.EnhancementKind;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One unit of queued work. Lower priority values are served first, ties in submission order.
 */
final class QueuedJob implements Comparable<QueuedJob> {

    static final int INDIVIDUAL_PRIORITY = 1;
    static final int BULK_PRIORITY = 10;

    private final String id;
    private final EnhancementKind kind;
    private final List<String> prospectIds;
    private final boolean force;
    private final boolean individual;
    private final String ownerId;
    private final int priority;
    private final long sequence;

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile QueuedJobState state = QueuedJobState.PENDING;
    private volatile String error;

    QueuedJob(String id, EnhancementKind kind, List<String> prospectIds, boolean force, boolean individual,
              String ownerId, long sequence) {
        this.id = id;
        this.kind = kind;
        this.prospectIds = List.copyOf(prospectIds);
        this.force = force;
        this.individual = individual;
        this.ownerId = ownerId;
        this.priority = individual ? INDIVIDUAL_PRIORITY : BULK_PRIORITY;
        this.sequence = sequence;
    }

    String id() {
        return id;
    }

    EnhancementKind kind() {
        return kind;
    }

    List<String> prospectIds() {
        return prospectIds;
    }

    boolean force() {
        return force;
    }

    boolean individual() {
        return individual;
    }

    String ownerId() {
        return ownerId;
    }

    QueuedJobState state() {
        return state;
    }

    void state(QueuedJobState newState) {
        this.state = newState;
    }

    void fail(String message) {
        this.error = message;
        this.state = QueuedJobState.FAILED;
    }

    void incrementProcessed() {
        processed.incrementAndGet();
    }

    void requestCancel() {
        cancelRequested.set(true);
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    QueuedJobStatus status() {
        return new QueuedJobStatus(id, state, processed.get(), prospectIds.size(), error);
    }

    @Override
    public int compareTo(QueuedJob other) {
        int byPriority = Integer.compare(priority, other.priority);
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }
}

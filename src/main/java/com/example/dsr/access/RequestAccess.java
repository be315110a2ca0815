package com.example.dsr.access;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestStatus;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code dsr_requests} table. All writes are single-row upserts;
 * state transitions that must not race go through {@link #saveIfStatus}.
 */
public interface RequestAccess {

    /**
     * Allocates the next numeric request id from an atomic counter.
     */
    long nextRequestId();

    Optional<Request> findById(long requestId);

    Request save(Request request);

    /**
     * Writes the request only if the stored copy still has {@code expected} status.
     *
     * @return false when another writer moved the request first
     */
    boolean saveIfStatus(Request request, RequestStatus expected);

    /**
     * Returns requests matching every non-null criterion, newest first, at most {@code limit}.
     */
    List<Request> find(RequestQuery query);

    /**
     * Pending requests that were scheduled for processing before {@code cutoffTimestamp}
     * but never claimed.
     */
    List<Request> findQueuedBefore(long cutoffTimestamp);
}

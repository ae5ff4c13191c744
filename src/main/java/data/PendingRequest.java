package data;

import ibkr.model.GatewayError;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One in-flight correlated call: the fragments received so far and the signal its caller waits on.
 * Fragments are only accepted until the request is completed.
 */
public class PendingRequest<T> {
    @Getter
    private final int requestId;
    @Getter
    private final RequestKind kind;
    @Getter
    private final Class<T> fragmentType;
    @Getter
    private final Instant issuedAt;

    private final List<T> buffer = new ArrayList<>();
    private final CompletableFuture<RequestOutcome<List<T>>> completion = new CompletableFuture<>();

    private volatile long lastActivityNanos;
    private volatile boolean touched;

    PendingRequest(int requestId, RequestKind kind, Class<T> fragmentType) {
        this.requestId = requestId;
        this.kind = kind;
        this.fragmentType = fragmentType;
        this.issuedAt = Instant.now();
        this.lastActivityNanos = System.nanoTime();
    }

    synchronized boolean append(T fragment) {
        if (completion.isDone()) {
            return false;
        }
        buffer.add(fragment);
        touch();
        return true;
    }

    void touch() {
        lastActivityNanos = System.nanoTime();
        touched = true;
    }

    synchronized boolean succeed() {
        return completion.complete(RequestOutcome.ok(List.copyOf(buffer)));
    }

    boolean fail(GatewayError error) {
        return completion.complete(RequestOutcome.failed(error));
    }

    boolean expire() {
        return completion.complete(RequestOutcome.timedOut(requestId));
    }

    CompletableFuture<RequestOutcome<List<T>>> completion() {
        return completion;
    }

    boolean isTouched() {
        return touched;
    }

    long nanosSinceActivity() {
        return System.nanoTime() - lastActivityNanos;
    }

    public synchronized int fragmentCount() {
        return buffer.size();
    }

    public boolean isDone() {
        return completion.isDone();
    }
}

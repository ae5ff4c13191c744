package data;

import ibkr.model.GatewayError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Correlates outbound requests with the callbacks that answer them.
 *
 * <p>Caller threads {@link #issue} a request, send it on the wire and {@link #await} it. The reader
 * thread feeds fragments with {@link #addFragment} and finishes the request with {@link #complete}
 * or {@link #fail}. Each request leaves the registry exactly once, through whichever of
 * complete, fail, timeout or cancel happens first; every later call for that id is a no-op.
 * Nothing on the callback side blocks.
 */
public class RequestRegistry {
    private static final Logger log = LoggerFactory.getLogger(RequestRegistry.class);

    public static final int FIRST_REQUEST_ID = 1000;

    private final ConcurrentHashMap<Integer, PendingRequest<?>> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<RequestKind, Integer> exclusiveOwners = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(FIRST_REQUEST_ID);

    /**
     * Allocates an id without registering a waiter, for standing subscriptions that nobody awaits.
     */
    public int nextReqId() {
        return nextId.getAndIncrement();
    }

    public <T> PendingRequest<T> issue(RequestKind kind, Class<T> fragmentType) {
        PendingRequest<T> request = new PendingRequest<>(nextReqId(), kind, fragmentType);
        pending.put(request.getRequestId(), request);
        log.trace("Issued {} request reqId={}", kind, request.getRequestId());
        return request;
    }

    /**
     * Issues a request of a kind the gateway answers without a request id. Callers must serialize
     * requests of the same kind.
     *
     * @throws IllegalStateException if another request of this kind is still in flight
     */
    public <T> PendingRequest<T> issueExclusive(RequestKind kind, Class<T> fragmentType) {
        if (!kind.isExclusive()) {
            throw new IllegalArgumentException(kind + " requests carry their own request id");
        }
        PendingRequest<T> request = new PendingRequest<>(nextReqId(), kind, fragmentType);
        Integer owner = exclusiveOwners.putIfAbsent(kind, request.getRequestId());
        if (owner != null) {
            throw new IllegalStateException(kind + " request " + owner + " is still in flight");
        }
        pending.put(request.getRequestId(), request);
        log.trace("Issued exclusive {} request reqId={}", kind, request.getRequestId());
        return request;
    }

    public OptionalInt exclusiveOwner(RequestKind kind) {
        Integer owner = exclusiveOwners.get(kind);
        return owner == null ? OptionalInt.empty() : OptionalInt.of(owner);
    }

    public boolean isPending(int reqId) {
        return pending.containsKey(reqId);
    }

    public int pendingCount() {
        return pending.size();
    }

    public <T> RequestOutcome<List<T>> await(PendingRequest<T> request, Duration timeout) {
        return await(request, timeout, null);
    }

    /**
     * Blocks until the request completes, fails or the timeout elapses. With a quiet period, a request
     * that received data and then heard nothing for that long is completed by the waiter itself.
     * A timed out request is unregistered before this returns, so a late callback is dropped.
     */
    public <T> RequestOutcome<List<T>> await(PendingRequest<T> request, Duration timeout, Duration quietPeriod) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long quietNanos = quietPeriod == null ? Long.MAX_VALUE : quietPeriod.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return expire(request);
                }
                try {
                    return request.completion().get(Math.min(remaining, quietNanos), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    if (request.isTouched() && request.nanosSinceActivity() >= quietNanos) {
                        log.debug("No data for reqId={} in {}ms - treating as complete",
                                request.getRequestId(), quietPeriod.toMillis());
                        complete(request.getRequestId());
                        return request.completion().join();
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(request.getRequestId());
            return request.completion().join();
        } catch (ExecutionException e) {
            // completion is never completed exceptionally
            unregister(request);
            return RequestOutcome.failed(GatewayError.cancelled(request.getRequestId()));
        }
    }

    private <T> RequestOutcome<List<T>> expire(PendingRequest<T> request) {
        if (unregister(request)) {
            request.expire();
            log.warn("Timed out waiting for {} reqId={} ({} fragments received)",
                    request.getKind(), request.getRequestId(), request.fragmentCount());
            return RequestOutcome.timedOut(request.getRequestId());
        }
        // completed by the reader thread while the deadline passed
        return request.completion().join();
    }

    /**
     * Appends one fragment of a multi-row answer. Returns false when the id is unknown, already
     * finished, or registered for a different fragment type.
     */
    public <T> boolean addFragment(int reqId, Class<T> type, T fragment) {
        PendingRequest<?> request = pending.get(reqId);
        if (request == null || fragment == null) {
            return false;
        }
        return append(request, type, fragment);
    }

    public <T> boolean addExclusiveFragment(RequestKind kind, Class<T> type, T fragment) {
        Integer owner = exclusiveOwners.get(kind);
        return owner != null && addFragment(owner, type, fragment);
    }

    @SuppressWarnings("unchecked")
    private static <T> boolean append(PendingRequest<?> request, Class<T> type, T fragment) {
        if (request.getFragmentType() != type) {
            log.warn("Dropping {} fragment for reqId={} registered as {} expecting {}",
                    type.getSimpleName(), request.getRequestId(), request.getKind(),
                    request.getFragmentType().getSimpleName());
            return false;
        }
        return ((PendingRequest<T>) request).append(fragment);
    }

    /** Records activity for requests whose data lands outside the fragment buffer. */
    public boolean touch(int reqId) {
        PendingRequest<?> request = pending.get(reqId);
        if (request == null) {
            return false;
        }
        request.touch();
        return true;
    }

    public boolean complete(int reqId) {
        PendingRequest<?> request = remove(reqId);
        if (request == null) {
            log.trace("Completion for unknown or finished reqId={} ignored", reqId);
            return false;
        }
        request.succeed();
        return true;
    }

    public boolean completeExclusive(RequestKind kind) {
        Integer owner = exclusiveOwners.get(kind);
        return owner != null && complete(owner);
    }

    public boolean fail(int reqId, GatewayError error) {
        PendingRequest<?> request = remove(reqId);
        if (request == null) {
            return false;
        }
        request.fail(error);
        return true;
    }

    public boolean cancel(int reqId) {
        return fail(reqId, GatewayError.cancelled(reqId));
    }

    /**
     * Wakes every waiter with the same failure, used when the connection goes away.
     */
    public int failAll(GatewayError error) {
        int failed = 0;
        for (Integer reqId : List.copyOf(pending.keySet())) {
            if (fail(reqId, error)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed {} pending requests: {}", failed, error);
        }
        return failed;
    }

    /**
     * Restarts the id sequence for a new session. Only done when nothing is pending.
     */
    public void resetIds() {
        if (!pending.isEmpty()) {
            log.warn("Not resetting request ids - {} requests still pending", pending.size());
            return;
        }
        nextId.set(FIRST_REQUEST_ID);
    }

    private PendingRequest<?> remove(int reqId) {
        PendingRequest<?> request = pending.remove(reqId);
        if (request != null && request.getKind().isExclusive()) {
            exclusiveOwners.remove(request.getKind(), reqId);
        }
        return request;
    }

    private boolean unregister(PendingRequest<?> request) {
        boolean removed = pending.remove(request.getRequestId(), request);
        if (removed && request.getKind().isExclusive()) {
            exclusiveOwners.remove(request.getKind(), request.getRequestId());
        }
        return removed;
    }
}

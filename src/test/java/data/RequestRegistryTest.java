package data;

import ibkr.model.ErrorCategory;
import ibkr.model.GatewayError;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestRegistryTest {

    private final RequestRegistry registry = new RequestRegistry();

    @Test
    void requestIdsStartAtFirstRequestIdAndIncrease() {
        PendingRequest<String> first = registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        PendingRequest<String> second = registry.issue(RequestKind.HISTORICAL_DATA, String.class);

        assertThat(first.getRequestId()).isEqualTo(RequestRegistry.FIRST_REQUEST_ID);
        assertThat(second.getRequestId()).isEqualTo(RequestRegistry.FIRST_REQUEST_ID + 1);
        assertThat(registry.nextReqId()).isEqualTo(RequestRegistry.FIRST_REQUEST_ID + 2);
    }

    @Test
    void fragmentsAreReturnedInArrivalOrderOnComplete() {
        PendingRequest<String> request = registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        int reqId = request.getRequestId();
        for (int i = 0; i < 10; i++) {
            assertThat(registry.addFragment(reqId, String.class, "bar-" + i)).isTrue();
        }
        registry.complete(reqId);

        RequestOutcome<List<String>> outcome = registry.await(request, Duration.ofSeconds(1));

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.getValue()).hasSize(10).startsWith("bar-0").endsWith("bar-9");
        assertThat(registry.isPending(reqId)).isFalse();
    }

    @Test
    void completionFromAnotherThreadWakesWaiter() {
        PendingRequest<Integer> request = registry.issue(RequestKind.CONTRACT_SEARCH, Integer.class);
        int reqId = request.getRequestId();

        CompletableFuture.runAsync(() -> {
            registry.addFragment(reqId, Integer.class, 1);
            registry.addFragment(reqId, Integer.class, 2);
            registry.complete(reqId);
        }, CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

        RequestOutcome<List<Integer>> outcome = registry.await(request, Duration.ofSeconds(2));

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.OK);
        assertThat(outcome.getValue()).containsExactly(1, 2);
    }

    @Test
    void timeoutUnregistersSoLateCallbacksAreNoOps() {
        PendingRequest<String> request = registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        int reqId = request.getRequestId();
        registry.addFragment(reqId, String.class, "partial");

        RequestOutcome<List<String>> outcome = registry.await(request, Duration.ofMillis(50));

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.TIMED_OUT);
        assertThat(outcome.getValue()).isNull();
        assertThat(outcome.getError().getId()).isEqualTo(reqId);
        assertThat(registry.isPending(reqId)).isFalse();

        assertThat(registry.addFragment(reqId, String.class, "late")).isFalse();
        assertThat(registry.complete(reqId)).isFalse();
        assertThat(registry.fail(reqId, GatewayError.cancelled(reqId))).isFalse();
        assertThat(request.completion().join().getStatus()).isEqualTo(OutcomeStatus.TIMED_OUT);
    }

    @Test
    void errorNamingTheIdFailsOnlyThatRequest() {
        PendingRequest<String> failing = registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        PendingRequest<String> other = registry.issue(RequestKind.HISTORICAL_DATA, String.class);

        registry.fail(failing.getRequestId(), GatewayError.of(failing.getRequestId(), 162,
                "Historical Market Data Service error message", ErrorCategory.REQUEST_TERMINAL));

        RequestOutcome<List<String>> outcome = registry.await(failing, Duration.ofSeconds(1));
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.getError().getCode()).isEqualTo(162);
        assertThat(registry.isPending(other.getRequestId())).isTrue();
    }

    @Test
    void quietPeriodCompletesRequestThatStoppedReceivingData() {
        PendingRequest<String> request = registry.issue(RequestKind.SNAPSHOT, String.class);
        registry.touch(request.getRequestId());

        RequestOutcome<List<String>> outcome = registry.await(request, Duration.ofSeconds(5), Duration.ofMillis(100));

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.getValue()).isEmpty();
    }

    @Test
    void quietPeriodDoesNotCompleteUntouchedRequest() {
        PendingRequest<String> request = registry.issue(RequestKind.SNAPSHOT, String.class);

        RequestOutcome<List<String>> outcome = registry.await(request, Duration.ofMillis(250), Duration.ofMillis(50));

        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.TIMED_OUT);
    }

    @Test
    void fragmentOfWrongTypeIsDropped() {
        PendingRequest<String> request = registry.issue(RequestKind.HISTORICAL_DATA, String.class);

        assertThat(registry.addFragment(request.getRequestId(), Integer.class, 42)).isFalse();
        assertThat(request.fragmentCount()).isZero();
    }

    @Test
    void exclusiveKindAllowsOneRequestInFlight() {
        PendingRequest<String> positions = registry.issueExclusive(RequestKind.POSITIONS, String.class);

        assertThatThrownBy(() -> registry.issueExclusive(RequestKind.POSITIONS, String.class))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.exclusiveOwner(RequestKind.POSITIONS)).hasValue(positions.getRequestId());

        registry.addExclusiveFragment(RequestKind.POSITIONS, String.class, "AAPL");
        registry.completeExclusive(RequestKind.POSITIONS);

        assertThat(registry.await(positions, Duration.ofSeconds(1)).getValue()).containsExactly("AAPL");
        assertThat(registry.exclusiveOwner(RequestKind.POSITIONS)).isEmpty();
        registry.issueExclusive(RequestKind.POSITIONS, String.class);
    }

    @Test
    void exclusiveKindIsReleasedOnTimeout() {
        PendingRequest<String> first = registry.issueExclusive(RequestKind.OPEN_ORDERS, String.class);
        registry.await(first, Duration.ofMillis(20));

        assertThat(registry.exclusiveOwner(RequestKind.OPEN_ORDERS)).isEmpty();
        assertThat(registry.addExclusiveFragment(RequestKind.OPEN_ORDERS, String.class, "late")).isFalse();
    }

    @Test
    void issueExclusiveRejectsKindsWithRequestIds() {
        assertThatThrownBy(() -> registry.issueExclusive(RequestKind.HISTORICAL_DATA, String.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failAllWakesEveryWaiterWithNotConnected() {
        PendingRequest<String> a = registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        PendingRequest<String> b = registry.issueExclusive(RequestKind.POSITIONS, String.class);

        assertThat(registry.failAll(GatewayError.notConnected())).isEqualTo(2);

        assertThat(registry.await(a, Duration.ofSeconds(1)).getStatus()).isEqualTo(OutcomeStatus.NOT_CONNECTED);
        assertThat(registry.await(b, Duration.ofSeconds(1)).getStatus()).isEqualTo(OutcomeStatus.NOT_CONNECTED);
        assertThat(registry.pendingCount()).isZero();
        assertThat(registry.exclusiveOwner(RequestKind.POSITIONS)).isEmpty();
    }

    @Test
    void resetIdsOnlyWhenNothingPending() {
        registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        registry.resetIds();
        assertThat(registry.nextReqId()).isEqualTo(RequestRegistry.FIRST_REQUEST_ID + 1);

        registry.failAll(GatewayError.notConnected());
        registry.resetIds();
        assertThat(registry.nextReqId()).isEqualTo(RequestRegistry.FIRST_REQUEST_ID);
    }

    @Test
    void interruptedWaiterCancelsRequest() throws Exception {
        PendingRequest<String> request = registry.issue(RequestKind.HISTORICAL_DATA, String.class);
        CompletableFuture<RequestOutcome<List<String>>> result = new CompletableFuture<>();
        Thread waiter = new Thread(() -> result.complete(registry.await(request, Duration.ofSeconds(30))));
        waiter.start();
        Thread.sleep(50);
        waiter.interrupt();

        RequestOutcome<List<String>> outcome = result.get(2, TimeUnit.SECONDS);
        assertThat(outcome.isOk()).isFalse();
        assertThat(registry.isPending(request.getRequestId())).isFalse();
    }
}

package data;

import ibkr.model.ErrorCategory;
import ibkr.model.GatewayError;
import lombok.Getter;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a correlated gateway call. A failed, timed out or disconnected call never carries a value,
 * so a partial result can't be mistaken for a complete one.
 */
@Getter
public final class RequestOutcome<T> {
    private final OutcomeStatus status;
    private final T value;
    private final GatewayError error;

    private RequestOutcome(OutcomeStatus status, T value, GatewayError error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> RequestOutcome<T> ok(T value) {
        return new RequestOutcome<>(OutcomeStatus.OK, value, null);
    }

    public static <T> RequestOutcome<T> failed(GatewayError error) {
        return new RequestOutcome<>(statusFor(error), null, error);
    }

    public static <T> RequestOutcome<T> timedOut(int requestId) {
        return new RequestOutcome<>(OutcomeStatus.TIMED_OUT, null, GatewayError.timeout(requestId));
    }

    public static <T> RequestOutcome<T> notConnected() {
        return new RequestOutcome<>(OutcomeStatus.NOT_CONNECTED, null, GatewayError.notConnected());
    }

    private static OutcomeStatus statusFor(GatewayError error) {
        if (error == null) {
            return OutcomeStatus.FAILED;
        }
        if (error.getCategory() == ErrorCategory.CONNECTION_FATAL) {
            return OutcomeStatus.NOT_CONNECTED;
        }
        if (error.getCategory() == ErrorCategory.MARKET_DATA_PERMISSION) {
            return OutcomeStatus.PERMISSION_DENIED;
        }
        return OutcomeStatus.FAILED;
    }

    public boolean isOk() {
        return status == OutcomeStatus.OK;
    }

    public Optional<T> toOptional() {
        return isOk() ? Optional.ofNullable(value) : Optional.empty();
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    /** Failures keep their status and error. */
    public <R> RequestOutcome<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) {
            return new RequestOutcome<>(status, null, error);
        }
        return new RequestOutcome<>(status, mapper.apply(value), null);
    }

    @Override
    public String toString() {
        return isOk() ? "RequestOutcome[OK]" : "RequestOutcome[" + status + " " + error + "]";
    }
}

package ibkr.model;

import java.math.BigDecimal;

public enum OrderStatus {
    PENDING,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    INACTIVE;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    /**
     * Maps a gateway status string. Returns null for statuses this tracker does not know.
     */
    public static OrderStatus fromWire(String status, BigDecimal filled, BigDecimal remaining) {
        if (status == null) {
            return null;
        }
        switch (status) {
            case "PendingSubmit":
            case "ApiPending":
                return PENDING;
            case "PreSubmitted":
            case "Submitted":
            case "PendingCancel":
                boolean partial = filled != null && filled.signum() > 0
                        && remaining != null && remaining.signum() > 0;
                return partial ? PARTIALLY_FILLED : SUBMITTED;
            case "Filled":
                return FILLED;
            case "Cancelled":
            case "ApiCancelled":
                return CANCELLED;
            case "Inactive":
                return INACTIVE;
            default:
                return null;
        }
    }
}

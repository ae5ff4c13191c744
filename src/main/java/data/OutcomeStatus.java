package data;

public enum OutcomeStatus {
    OK,
    FAILED,
    TIMED_OUT,
    NOT_CONNECTED,
    PERMISSION_DENIED
}

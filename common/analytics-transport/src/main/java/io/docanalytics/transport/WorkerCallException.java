package io.docanalytics.transport;

/**
 * A worker call that produced no usable reply. The dispatcher counts it against the item and
 * moves on.
 */
public class WorkerCallException extends Exception {

    public enum Reason {
        TIMEOUT,
        TRANSPORT,
        MALFORMED_REPLY,
        REJECTED
    }

    private final Reason reason;

    public WorkerCallException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public WorkerCallException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}

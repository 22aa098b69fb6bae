package io.github.drompincen.fixflow.runtime.error;

/**
 * Failure of a service operation. The gateway maps {@link ErrorKind} to an HTTP status
 * and returns the message to the caller as-is.
 */
public class FixFlowException extends RuntimeException {

    private final ErrorKind kind;

    public FixFlowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FixFlowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    public static FixFlowException unauthenticated(String message) {
        return new FixFlowException(ErrorKind.UNAUTHENTICATED, message);
    }

    public static FixFlowException forbidden(String message) {
        return new FixFlowException(ErrorKind.FORBIDDEN, message);
    }

    public static FixFlowException notFound(String message) {
        return new FixFlowException(ErrorKind.NOT_FOUND, message);
    }

    public static FixFlowException conflict(String message) {
        return new FixFlowException(ErrorKind.CONFLICT, message);
    }

    public static FixFlowException badRequest(String message) {
        return new FixFlowException(ErrorKind.BAD_REQUEST, message);
    }
}

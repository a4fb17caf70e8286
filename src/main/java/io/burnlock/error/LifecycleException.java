package io.burnlock.error;

public final class LifecycleException extends RuntimeException {
    private final ErrorKind kind;

    public LifecycleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LifecycleException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static LifecycleException notFound(String message) {
        return new LifecycleException(ErrorKind.NOT_FOUND, message);
    }

    public static LifecycleException conflict(String message) {
        return new LifecycleException(ErrorKind.CONFLICT, message);
    }

    public static LifecycleException precondition(String message) {
        return new LifecycleException(ErrorKind.PRECONDITION, message);
    }

    public static LifecycleException transientIo(String message, Throwable cause) {
        return new LifecycleException(ErrorKind.TRANSIENT_IO, message, cause);
    }
}

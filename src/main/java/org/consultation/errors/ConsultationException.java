package org.consultation.errors;

/**
 * Base of every rejection raised by the governance and delegation components.
 * <p>
 * A rejected operation leaves the store exactly as it was before the call.
 */
public abstract class ConsultationException extends RuntimeException {

    private final ErrorKind kind;

    protected ConsultationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ConsultationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

package org.consultation.errors;

/**
 * Vote attempted before the ballot start or at/after its deadline.
 */
public class WindowClosedException extends ConsultationException {

    public WindowClosedException(String message) {
        super(ErrorKind.WINDOW_CLOSED, message);
    }
}

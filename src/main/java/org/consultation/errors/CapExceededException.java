package org.consultation.errors;

/**
 * Delegation would push the delegator's committed fraction above one.
 */
public class CapExceededException extends ConsultationException {

    public CapExceededException(String message) {
        super(ErrorKind.CAP_EXCEEDED, message);
    }
}

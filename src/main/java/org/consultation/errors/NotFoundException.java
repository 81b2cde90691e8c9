package org.consultation.errors;

/**
 * Referenced ballot, delegator or delegation does not exist.
 */
public class NotFoundException extends ConsultationException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}

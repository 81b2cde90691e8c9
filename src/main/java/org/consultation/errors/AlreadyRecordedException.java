package org.consultation.errors;

/**
 * Second vote from the same account, or second elevation of a temperature check.
 */
public class AlreadyRecordedException extends ConsultationException {

    public AlreadyRecordedException(String message) {
        super(ErrorKind.ALREADY_RECORDED, message);
    }
}

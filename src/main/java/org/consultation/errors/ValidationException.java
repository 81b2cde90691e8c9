package org.consultation.errors;

/**
 * Malformed input: empty text, too many entries, bad selection or fraction.
 */
public class ValidationException extends ConsultationException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}

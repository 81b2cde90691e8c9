package org.consultation.errors;

/**
 * Missing or invalid presence proof, or a privileged call from someone other than the owner.
 */
public class NotAuthorizedException extends ConsultationException {

    public NotAuthorizedException(String message) {
        super(ErrorKind.NOT_AUTHORIZED, message);
    }
}

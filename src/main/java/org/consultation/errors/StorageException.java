package org.consultation.errors;

/**
 * Failure of the underlying store. The surrounding transaction has been rolled back.
 */
public class StorageException extends ConsultationException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}

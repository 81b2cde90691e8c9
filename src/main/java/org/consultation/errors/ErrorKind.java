package org.consultation.errors;

/**
 * Category of a rejected operation.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    NOT_AUTHORIZED,
    WINDOW_CLOSED,
    ALREADY_RECORDED,
    CAP_EXCEEDED,
    STORAGE
}

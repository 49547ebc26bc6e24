package org.apiwatch.store;

/**
 * The database rejected a value of the row itself, e.g. a NUL character in a JSON body.
 * Writing the same row again fails the same way.
 */
public class UnstorablePayloadException extends StoreException {

    public UnstorablePayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}

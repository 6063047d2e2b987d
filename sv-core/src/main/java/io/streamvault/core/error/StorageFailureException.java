package io.streamvault.core.error;

/** Durable write or read failed. An append that raised this did not happen and is safe to retry. */
public class StorageFailureException extends EventStoreException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

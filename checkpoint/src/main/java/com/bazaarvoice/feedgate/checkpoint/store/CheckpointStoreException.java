package com.bazaarvoice.feedgate.checkpoint.store;

public class CheckpointStoreException extends RuntimeException {

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

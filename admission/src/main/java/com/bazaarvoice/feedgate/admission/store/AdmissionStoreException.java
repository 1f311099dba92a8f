package com.bazaarvoice.feedgate.admission.store;

/**
 * Thrown when the admission store cannot be reached or returns an unusable reply.
 */
public class AdmissionStoreException extends RuntimeException {

    public AdmissionStoreException(String message) {
        super(message);
    }

    public AdmissionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.eainde.compliance.completion;

/**
 * Failure of the completion endpoint itself (transport, timeout, malformed response).
 */
public class ServiceException extends RuntimeException {

    public ServiceException(String message) {
        super(message);
    }

    public ServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.recyclesystems;

/**
 * Classifies why a call to a service failed.
 */
public enum ErrorKind {
    /** Receive sent to a stopped service. */
    NOT_RUNNING,
    /** The service was built without a receive handler. */
    NO_RECEIVE_HANDLER,
    /** The inbox stayed full for the whole timeout; the message was never delivered. */
    PUT_TIMEOUT,
    /** No reply arrived within the timeout; the work may still complete inside the service. */
    TAKE_TIMEOUT,
    /** A service map was asked to route to a child it does not contain. */
    SERVICE_NOT_FOUND,
    /** A user supplied start, stop, receive or map-config function threw. */
    USER_FUNCTION,
    /** The service has been closed. */
    DISPOSED,
    /** Unexpected failure inside the processing loop itself. */
    INTERNAL
}

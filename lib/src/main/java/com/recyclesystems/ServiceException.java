package com.recyclesystems;

/**
 * Unchecked exception thrown by the blocking service operations
 * ({@link Service#start}, {@link Service#stop}, {@link Service#ask}).
 */
public class ServiceException extends RuntimeException {

    /** Why the call failed. */
    private final ErrorKind kind;

    /** The key of the service the call was made against. */
    private final String serviceKey;

    /**
     * Creates a new ServiceException.
     *
     * @param kind the failure classification
     * @param message the detail message
     * @param serviceKey the key of the service involved
     */
    public ServiceException(ErrorKind kind, String message, String serviceKey) {
        super(message);
        this.kind = kind;
        this.serviceKey = serviceKey;
    }

    /**
     * Creates a new ServiceException wrapping a cause.
     *
     * @param kind the failure classification
     * @param message the detail message
     * @param serviceKey the key of the service involved
     * @param cause the underlying exception
     */
    public ServiceException(ErrorKind kind, String message, String serviceKey, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.serviceKey = serviceKey;
    }

    /**
     * @return the failure classification
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the key of the service the call was made against
     */
    public String getServiceKey() {
        return serviceKey;
    }

    /**
     * @return true for {@link ErrorKind#PUT_TIMEOUT} and {@link ErrorKind#TAKE_TIMEOUT}
     */
    public boolean isTimeout() {
        return kind == ErrorKind.PUT_TIMEOUT || kind == ErrorKind.TAKE_TIMEOUT;
    }

    @Override
    public String toString() {
        return getClass().getName() + "[" + kind + ", service=" + serviceKey + "]: " + getMessage();
    }
}

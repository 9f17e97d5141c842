package com.dpstore.error;

/**
 * Failure of a store, data item or lock operation.
 * Carries the error code alongside the message so callers can branch on it.
 */
public class DpsException extends Exception {

    private final ErrorCode code;

    public DpsException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public DpsException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Get the error code constant.
     */
    public ErrorCode getCode() {
        return code;
    }

    /**
     * Get the numeric error code.
     *
     * @return numeric code, e.g. 110 for DPS_STORE_DOES_NOT_EXIST
     */
    public int getErrorCode() {
        return code.getCode();
    }

    @Override
    public String toString() {
        return "DpsException{" +
               "code=" + code + "(" + code.getCode() + ")" +
               ", message='" + getMessage() + '\'' +
               '}';
    }
}

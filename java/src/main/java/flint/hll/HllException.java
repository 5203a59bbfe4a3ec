/**
 * HllException.java
 */
package flint.hll;

import java.io.IOException;

/**
 * Failed conversion. The {@link ErrorCode} tells a rejected write from a short
 * one, and both from bad input (precision, register, option).
 */
public class HllException extends IOException {

    private final ErrorCode errorCode;

    public HllException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + " - " + detail);
        this.errorCode = errorCode;
    }

    public HllException(ErrorCode errorCode, Object detail) {
        this(errorCode, String.valueOf(detail));
    }

    public HllException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.getMessage() + " - " + detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    @Override
    public String toString() {
        return "HllException{" + errorCode + "(" + errorCode.getCode() + "), " + getMessage() + "}";
    }
}

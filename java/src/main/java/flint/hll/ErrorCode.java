/**
 * 
 */
package flint.hll;

/**
 * Error codes for conversion operations
 */
public enum ErrorCode {
    // Output errors (-4000 to -4999)
    WRITE_FAILED(-4001, "Output write error"),
    SHORT_WRITE(-4002, "Output accepted fewer bytes than requested"),

    // Input errors (-2000 to -2999)
    INVALID_PRECISION(-2000, "Invalid precision"),
    INVALID_REGISTER(-2001, "Invalid register"),
    INVALID_OPTION(-2002, "Invalid option");
    
    private final int code;
    private final String message;
    
    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
    
    public int getCode() {
        return code;
    }
    
    public String getMessage() {
        return message;
    }
}

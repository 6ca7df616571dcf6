/**
 *
 */
package termbase.flat;

import java.io.IOException;

/**
 * Conversion exception with error code classification.
 * This allows callers to tell a fatal input error from a "no data" outcome.
 */
public class ConversionException extends IOException {

    private final ErrorCode errorCode;
    private final Object context;

    public ConversionException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.context = null;
    }

    public ConversionException(ErrorCode errorCode, Object context) {
        super(errorCode.getMessage() + " - " + context);
        this.errorCode = errorCode;
        this.context = context;
    }

    public ConversionException(ErrorCode errorCode, Object context, Throwable cause) {
        super(errorCode.getMessage() + " - " + context, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Get the context object associated with this exception (offending path, field, ...)
     * @return the context object, or null if not available
     */
    public Object getContext() {
        return context;
    }

    /**
     * Check if this exception has a specific error code
     * @param code the error code to check
     * @return true if the error code matches
     */
    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    /**
     * True for the empty extraction outcomes, which callers may handle instead of aborting.
     */
    public boolean isNoData() {
        return isErrorCode(ErrorCode.NO_ENTRIES) || isErrorCode(ErrorCode.NO_ROWS);
    }

    @Override
    public String toString() {
        return "ConversionException{" +
                "errorCode=" + errorCode +
                ", context=" + context +
                '}';
    }
}

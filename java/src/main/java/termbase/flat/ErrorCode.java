/**
 *
 */
package termbase.flat;

/**
 * Error codes for conversion runs
 */
public enum ErrorCode {
    // Input errors (-1000 to -1999)
    FILE_NOT_FOUND(-1000, "Input file not found"),
    XML_PARSE_ERROR(-1001, "Error parsing XML"),
    INPUT_READ_ERROR(-1002, "Input read error"),

    // Empty results (-2000 to -2999)
    NO_ENTRIES(-2000, "No term entries found"),
    NO_ROWS(-2001, "No data was extracted"),

    // Field selection errors (-3000 to -3999)
    NO_FIELDS_SELECTED(-3000, "No fields selected"),
    MISSING_FIELD_MAPPING(-3001, "Selected field has no name mapping"),

    // Output errors (-4000 to -4999)
    OUTPUT_WRITE_ERROR(-4000, "Failed to create output file"),
    UNSUPPORTED_OUTPUT(-4001, "Unsupported output format"),

    // General errors (-9000 to -9999)
    INTERNAL_ERROR(-9002, "Internal error");

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

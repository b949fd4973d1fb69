package com.tfmigrate.parser.exception;

/**
 * Raised when HCL source text cannot be tokenized or parsed.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final int line;

    public ParseException(String message, String fileName, int line) {
        super(format(message, fileName, line));
        this.fileName = fileName;
        this.line = line;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    private static String format(String message, String fileName, int line) {
        if (line <= 0) {
            return message;
        }
        String location = fileName != null && !fileName.isEmpty() ? fileName + ":" + line : "line " + line;
        return message + " at " + location;
    }
}

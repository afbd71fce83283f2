package io.github.riemr.cpe.exception;

/** Thrown when the attendance export or a configured time string cannot be interpreted. */
public class ReportFormatException extends RuntimeException {

    public ReportFormatException(String message) {
        super(message);
    }

    public ReportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.vidnyan.conclint.domain.ast;

/**
 * Raised when an input tree violates the node contract.
 * Fatal for the compilation unit it was raised for, never for the whole run.
 */
public class MalformedTreeException extends RuntimeException {

    private final String filePath;

    public MalformedTreeException(String filePath, String message) {
        super(filePath + ": " + message);
        this.filePath = filePath;
    }

    public MalformedTreeException(String filePath, String message, Throwable cause) {
        super(filePath + ": " + message, cause);
        this.filePath = filePath;
    }

    public String getFilePath() {
        return filePath;
    }
}

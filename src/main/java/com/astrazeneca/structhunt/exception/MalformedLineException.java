package com.astrazeneca.structhunt.exception;


import java.util.Locale;

/**
 * Thrown for a single unreadable line of a predictor output or annotation file. Always caught by the reader,
 * the line is skipped and reading continues.
 */
public class MalformedLineException extends RuntimeException {
    public final static String MalformedLineExceptionMessage = "Line %d of %s is skipped: %s";

    public final int lineNumber;

    public MalformedLineException(String file, int lineNumber, String reason) {
        super(String.format(Locale.US, MalformedLineExceptionMessage, lineNumber, file, reason));
        this.lineNumber = lineNumber;
    }
}

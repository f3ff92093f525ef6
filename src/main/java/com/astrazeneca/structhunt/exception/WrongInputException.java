package com.astrazeneca.structhunt.exception;


import java.util.Locale;

public class WrongInputException extends RuntimeException {
    public final static String WrongInputExceptionMessage = "The input %s \"%s\" can't be used: %s. Please check that " +
            "the file exists, is not empty and is in the expected format.";

    public WrongInputException(String kind, String path, String reason) {
        super(String.format(Locale.US, WrongInputExceptionMessage, kind, path, reason));
    }

    public WrongInputException(String kind, String path, String reason, Throwable e) {
        super(String.format(Locale.US, WrongInputExceptionMessage, kind, path, reason), e);
    }
}

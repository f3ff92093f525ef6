package com.astrazeneca.structhunt.exception;


import java.util.Locale;

public class PredictorProcessException extends Exception {
    public final static String PredictorProcessExceptionMessage = "Predictor failed on partition %s: %s";

    public final String partitionId;
    public final String errorText;

    public PredictorProcessException(String partitionId, String errorText) {
        super(String.format(Locale.US, PredictorProcessExceptionMessage, partitionId, errorText));
        this.partitionId = partitionId;
        this.errorText = errorText;
    }

    public PredictorProcessException(String partitionId, String errorText, Throwable e) {
        super(String.format(Locale.US, PredictorProcessExceptionMessage, partitionId, errorText), e);
        this.partitionId = partitionId;
        this.errorText = errorText;
    }
}

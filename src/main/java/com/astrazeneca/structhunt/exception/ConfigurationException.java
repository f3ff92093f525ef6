package com.astrazeneca.structhunt.exception;


import java.util.Locale;

public class ConfigurationException extends RuntimeException {
    public final static String ConfigurationExceptionMessage = "Wrong value of parameter %s: %s.";

    public ConfigurationException(String parameter, String reason) {
        super(String.format(Locale.US, ConfigurationExceptionMessage, parameter, reason));
    }
}

package com.astrazeneca.structhunt.printers;

/**
 * Printer types for tables printed without an output directory. The needed record printer will be created for
 * each type of PrinterType.
 */
public enum PrinterType {
    OUT,
    ERR
}

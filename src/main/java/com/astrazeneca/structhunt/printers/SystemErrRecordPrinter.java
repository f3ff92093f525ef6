package com.astrazeneca.structhunt.printers;

/**
 * Error output for record printer (will print to STDERR).
 */
public class SystemErrRecordPrinter extends RecordPrinter {
    public SystemErrRecordPrinter() {
        out = System.err;
    }
}

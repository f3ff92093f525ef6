package com.astrazeneca.structhunt.printers;

/**
 * Standard output for record printer (will print to STDOUT).
 */
public class SystemOutRecordPrinter extends RecordPrinter {
    public SystemOutRecordPrinter() {
        out = System.out;
    }
}

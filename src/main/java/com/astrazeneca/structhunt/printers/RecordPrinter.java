package com.astrazeneca.structhunt.printers;

import java.io.PrintStream;

/**
 * Prints output records line by line to the set stream. New destinations are added by extending this class
 * and, for console streams, a new PrinterType.
 */
public abstract class RecordPrinter {
    protected PrintStream out;

    /**
     * Prints one record as a delimited line
     * @param record output record
     */
    public void print(OutputRecord record) {
        out.println(record.toString());
    }

    public void printHeader(String header) {
        out.println(header);
    }

    /**
     * Set out stream to the parameter, e.g. to collect a table in memory.
     * @param printStream print stream where to print records
     */
    public void setOut(PrintStream printStream) {
        out = printStream;
    }

    public PrintStream getOut() {
        return out;
    }

    /**
     * Factory method for console printers.
     * @param type printer type from configuration
     * @return printer writing to the console stream of the type
     */
    public static RecordPrinter createPrinter(PrinterType type) {
        switch (type) {
            case ERR: return new SystemErrRecordPrinter();
            case OUT:
            default: return new SystemOutRecordPrinter();
        }
    }
}

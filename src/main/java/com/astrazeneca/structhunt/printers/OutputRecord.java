package com.astrazeneca.structhunt.printers;

/**
 * One line of an output table. Subclasses define the columns in {@link #toString()}.
 */
public abstract class OutputRecord {
    protected String delimiter = "\t";

    /**
     * Set delimiter to print records between fields. Default is <code>\t</code> (tab delimiter).
     * @param delimiter string contains delimiter
     */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }
}

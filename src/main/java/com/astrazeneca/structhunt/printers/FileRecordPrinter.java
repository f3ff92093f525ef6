package com.astrazeneca.structhunt.printers;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Record printer writing a table file in the output directory.
 */
public class FileRecordPrinter extends RecordPrinter implements Closeable {
    public FileRecordPrinter(Path file) throws IOException {
        out = new PrintStream(new BufferedOutputStream(Files.newOutputStream(file)), false, "UTF-8");
    }

    @Override
    public void close() {
        out.close();
    }
}

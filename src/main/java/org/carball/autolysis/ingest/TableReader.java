package org.carball.autolysis.ingest;

import org.carball.autolysis.model.table.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns raw bytes of unknown encoding into a typed {@link Table}.
 */
public interface TableReader {

    Table read(byte[] data, String tableName) throws IOException;

    default Table read(Path file) throws IOException {
        return read(Files.readAllBytes(file), tableNameOf(file));
    }

    static String tableNameOf(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

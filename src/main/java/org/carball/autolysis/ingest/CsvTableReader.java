package org.carball.autolysis.ingest;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.Table;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads delimited text with a header row. The encoding is detected first; a column becomes
 * numeric when every non-missing cell parses as a number, otherwise it stays categorical.
 */
@Slf4j
public class CsvTableReader implements TableReader {

    static final Set<String> MISSING_MARKERS = Set.of(
            "", "NA", "N/A", "n/a", "NaN", "nan", "null", "NULL", "None", "#N/A");

    private static final Pattern NUMBER = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?(inf|Inf|INF|Infinity)");

    private final EncodingDetector encodingDetector;

    public CsvTableReader() {
        this(new EncodingDetector());
    }

    public CsvTableReader(EncodingDetector encodingDetector) {
        this.encodingDetector = encodingDetector;
    }

    @Override
    public Table read(byte[] data, String tableName) throws IOException {
        EncodingDetector.DecodedText decoded = encodingDetector.decode(data);
        log.info("Data loaded with {} encoding", decoded.charset().name());

        List<String> headers;
        List<String[]> rows = new ArrayList<>();

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(decoded.text())).build()) {
            String[] header = reader.readNext();
            if (header == null || header.length == 0 || (header.length == 1 && header[0].isBlank())) {
                throw new IllegalArgumentException("CSV file has no headers");
            }
            headers = uniqueHeaders(header);

            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) {
                    continue;
                }
                if (row.length != headers.size()) {
                    log.debug("Skipping row with incorrect column count: {} vs {}", row.length, headers.size());
                    continue;
                }
                rows.add(row);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + tableName + ": " + e.getMessage(), e);
        }

        List<Column> columns = new ArrayList<>(headers.size());
        for (int c = 0; c < headers.size(); c++) {
            columns.add(buildColumn(headers.get(c), rows, c));
        }

        Table table = new Table(tableName, columns);
        log.info("Parsed {} rows and {} columns ({} numeric) from {}",
                table.getRowCount(), table.getColumnCount(), table.numericColumns().size(), tableName);
        return table;
    }

    private static Column buildColumn(String name, List<String[]> rows, int index) {
        List<String> cells = new ArrayList<>(rows.size());
        boolean numeric = true;
        for (String[] row : rows) {
            String cell = row[index].trim();
            if (MISSING_MARKERS.contains(cell)) {
                cells.add(null);
                continue;
            }
            cells.add(cell);
            if (numeric && !NUMBER.matcher(cell).matches()) {
                numeric = false;
            }
        }

        if (!numeric) {
            return Column.categorical(name, cells);
        }

        List<Double> values = new ArrayList<>(cells.size());
        for (String cell : cells) {
            values.add(cell == null ? null : parseNumber(cell));
        }
        return Column.numeric(name, values);
    }

    static double parseNumber(String cell) {
        String lower = cell.toLowerCase();
        if (lower.endsWith("inf") || lower.endsWith("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(cell);
    }

    private static List<String> uniqueHeaders(String[] header) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> names = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            String base = header[i].trim().isEmpty() ? "Unnamed: " + i : header[i].trim();
            String name = base;
            int suffix = 1;
            while (!seen.add(name)) {
                name = base + "." + suffix++;
            }
            names.add(name);
        }
        log.trace("Headers: {}", Arrays.toString(header));
        return names;
    }
}

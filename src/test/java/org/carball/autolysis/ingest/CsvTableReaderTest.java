package org.carball.autolysis.ingest;

import org.carball.autolysis.model.table.Column;
import org.carball.autolysis.model.table.ColumnKind;
import org.carball.autolysis.model.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CsvTableReaderTest {

    private CsvTableReader reader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        reader = new CsvTableReader();
    }

    @Test
    void shouldResolveColumnKinds() throws IOException {
        // Given
        String csv = """
                id,rating,title,year
                1,4.5,Dune,1965
                2,3.75,"Foundation, Book 1",1951
                3,-1e2,Hyperion,NA
                """;

        // When
        Table table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "books");

        // Then
        assertThat(table.getName()).isEqualTo("books");
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.getColumns()).extracting(Column::getKind)
                .containsExactly(ColumnKind.NUMERIC, ColumnKind.NUMERIC, ColumnKind.CATEGORICAL, ColumnKind.NUMERIC);
        Column rating = table.column("rating").orElseThrow();
        assertThat(rating.numericValue(2)).isEqualTo(-100.0);
        assertThat(table.column("title").orElseThrow().textValue(1)).isEqualTo("Foundation, Book 1");
        assertThat(table.column("year").orElseThrow().isMissing(2)).isTrue();
    }

    @Test
    void shouldHonourMissingMarkers() throws IOException {
        // Given
        String csv = """
                a,b
                1,x
                ,N/A
                NaN,null
                None,#N/A
                 n/a ,y
                """;

        // When
        Table table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "t");

        // Then
        Column a = table.column("a").orElseThrow();
        Column b = table.column("b").orElseThrow();
        assertThat(a.isNumeric()).isTrue();
        assertThat(a.missingCount()).isEqualTo(4);
        assertThat(b.isNumeric()).isFalse();
        assertThat(b.missingCount()).isEqualTo(3);
    }

    @Test
    void shouldTreatMixedColumnAsCategorical() throws IOException {
        // Given
        String csv = "value\n1\n2\nthree\n";

        // When
        Table table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "t");

        // Then
        Column value = table.column("value").orElseThrow();
        assertThat(value.isNumeric()).isFalse();
        assertThat(value.textValue(0)).isEqualTo("1");
    }

    @Test
    void shouldSkipRaggedRows() throws IOException {
        // Given
        String csv = "x,y\n1,2\n3\n4,5,6\n7,8\n";

        // When
        Table table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "t");

        // Then
        assertThat(table.getRowCount()).isEqualTo(2);
        assertThat(table.column("x").orElseThrow().presentValues()).containsExactly(1.0, 7.0);
    }

    @Test
    void shouldDecodeWindows1252File() throws IOException {
        // Given
        Path file = tempDir.resolve("media.csv");
        Files.write(file, "title,score\nAmélie,5\nCafé Society,3\n".getBytes(Charset.forName("windows-1252")));

        // When
        Table table = reader.read(file);

        // Then
        assertThat(table.getName()).isEqualTo("media");
        assertThat(table.column("title").orElseThrow().textValue(0)).isEqualTo("Amélie");
        assertThat(table.column("score").orElseThrow().isNumeric()).isTrue();
    }

    @Test
    void shouldRenameDuplicateAndBlankHeaders() throws IOException {
        // Given
        String csv = "a,a,\n1,2,3\n";

        // When
        Table table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "t");

        // Then
        assertThat(table.getColumns()).extracting(Column::getName).containsExactly("a", "a.1", "Unnamed: 2");
    }

    @Test
    void shouldTreatAllMissingColumnAsNumeric() throws IOException {
        // Given
        String csv = "x,empty\n1,\n2,NA\n";

        // When
        Table table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "t");

        // Then
        assertThat(table.column("empty").orElseThrow().isNumeric()).isTrue();
        assertThat(table.column("empty").orElseThrow().missingCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectFileWithoutHeader() {
        assertThatThrownBy(() -> reader.read(new byte[0], "empty"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no headers");
    }

    @Test
    void shouldParseInfinityMarkers() {
        assertThat(CsvTableReader.parseNumber("inf")).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(CsvTableReader.parseNumber("-Infinity")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(CsvTableReader.parseNumber("2.5e1")).isEqualTo(25.0);
    }
}

package org.carball.autolysis.ingest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class EncodingDetectorTest {

    private EncodingDetector detector;

    @BeforeEach
    void setUp() {
        detector = new EncodingDetector();
    }

    @Test
    void shouldDecodeValidUtf8() {
        // Given
        byte[] data = "name\nZoë\n東京\n".getBytes(StandardCharsets.UTF_8);

        // When
        EncodingDetector.DecodedText decoded = detector.decode(data);

        // Then
        assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(decoded.text()).isEqualTo("name\nZoë\n東京\n");
    }

    @Test
    void shouldStripUtf8ByteOrderMark() {
        // Given
        byte[] body = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[body.length + 3];
        data[0] = (byte) 0xEF;
        data[1] = (byte) 0xBB;
        data[2] = (byte) 0xBF;
        System.arraycopy(body, 0, data, 3, body.length);

        // When
        EncodingDetector.DecodedText decoded = detector.decode(data);

        // Then
        assertThat(decoded.text()).startsWith("a,b");
    }

    @Test
    void shouldDecodeUtf16WithByteOrderMark() {
        // Given
        byte[] data = "x\n1\n".getBytes(StandardCharsets.UTF_16);

        // When
        EncodingDetector.DecodedText decoded = detector.decode(data);

        // Then
        assertThat(decoded.charset()).isEqualTo(StandardCharsets.UTF_16BE);
        assertThat(decoded.text()).isEqualTo("x\n1\n");
    }

    @Test
    void shouldFallBackToWindows1252() {
        // Given - 0xE9 alone is not valid UTF-8
        byte[] data = "city\nCafé Crème, Paris\n".getBytes(Charset.forName("windows-1252"));

        // When
        EncodingDetector.DecodedText decoded = detector.decode(data);

        // Then
        assertThat(decoded.charset().name()).isEqualTo("windows-1252");
        assertThat(decoded.text()).contains("Café Crème, Paris");
    }

    @Test
    void shouldFallBackToLatin1ForBytesUndefinedInWindows1252() {
        // Given - 0x81 has no mapping in windows-1252
        byte[] data = {'a', '\n', (byte) 0x81, (byte) 0xE9, '\n'};

        // When
        EncodingDetector.DecodedText decoded = detector.decode(data);

        // Then
        assertThat(decoded.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(decoded.text()).hasSize(5);
    }
}

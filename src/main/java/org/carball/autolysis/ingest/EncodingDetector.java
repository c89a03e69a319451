package org.carball.autolysis.ingest;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Guesses the character encoding of a text file. A byte order mark wins; otherwise the first
 * candidate that decodes the whole input without errors is used. ISO-8859-1 maps every byte
 * and closes the list.
 */
@Slf4j
public class EncodingDetector {

    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);

    public record DecodedText(String text, Charset charset) {
    }

    public DecodedText decode(byte[] data) {
        DecodedText withBom = decodeByteOrderMark(data);
        if (withBom != null) {
            return withBom;
        }

        for (Charset charset : CANDIDATES) {
            try {
                String text = strictDecoder(charset).decode(ByteBuffer.wrap(data)).toString();
                log.debug("Decoded {} bytes as {}", data.length, charset.name());
                return new DecodedText(text, charset);
            } catch (CharacterCodingException e) {
                log.trace("Input is not valid {}: {}", charset.name(), e.getMessage());
            }
        }

        // unreachable while ISO-8859-1 is a candidate
        return new DecodedText(new String(data, StandardCharsets.ISO_8859_1), StandardCharsets.ISO_8859_1);
    }

    private static DecodedText decodeByteOrderMark(byte[] data) {
        if (data.length >= 3 && (data[0] & 0xFF) == 0xEF && (data[1] & 0xFF) == 0xBB && (data[2] & 0xFF) == 0xBF) {
            return new DecodedText(new String(data, 3, data.length - 3, StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        }
        if (data.length >= 2 && (data[0] & 0xFF) == 0xFE && (data[1] & 0xFF) == 0xFF) {
            return new DecodedText(new String(data, 2, data.length - 2, StandardCharsets.UTF_16BE), StandardCharsets.UTF_16BE);
        }
        if (data.length >= 2 && (data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xFE) {
            return new DecodedText(new String(data, 2, data.length - 2, StandardCharsets.UTF_16LE), StandardCharsets.UTF_16LE);
        }
        return null;
    }

    private static CharsetDecoder strictDecoder(Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}

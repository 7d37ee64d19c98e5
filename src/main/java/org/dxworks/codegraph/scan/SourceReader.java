package org.dxworks.codegraph.scan;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a file as UTF-8, falling back to a secondary encoding when the bytes are not valid
 * UTF-8. Decoding is strict: malformed input fails rather than being replaced.
 */
public class SourceReader {

    private static final String BOM = "\uFEFF";

    private final Charset fallbackEncoding;

    public SourceReader(Charset fallbackEncoding) {
        this.fallbackEncoding = fallbackEncoding;
    }

    public SourceReader() {
        this(StandardCharsets.ISO_8859_1);
    }

    public String read(Path file) throws ReadFailureException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ReadFailureException(file, e);
        }

        String text;
        try {
            text = decode(bytes, StandardCharsets.UTF_8);
        } catch (CharacterCodingException utf8Failure) {
            try {
                text = decode(bytes, fallbackEncoding);
            } catch (CharacterCodingException fallbackFailure) {
                fallbackFailure.addSuppressed(utf8Failure);
                throw new ReadFailureException(file, fallbackFailure);
            }
        }

        // Remove BOM if present (common in files saved by Windows editors)
        if (text.startsWith(BOM)) {
            text = text.substring(1);
        }
        return text;
    }

    private static String decode(byte[] bytes, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}

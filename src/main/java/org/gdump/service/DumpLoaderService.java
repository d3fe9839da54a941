package org.gdump.service;

import org.gdump.model.DumpModel;
import org.gdump.parser.DumpParser;
import org.gdump.parser.Goroutine;
import org.gdump.parser.ParsedDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a goroutine dump file into a {@link DumpModel}.
 *
 * <p>Dumps are often copied out of terminals, log viewers or Windows consoles, so the file encoding
 * is detected from its byte order mark or by trial decoding before the text is parsed.</p>
 */
public class DumpLoaderService {

    private static final Logger LOG = LoggerFactory.getLogger(DumpLoaderService.class);

    private static final List<Charset> CHARSET_CANDIDATES = createCharsetCandidates();
    private static final int UTF16_SAMPLE_BYTES = 256;

    private final DumpParser parser;

    public DumpLoaderService() {
        this(new DumpParser());
    }

    public DumpLoaderService(DumpParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public DumpModel load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");

        byte[] fileBytes = Files.readAllBytes(file);
        Encoding encoding = detectEncoding(fileBytes);

        ParsedDump parsed;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new ByteArrayInputStream(fileBytes, encoding.bomLength(), fileBytes.length - encoding.bomLength()),
                encoding.charset()))) {
            parsed = parser.parseDump(reader);
        }

        DumpModel model = new DumpModel();
        model.setSource(file);
        for (Goroutine goroutine : parsed.goroutines()) {
            model.addGoroutine(goroutine);
        }
        model.addIssues(parsed.issues());

        LOG.info("Loaded {} goroutines from {} ({}), skipped {} blocks or frames",
                model.getGoroutineCount(), file.getFileName(), encoding.charset().name(), parsed.issues().size());
        return model;
    }

    static Encoding detectEncoding(byte[] data) {
        if (data.length >= 3
                && (data[0] & 0xFF) == 0xEF
                && (data[1] & 0xFF) == 0xBB
                && (data[2] & 0xFF) == 0xBF) {
            return new Encoding(StandardCharsets.UTF_8, 3);
        }
        if (data.length >= 2) {
            int first = data[0] & 0xFF;
            int second = data[1] & 0xFF;
            if (first == 0xFF && second == 0xFE) {
                return new Encoding(StandardCharsets.UTF_16LE, 2);
            }
            if (first == 0xFE && second == 0xFF) {
                return new Encoding(StandardCharsets.UTF_16BE, 2);
            }
        }

        // strict UTF-16 decoding accepts nearly any even-length input, so only try it when the NULs say so
        Charset utf16 = guessUtf16(data);
        if (utf16 != null && decodes(utf16, data)) {
            return new Encoding(utf16, 0);
        }

        for (Charset candidate : CHARSET_CANDIDATES) {
            if (decodes(candidate, data)) {
                return new Encoding(candidate, 0);
            }
        }

        return new Encoding(StandardCharsets.UTF_8, 0);
    }

    private static Charset guessUtf16(byte[] data) {
        int pairs = Math.min(data.length, UTF16_SAMPLE_BYTES) / 2;
        if (pairs == 0) {
            return null;
        }
        int evenZeros = 0;
        int oddZeros = 0;
        for (int i = 0; i < pairs * 2; i += 2) {
            if (data[i] == 0) {
                evenZeros++;
            }
            if (data[i + 1] == 0) {
                oddZeros++;
            }
        }
        if (oddZeros * 2 > pairs && evenZeros * 4 < oddZeros) {
            return StandardCharsets.UTF_16LE;
        }
        if (evenZeros * 2 > pairs && oddZeros * 4 < evenZeros) {
            return StandardCharsets.UTF_16BE;
        }
        return null;
    }

    private static boolean decodes(Charset charset, byte[] data) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(data));
            return true;
        } catch (CharacterCodingException ex) {
            LOG.trace("Dump is not valid {}", charset.name());
            return false;
        }
    }

    private static List<Charset> createCharsetCandidates() {
        List<Charset> candidates = new ArrayList<>();
        candidates.add(StandardCharsets.UTF_8);
        addIfSupported(candidates, "windows-1251");
        addIfSupported(candidates, "koi8-r");
        addIfSupported(candidates, "cp866");
        return List.copyOf(candidates);
    }

    private static void addIfSupported(List<Charset> target, String charsetName) {
        if (Charset.isSupported(charsetName)) {
            target.add(Charset.forName(charsetName));
        }
    }

    record Encoding(Charset charset, int bomLength) {
    }
}

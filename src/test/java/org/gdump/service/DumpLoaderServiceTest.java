package org.gdump.service;

import org.gdump.model.DumpModel;
import org.gdump.parser.Goroutine;
import org.gdump.parser.ParseIssue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DumpLoaderServiceTest {

    private static final String DUMP = """
            goroutine 1 [running]:
            main.main()
            \t/app/main.go:7 +0x1d

            goroutine 6 [chan receive, 2 minutes]:
            main.consume(0xc000020)
            \t/app/consumer.go:19 +0x5e
            created by main.main in goroutine 1
            \t/app/main.go:5 +0x2f

            goroutine oops [running]:
            main.lost()
            \t/app/lost.go:1 +0x1
            """;

    private final DumpLoaderService service = new DumpLoaderService();

    @TempDir
    Path tempDir;

    @Test
    void loadsDumpIntoModel() throws IOException {
        Path file = tempDir.resolve("dump.txt");
        Files.writeString(file, DUMP, StandardCharsets.UTF_8);

        DumpModel model = service.load(file);

        assertEquals(file, model.getSource().orElseThrow());
        assertEquals(List.of(1L, 6L), model.getGoroutines().stream().map(Goroutine::getId).toList());
        assertEquals(2, model.getStatusCount());
        assertEquals(List.of(ParseIssue.Kind.MALFORMED_HEADER),
                model.getIssues().stream().map(ParseIssue::kind).toList());
    }

    @Test
    void decodesUtf16WithByteOrderMark() throws IOException {
        Path file = tempDir.resolve("dump-utf16.txt");
        byte[] text = DUMP.getBytes(StandardCharsets.UTF_16LE);
        byte[] content = new byte[text.length + 2];
        content[0] = (byte) 0xFF;
        content[1] = (byte) 0xFE;
        System.arraycopy(text, 0, content, 2, text.length);
        Files.write(file, content);

        DumpModel model = service.load(file);

        assertEquals(2, model.getGoroutineCount());
        assertEquals("chan receive", model.getGoroutine(6).orElseThrow().getStatus());
    }

    @Test
    void stripsUtf8ByteOrderMark() throws IOException {
        Path file = tempDir.resolve("dump-bom.txt");
        byte[] text = DUMP.getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[text.length + 3];
        content[0] = (byte) 0xEF;
        content[1] = (byte) 0xBB;
        content[2] = (byte) 0xBF;
        System.arraycopy(text, 0, content, 3, text.length);
        Files.write(file, content);

        DumpModel model = service.load(file);

        assertEquals(1L, model.getGoroutines().get(0).getId());
        assertEquals(1, model.getIssues().size());
    }

    @Test
    void readsSingleByteDumpWithEvenLength() throws IOException {
        Path file = tempDir.resolve("dump-latin1.txt");
        byte[] content = "panic: caf\u00e9\n\ngoroutine 1 [running]:\nmain.main()\n\t/app/main.go:7 +0x1d\n"
                .getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(0, content.length % 2);
        Files.write(file, content);

        DumpModel model = service.load(file);

        assertEquals(1, model.getGoroutineCount());
        Goroutine goroutine = model.getGoroutine(1).orElseThrow();
        assertEquals("running", goroutine.getStatus());
        assertEquals("/app/main.go", goroutine.getStackTrace().get(0).getFile());
        assertNotEquals(StandardCharsets.UTF_16LE, DumpLoaderService.detectEncoding(content).charset());
        assertNotEquals(StandardCharsets.UTF_16BE, DumpLoaderService.detectEncoding(content).charset());
    }

    @Test
    void decodesUtf16WithoutByteOrderMark() throws IOException {
        Path file = tempDir.resolve("dump-utf16le.txt");
        Files.write(file, DUMP.getBytes(StandardCharsets.UTF_16LE));

        DumpModel model = service.load(file);

        assertEquals(List.of(1L, 6L), model.getGoroutines().stream().map(Goroutine::getId).toList());
        assertEquals(StandardCharsets.UTF_16BE,
                DumpLoaderService.detectEncoding(DUMP.getBytes(StandardCharsets.UTF_16BE)).charset());
    }

    @Test
    void detectsEncodingWithoutByteOrderMark() {
        assertEquals(StandardCharsets.UTF_8,
                DumpLoaderService.detectEncoding("goroutine 1 [running]:".getBytes(StandardCharsets.UTF_8)).charset());
        assertEquals(0,
                DumpLoaderService.detectEncoding("goroutine 1 [running]:".getBytes(StandardCharsets.UTF_8)).bomLength());
    }

    @Test
    void failsForMissingFile() {
        assertThrows(NoSuchFileException.class, () -> service.load(tempDir.resolve("missing.txt")));
    }
}

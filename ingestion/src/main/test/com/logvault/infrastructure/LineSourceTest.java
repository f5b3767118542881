package com.logvault.infrastructure;

import com.logvault.application.exceptions.ErrorKind;
import com.logvault.application.exceptions.SourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class LineSourceTest {

    @TempDir
    Path tempDir;

    private static List<String> drain(LineSource source) {
        List<String> lines = new ArrayList<>();
        source.forEachRemaining(lines::add);
        return lines;
    }

    @Test
    void invalid_utf8_bytes_are_dropped() throws IOException {
        byte[] bytes = {'o', 'k', (byte) 0xC3, (byte) 0x28, '!', '\n', (byte) 0xFF, 'x', '\n'};
        try (var source = new LineSource("bytes", new ByteArrayInputStream(bytes))) {
            List<String> lines = drain(source);

            assertEquals(2, lines.size());
            assertTrue(lines.get(0).startsWith("ok"));
            assertTrue(lines.get(0).endsWith("(!"));
            assertEquals("x", lines.get(1));
        }
    }

    @Test
    void handles_crlf_and_missing_final_newline() throws IOException {
        var content = "one\r\ntwo\r\n\r\nthree".getBytes(StandardCharsets.UTF_8);
        try (var source = new LineSource("crlf", new ByteArrayInputStream(content))) {
            assertEquals(List.of("one", "two", "three"), drain(source));
            assertEquals(4, source.getLinesRead());
            assertEquals(1, source.getEmptyLines());
        }
    }

    @Test
    void next_past_end_throws() throws IOException {
        try (var source = new LineSource("empty", new ByteArrayInputStream(new byte[0]))) {
            assertFalse(source.hasNext());
            assertThrows(NoSuchElementException.class, source::next);
        }
    }

    @Test
    void opens_files_from_disk() throws IOException {
        Path file = tempDir.resolve("records.txt");
        Files.writeString(file, "alpha\nbeta\n", StandardCharsets.UTF_8);

        try (var source = LineSource.open(file)) {
            assertEquals(List.of("alpha", "beta"), drain(source));
        }
    }

    @Test
    void missing_file_is_source_not_found() {
        SourceNotFoundException e = assertThrows(SourceNotFoundException.class,
                () -> LineSource.open(tempDir.resolve("missing.txt")));

        assertEquals(ErrorKind.SOURCE_NOT_FOUND, e.getKind());
    }
}

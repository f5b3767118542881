package com.logvault.infrastructure;

import com.logvault.application.exceptions.SourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only reader that hands out trimmed, non-empty lines one at a time.
 * <p>
 * Input is decoded as UTF-8 with malformed and unmappable bytes dropped, so a damaged line loses
 * the bad characters instead of failing the whole read. Blank lines are skipped and counted.
 */
public class LineSource implements Iterator<String>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LineSource.class);
    private static final long PROGRESS_EVERY = 100_000;

    private final String name;
    private final BufferedReader reader;
    private String next;
    private long linesRead;
    private long emptyLines;
    private boolean finished;

    public LineSource(String name, InputStream in) {
        this.name = name;
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        this.reader = new BufferedReader(new InputStreamReader(in, decoder));
    }

    public static LineSource open(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SourceNotFoundException(file.toString());
        }
        try {
            return new LineSource(file.toString(), Files.newInputStream(file));
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(file.toString());
        } catch (IOException e) {
            throw new SourceNotFoundException(file.toString(), e);
        }
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        next = readNonEmpty();
        return next != null;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines in " + name);
        }
        String line = next;
        next = null;
        return line;
    }

    private String readNonEmpty() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                linesRead++;
                if (linesRead % PROGRESS_EVERY == 0) {
                    log.info("Read {} lines from {}...", linesRead, name);
                }
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    emptyLines++;
                    continue;
                }
                return trimmed;
            }
            finished = true;
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + name, e);
        }
    }

    public String getName() {
        return name;
    }

    public long getLinesRead() {
        return linesRead;
    }

    public long getEmptyLines() {
        return emptyLines;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}

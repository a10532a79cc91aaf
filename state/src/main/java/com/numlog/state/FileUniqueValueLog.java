package com.numlog.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends unique values to a text file, one decimal value per line.
 * The file is truncated when opened: unique values are process-lifetime only.
 */
public final class FileUniqueValueLog implements UniqueValueLog {

    private static final Logger log = LoggerFactory.getLogger(FileUniqueValueLog.class);

    private final Path path;
    private final BufferedWriter writer;
    private long appended;

    public FileUniqueValueLog(Path path) throws IOException {
        this.path = path;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(path, StandardCharsets.US_ASCII,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        log.info("Unique values log opened at {}", path.toAbsolutePath());
    }

    @Override
    public void append(long value) throws IOException {
        writer.write(Long.toString(value));
        writer.write('\n');
        writer.flush();
        appended++;
    }

    public Path path() { return path; }

    @Override
    public void close() throws IOException {
        writer.close();
        log.info("Unique values log closed: {} values written to {}", appended, path);
    }
}

package org.sandpile.cli.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link RunSummary} as pretty-printed JSON.
 */
public class RunSummaryWriter {

    private static final Logger LOG = LoggerFactory.getLogger(RunSummaryWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Writes the summary, creating parent directories as needed and replacing an existing file.
     *
     * @param file The target file.
     * @param summary The summary to write.
     * @throws UncheckedIOException if the file cannot be written.
     */
    public void write(Path file, RunSummary summary) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run summary " + file.toAbsolutePath(), e);
        }
        LOG.info("Wrote run summary to {}", file.toAbsolutePath());
    }

    /**
     * Returns the mapper used for writing, e.g. to read a summary back.
     *
     * @return The object mapper.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}

package org.sandpile.cli.commands;

import org.sandpile.cli.CommandLineInterface;
import org.sandpile.junit.extensions.logging.ExpectLog;
import org.sandpile.junit.extensions.logging.LogLevel;
import org.sandpile.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class VideoCommandTest {

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*VideoCommand", messagePattern = "Video encoding failed: No \\.png frames found in.*")
    void emptyFrameDirectoryExitsWithOne(@TempDir Path tempDir) {
        int exitCode = CommandLineInterface.createCommandLine().execute(
                "video", "--frames", tempDir.toString(), "--out", tempDir.resolve("out.mp4").toString());

        assertEquals(1, exitCode);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*VideoCommand", messagePattern = "Video encoding failed: Frame directory not found.*")
    void missingFrameDirectoryExitsWithOne(@TempDir Path tempDir) {
        int exitCode = CommandLineInterface.createCommandLine().execute(
                "video", "--frames", tempDir.resolve("missing").toString());

        assertEquals(1, exitCode);
    }
}

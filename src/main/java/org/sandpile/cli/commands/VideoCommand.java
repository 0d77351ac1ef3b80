package org.sandpile.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.sandpile.cli.rendering.FfmpegVideoEncoder;
import org.sandpile.cli.rendering.VideoEncodingException;
import org.sandpile.node.config.ConfigLoader;
import org.sandpile.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "video", description = "Encodes persisted frames into a video file using ffmpeg.")
public class VideoCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VideoCommand.class);

    @Option(names = {"-c", "--config"}, description = "Path to custom configuration file (default: sandpile.conf)")
    private File configFile;

    @Option(names = "--frames", description = "Directory holding the persisted frames.")
    private File frameDirectory;

    @Option(names = "--out", description = "Output filename.")
    private File outputFile;

    @Option(names = "--fps", description = "Frames per second for the output video.")
    private Integer fps;

    @Option(names = "--preset", description = "ffmpeg encoding preset (ultrafast/fast/medium/slow).")
    private String preset;

    @Override
    public Integer call() {
        final Config video;
        try {
            final Config config = ConfigLoader.withOverrides(ConfigLoader.load(configFile), overrides());
            LoggingConfigurator.configure(config);
            video = config.getConfig("sandpile.video");
        } catch (ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }

        final FfmpegVideoEncoder encoder = new FfmpegVideoEncoder(video.getString("preset"));
        try {
            encoder.encode(Path.of(video.getString("frame-directory")), Path.of(video.getString("output")), video.getInt("fps"));
        } catch (VideoEncodingException e) {
            log.error("Video encoding failed: {}", e.getMessage());
            return 1;
        }
        return 0;
    }

    private Map<String, Object> overrides() {
        final Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put("sandpile.video.frame-directory", frameDirectory == null ? null : frameDirectory.getPath());
        overrides.put("sandpile.video.output", outputFile == null ? null : outputFile.getPath());
        overrides.put("sandpile.video.fps", fps);
        overrides.put("sandpile.video.preset", preset);
        return overrides;
    }
}

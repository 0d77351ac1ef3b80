package org.sandpile.cli.rendering;

import org.sandpile.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Encodes persisted PNG frames into a video by streaming raw BGRA frames to an ffmpeg process.
 * <p>
 * Frames are taken in lexicographic file name order, which matches frame order for zero-padded names.
 * The first frame fixes the video size; every other frame must have the same size.
 */
public class FfmpegVideoEncoder {

    private static final Logger LOG = LoggerFactory.getLogger(FfmpegVideoEncoder.class);
    private static final int PROGRESS_INTERVAL = 1000;
    private static final int OUTPUT_TAIL_LENGTH = 2000;

    private final String executable;
    private final String preset;

    /**
     * Creates an encoder that runs {@code ffmpeg} from the PATH.
     *
     * @param preset The x264 encoding preset, e.g. {@code fast}.
     */
    public FfmpegVideoEncoder(String preset) {
        this("ffmpeg", preset);
    }

    /**
     * Creates an encoder.
     *
     * @param executable The ffmpeg executable to run.
     * @param preset The x264 encoding preset.
     */
    public FfmpegVideoEncoder(String executable, String preset) {
        this.executable = executable;
        this.preset = preset;
    }

    /**
     * Encodes all frames of a directory.
     *
     * @param frameDirectory The directory holding the PNG frames.
     * @param output The video file to write; overwritten if it exists.
     * @param fps Frames per second, at least 1.
     * @return The number of frames encoded.
     * @throws VideoEncodingException if there are no frames, a frame cannot be read or has a different
     *                                size, or ffmpeg cannot be started or fails.
     */
    public long encode(Path frameDirectory, Path output, int fps) throws VideoEncodingException {
        if (fps < 1) {
            throw new VideoEncodingException("Frames per second must be at least 1 but was " + fps);
        }
        List<Path> frames = listFrames(frameDirectory);
        if (frames.isEmpty()) {
            throw new VideoEncodingException("No " + Config.FRAME_FILE_EXTENSION + " frames found in " + frameDirectory.toAbsolutePath());
        }
        BufferedImage first = readFrame(frames.get(0));
        int width = first.getWidth();
        int height = first.getHeight();
        LOG.info("Encoding {} frames of {}x{} from {} into {} at {} fps",
                frames.size(), width, height, frameDirectory.toAbsolutePath(), output.toAbsolutePath(), fps);

        ProcessBuilder pb = new ProcessBuilder(buildCommand(width, height, fps, output));
        pb.redirectErrorStream(true);
        Process ffmpeg;
        try {
            ffmpeg = pb.start();
        } catch (IOException e) {
            throw new VideoEncodingException("Failed to start " + executable + ". Please ensure it is installed and in your PATH.", e);
        }

        AtomicReference<String> outputTail = new AtomicReference<>("");
        Thread outputReader = startOutputReader(ffmpeg, outputTail);

        long written = 0;
        byte[] bgra = new byte[width * height * 4];
        try (OutputStream ffmpegInput = ffmpeg.getOutputStream()) {
            for (Path frame : frames) {
                BufferedImage image = written == 0 ? first : readFrame(frame);
                if (image.getWidth() != width || image.getHeight() != height) {
                    ffmpeg.destroy();
                    throw new VideoEncodingException(String.format("Frame %s is %dx%d but the first frame is %dx%d",
                            frame.getFileName(), image.getWidth(), image.getHeight(), width, height));
                }
                toBgra(image, bgra);
                ffmpegInput.write(bgra);
                written++;
                if (written % PROGRESS_INTERVAL == 0) {
                    LOG.info("Encoded {}/{} frames", written, frames.size());
                }
            }
        } catch (IOException e) {
            ffmpeg.destroy();
            throw new VideoEncodingException("Failed to stream frames to ffmpeg: " + e.getMessage()
                    + tailSuffix(outputTail.get()), e);
        }

        int exitCode;
        try {
            exitCode = ffmpeg.waitFor();
            outputReader.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ffmpeg.destroy();
            throw new VideoEncodingException("Interrupted while waiting for ffmpeg", e);
        }
        if (exitCode != 0) {
            throw new VideoEncodingException("ffmpeg failed with exit code " + exitCode + tailSuffix(outputTail.get()));
        }
        LOG.info("Video successfully created: {}", output.toAbsolutePath());
        return written;
    }

    /**
     * Builds the ffmpeg command line for raw BGRA input on stdin.
     *
     * @param width Frame width in pixels.
     * @param height Frame height in pixels.
     * @param fps Frames per second.
     * @param output The video file.
     * @return The command and its arguments.
     */
    public List<String> buildCommand(int width, int height, int fps, Path output) {
        List<String> args = new ArrayList<>();
        args.add(executable);
        args.add("-y");
        args.add("-f"); args.add("rawvideo");
        args.add("-vcodec"); args.add("rawvideo");
        args.add("-s"); args.add(width + "x" + height);
        args.add("-pix_fmt"); args.add("bgra");
        args.add("-r"); args.add(String.valueOf(fps));
        args.add("-i"); args.add("-");
        args.add("-c:v"); args.add("libx264");
        args.add("-preset"); args.add(preset);
        args.add("-pix_fmt"); args.add("yuv420p");
        // yuv420p needs even dimensions.
        args.add("-vf"); args.add("pad=ceil(iw/2)*2:ceil(ih/2)*2");
        args.add(output.toAbsolutePath().toString());
        return args;
    }

    /**
     * Lists the frame files of a directory in encoding order.
     *
     * @param frameDirectory The directory to scan.
     * @return The PNG files sorted by file name; empty if the directory holds none.
     * @throws VideoEncodingException if the directory does not exist or cannot be read.
     */
    public static List<Path> listFrames(Path frameDirectory) throws VideoEncodingException {
        if (!Files.isDirectory(frameDirectory)) {
            throw new VideoEncodingException("Frame directory not found: " + frameDirectory.toAbsolutePath());
        }
        try (Stream<Path> files = Files.list(frameDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(Config.FRAME_FILE_EXTENSION))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new VideoEncodingException("Failed to list frames in " + frameDirectory.toAbsolutePath(), e);
        }
    }

    private static BufferedImage readFrame(Path frame) throws VideoEncodingException {
        try {
            BufferedImage image = ImageIO.read(frame.toFile());
            if (image == null) {
                throw new VideoEncodingException("Not a readable image: " + frame.toAbsolutePath());
            }
            return image;
        } catch (IOException e) {
            throw new VideoEncodingException("Failed to read frame " + frame.toAbsolutePath(), e);
        }
    }

    /**
     * Converts an image to BGRA bytes as ffmpeg expects them for {@code -pix_fmt bgra}.
     *
     * @param image The source image.
     * @param target A buffer of {@code width * height * 4} bytes.
     */
    static void toBgra(BufferedImage image, byte[] target) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] row = new int[width];
        int offset = 0;
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int rgb = row[x];
                target[offset++] = (byte) (rgb & 0xFF);
                target[offset++] = (byte) ((rgb >> 8) & 0xFF);
                target[offset++] = (byte) ((rgb >> 16) & 0xFF);
                target[offset++] = (byte) 255;
            }
        }
    }

    private static Thread startOutputReader(Process ffmpeg, AtomicReference<String> outputTail) {
        Thread reader = new Thread(() -> {
            try (InputStream stream = ffmpeg.getInputStream()) {
                byte[] buffer = new byte[1024];
                StringBuilder collected = new StringBuilder();
                int bytesRead;
                while ((bytesRead = stream.read(buffer)) != -1) {
                    String chunk = new String(buffer, 0, bytesRead, StandardCharsets.UTF_8);
                    LOG.debug("[ffmpeg] {}", chunk.stripTrailing());
                    collected.append(chunk);
                    if (collected.length() > OUTPUT_TAIL_LENGTH) {
                        collected.delete(0, collected.length() - OUTPUT_TAIL_LENGTH);
                    }
                    outputTail.set(collected.toString());
                }
            } catch (IOException e) {
                LOG.debug("Stopped reading ffmpeg output: {}", e.getMessage());
            }
        }, "ffmpeg-output-reader");
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private static String tailSuffix(String tail) {
        return tail.isBlank() ? "" : "\nLast ffmpeg output:\n" + tail;
    }
}

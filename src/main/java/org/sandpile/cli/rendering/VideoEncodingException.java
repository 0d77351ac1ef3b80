package org.sandpile.cli.rendering;

/**
 * Thrown when persisted frames cannot be turned into a video, e.g. because no frames exist,
 * frames differ in size or ffmpeg fails.
 */
public class VideoEncodingException extends Exception {

    public VideoEncodingException(String message) {
        super(message);
    }

    public VideoEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

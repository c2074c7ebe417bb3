package org.endlesssource.mediastate.api;

/**
 * Source video stream of the now-playing item.
 */
public record VideoStream(String codec, Integer width, Integer height, Double framerate, Long bitrate) {

    public String resolution() {
        if (width == null || height == null || width <= 0 || height <= 0) {
            return null;
        }
        return width + "x" + height;
    }
}

package org.endlesssource.mediastate.api;

/**
 * Source audio stream of the now-playing item.
 */
public record AudioStream(String codec, Integer channels, Long bitrate, Integer sampleRate, String language) {
}

package org.endlesssource.mediastate.api;

/**
 * What a session is playing. Exactly one variant applies to a session at a time:
 * {@link NoMedia}, {@link Movie}, {@link Episode} or {@link LiveTv}.
 */
public interface MediaVariant {

    MediaKind kind();
}

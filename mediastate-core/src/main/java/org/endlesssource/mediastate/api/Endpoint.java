package org.endlesssource.mediastate.api;

/**
 * Logical media-server endpoints the engine reads from.
 * Providers map each one onto their own wire paths.
 */
public enum Endpoint {
    SESSIONS,
    PROGRAM,
    CHANNEL_GUIDE,
    CHANNEL,
    ACTIVITY_LOG,
    SYSTEM_INFO,
    TIMERS,
    ACTIVE_RECORDINGS,
    SERIES_TIMERS,
    ITEM_COUNTS,
    LIBRARY_VIEWS,
    LATEST_MOVIES,
    LATEST_EPISODES,
    UPCOMING_EPISODES;

    /** Item, program or channel id. */
    public static final String PARAM_ID = "id";
    public static final String PARAM_CHANNEL_ID = "channelId";
    public static final String PARAM_LIMIT = "limit";
}

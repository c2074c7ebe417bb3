package org.endlesssource.mediastate.emby;

import org.endlesssource.mediastate.api.PlaybackCommand;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Emby REST paths, relative to the server base URL.
 */
final class EmbyPaths {
    static final String SESSION_QUERY = "IncludeDeviceInformation=true&IncludePlaybackState=true"
            + "&ExcludeInactive=false&ActiveWithinSeconds=86400";
    static final String PROGRAM_FIELDS = "Overview,Genres,StartDate,EndDate,SeriesName,SeasonNumber,EpisodeNumber,"
            + "ChannelName,ChannelNumber";
    static final String ITEM_FIELDS = "PremiereDate,ReleaseDate,DateCreated,SeriesName,RunTimeTicks,Genres,"
            + "CommunityRating,MediaStreams,IndexNumber,ParentIndexNumber";
    static final String UPCOMING_FIELDS = "PremiereDate,SeriesName,RunTimeTicks,IndexNumber,ParentIndexNumber";
    static final String EXCLUDED_ITEM_TYPES = "CollectionFolder,Folder,Playlist,BoxSet";

    private EmbyPaths() {}

    static String sessions() {
        return "/Sessions?" + SESSION_QUERY;
    }

    static String sessionsControllableBy(String userId) {
        return sessions() + "&ControllableByUserId=" + encode(userId);
    }

    static String currentUser() {
        return "/Users/Me";
    }

    static String users() {
        return "/Users";
    }

    static String program(String programId, String userId) {
        return "/LiveTv/Programs/" + encode(programId) + "?Fields=" + PROGRAM_FIELDS + userQuery(userId);
    }

    static String airingPrograms(String channelId, String userId) {
        return "/LiveTv/Programs?ChannelIds=" + encode(channelId) + "&IsAiring=true&Fields=" + PROGRAM_FIELDS
                + userQuery(userId);
    }

    static String channelAiringPrograms(String channelId, String userId) {
        return "/LiveTv/Channels/" + encode(channelId) + "/Programs?IsAiring=true&Fields=" + PROGRAM_FIELDS
                + userQuery(userId);
    }

    static String channel(String channelId) {
        return "/LiveTv/Channels/" + encode(channelId);
    }

    static String activityLog() {
        return "/System/ActivityLog/Entries";
    }

    static String systemInfo() {
        return "/System/Info";
    }

    static String timers(String userId) {
        return "/LiveTv/Timers" + (userId == null ? "" : "?UserId=" + encode(userId));
    }

    static String activeRecordings() {
        return "/LiveTv/Recordings/Active";
    }

    static String seriesTimers(String userId) {
        return "/LiveTv/SeriesTimers" + (userId == null ? "" : "?UserId=" + encode(userId));
    }

    static String itemCounts(String userId) {
        return "/Items/Counts?UserId=" + encode(userId);
    }

    static String views(String userId) {
        return "/Users/" + encode(userId) + "/Views";
    }

    /**
     * Most recently added items of a type, newest first.
     */
    static String latestItems(String userId, String itemType, int limit) {
        return "/Users/" + encode(userId) + "/Items?IncludeItemTypes=" + itemType
                + "&SortBy=DateCreated&SortOrder=Descending&Limit=" + limit
                + "&Fields=" + ITEM_FIELDS + "&Recursive=true&ExcludeItemTypes=" + EXCLUDED_ITEM_TYPES;
    }

    static String upcomingEpisodes(String userId, int limit) {
        return "/Shows/Upcoming?UserId=" + encode(userId) + "&Limit=" + limit + "&Fields=" + UPCOMING_FIELDS;
    }

    /**
     * Unaired episodes premiering within a year, used when the upcoming list is empty.
     */
    static String unairedEpisodes(String userId, int limit, Instant now) {
        Instant from = now.truncatedTo(ChronoUnit.SECONDS);
        Instant to = from.plus(365, ChronoUnit.DAYS);
        return "/Users/" + encode(userId) + "/Items?IncludeItemTypes=Episode&SortBy=PremiereDate&SortOrder=Ascending"
                + "&Limit=" + limit + "&Fields=" + UPCOMING_FIELDS + "&Recursive=true"
                + "&ExcludeItemTypes=" + EXCLUDED_ITEM_TYPES
                + "&MinPremiereDate=" + encode(from.toString()) + "&MaxPremiereDate=" + encode(to.toString())
                + "&IsUnaired=true";
    }

    static String command(String sessionId, PlaybackCommand command) {
        String base = "/Sessions/" + encode(sessionId) + "/Playing/";
        return switch (command.type()) {
            case PLAY -> base + "Unpause";
            case PAUSE -> base + "Pause";
            case STOP -> base + "Stop";
            case SEEK -> base + "Seek?PositionTicks=" + toTicks(command);
        };
    }

    static String itemImage(String itemId) {
        return "/Items/" + encode(itemId) + "/Images/Primary";
    }

    static String userImage(String userId) {
        return "/Users/" + encode(userId) + "/Images/Primary";
    }

    /**
     * Seek position in server ticks (100 ns).
     */
    static long toTicks(PlaybackCommand command) {
        return command.seekPosition()
                .map(position -> position.toNanos() / 100L)
                .orElse(0L);
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String userQuery(String userId) {
        return userId == null ? "" : "&UserId=" + encode(userId);
    }
}

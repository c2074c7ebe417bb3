package org.endlesssource.mediastate.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.Fetcher;
import org.endlesssource.mediastate.api.ImageUrls;
import org.endlesssource.mediastate.api.LiveTv;
import org.endlesssource.mediastate.api.Program;
import org.endlesssource.mediastate.api.ProgramSource;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.raw.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the program currently airing for a live TV session.
 * Tries the program id the session carries, then the channel guide window
 * covering now, and finally settles for channel-derived fields.
 */
public final class LiveProgramResolver {
    private static final Logger logger = LoggerFactory.getLogger(LiveProgramResolver.class);

    private final Fetcher fetcher;
    private final ImageUrls imageUrls;

    public LiveProgramResolver(Fetcher fetcher, ImageUrls imageUrls) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.imageUrls = Objects.requireNonNull(imageUrls, "imageUrls must not be null");
    }

    /**
     * Attach the current program to a live TV variant.
     * @param live The unresolved variant
     * @param now Current time, used for the guide search and the position
     * @return The variant with program, duration and position filled in where known
     * @throws TransportException only when the server rejects the credentials
     */
    public LiveTv resolve(LiveTv live, Instant now) throws TransportException {
        Program program = resolveProgram(live, now);
        LiveTv resolved = live.withProgram(program, now);
        if (resolved.channelNumber() == null && resolved.channelId() != null) {
            Optional<String> number = lookupChannelNumber(resolved.channelId());
            if (number.isPresent()) {
                resolved = new LiveTv(resolved.channelName(), number.get(), resolved.channelId(),
                        resolved.programIdHint(), resolved.program(), resolved.duration(), resolved.position());
            }
        }
        return resolved;
    }

    public Program resolveProgram(LiveTv live, Instant now) throws TransportException {
        if (live.programIdHint() != null) {
            Optional<Program> direct = byProgramId(live.programIdHint());
            if (direct.isPresent()) {
                return direct.get();
            }
        }
        if (live.channelId() != null) {
            Optional<Program> airing = byChannelGuide(live.channelId(), now);
            if (airing.isPresent()) {
                return airing.get();
            }
        }
        logger.debug("No program found for channel {} ({})", live.channelName(), live.channelId());
        return Program.channelOnly(live.channelName(), live.channelNumber(), live.channelId());
    }

    private Optional<Program> byProgramId(String programId) throws TransportException {
        Optional<JsonNode> payload = fetchQuietly(Endpoint.PROGRAM, Map.of(Endpoint.PARAM_ID, programId));
        return payload
                .filter(node -> node.isObject() && !node.isEmpty())
                .map(node -> toProgram(node, programId, ProgramSource.PROGRAM_ID));
    }

    private Optional<Program> byChannelGuide(String channelId, Instant now) throws TransportException {
        Optional<JsonNode> payload = fetchQuietly(Endpoint.CHANNEL_GUIDE, Map.of(Endpoint.PARAM_CHANNEL_ID, channelId));
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        for (JsonNode entry : JsonFields.items(payload.get())) {
            Program candidate = toProgram(entry, null, ProgramSource.CHANNEL_SEARCH);
            if (candidate.covers(now)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<String> lookupChannelNumber(String channelId) throws TransportException {
        return fetchQuietly(Endpoint.CHANNEL, Map.of(Endpoint.PARAM_ID, channelId))
                .flatMap(node -> JsonFields.text(node, "Number", "ChannelNumber"));
    }

    private Program toProgram(JsonNode node, String programIdHint, ProgramSource source) {
        String id = JsonFields.text(node, "Id").orElse(programIdHint);
        return new Program(
                id,
                JsonFields.text(node, "SeriesName", "SeriesTitle", "ProgramSeriesTitle", "ShowName", "Program", "Name")
                        .orElse(null),
                JsonFields.text(node, "Overview").orElse(null),
                JsonFields.instant(node, "StartDate").orElse(null),
                JsonFields.instant(node, "EndDate").orElse(null),
                id == null ? null : imageUrls.itemImage(id),
                JsonFields.text(node, "ChannelName").orElse(null),
                JsonFields.text(node, "ChannelNumber", "Number").orElse(null),
                JsonFields.text(node, "ChannelId").orElse(null),
                source);
    }

    /**
     * A failed lookup falls through to the next step of the chain; rejected credentials do not.
     */
    private Optional<JsonNode> fetchQuietly(Endpoint endpoint, Map<String, String> params) throws TransportException {
        try {
            return Optional.of(fetcher.fetch(endpoint, params));
        } catch (TransportException ex) {
            if (ex.isUnauthorized()) {
                throw ex;
            }
            logger.debug("Program lookup {} {} failed: {}", endpoint, params, ex.getMessage());
            return Optional.empty();
        }
    }
}

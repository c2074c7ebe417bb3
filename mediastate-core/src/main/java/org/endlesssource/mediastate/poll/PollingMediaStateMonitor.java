package org.endlesssource.mediastate.poll;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.mediastate.aggregate.AggregationEngine;
import org.endlesssource.mediastate.aggregate.ServerInfo;
import org.endlesssource.mediastate.aggregate.ServerStats;
import org.endlesssource.mediastate.api.ActivityEntry;
import org.endlesssource.mediastate.api.Category;
import org.endlesssource.mediastate.api.CategoryHealth;
import org.endlesssource.mediastate.api.CategoryStatus;
import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.Endpoint;
import org.endlesssource.mediastate.api.Feature;
import org.endlesssource.mediastate.api.LibraryItem;
import org.endlesssource.mediastate.api.LibraryStats;
import org.endlesssource.mediastate.api.LiveTv;
import org.endlesssource.mediastate.api.MediaServerClient;
import org.endlesssource.mediastate.api.MediaStateMonitor;
import org.endlesssource.mediastate.api.MonitorOptions;
import org.endlesssource.mediastate.api.Publisher;
import org.endlesssource.mediastate.api.RecordingsSnapshot;
import org.endlesssource.mediastate.api.SessionControls;
import org.endlesssource.mediastate.api.SessionSnapshot;
import org.endlesssource.mediastate.api.TransportException;
import org.endlesssource.mediastate.library.LibraryListsTracker;
import org.endlesssource.mediastate.library.LibraryStatsCache;
import org.endlesssource.mediastate.publish.EntityPublisher;
import org.endlesssource.mediastate.raw.RawSession;
import org.endlesssource.mediastate.recording.RecordingsTracker;
import org.endlesssource.mediastate.session.LiveProgramResolver;
import org.endlesssource.mediastate.session.MediaClassifier;
import org.endlesssource.mediastate.session.PlaybackCommander;
import org.endlesssource.mediastate.session.SessionIdentityManager;
import org.endlesssource.mediastate.session.TranscodeAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Polling monitor: one independent loop per category, each committing into its own
 * last-known-good cell and publishing from there.
 */
public final class PollingMediaStateMonitor implements MediaStateMonitor {
    private static final Logger logger = LoggerFactory.getLogger(PollingMediaStateMonitor.class);

    private final MediaServerClient client;
    private final EntityPublisher entities;
    private final Clock clock;
    private final PollScheduler scheduler;
    private final MediaClassifier classifier;
    private final LiveProgramResolver programResolver;
    private final SessionIdentityManager identities;
    private final PlaybackCommander commander;
    private final AggregationEngine aggregation = new AggregationEngine();
    private final RecordingsTracker recordings;
    private final LibraryStatsCache libraryStats;
    private final LibraryListsTracker libraryLists;
    private final Map<Category, CategoryState> states = new EnumMap<>(Category.class);

    private final AtomicReference<SessionSnapshot> sessionCell = new AtomicReference<>(SessionSnapshot.EMPTY);
    private final AtomicReference<ServerStats> serverStatsCell = new AtomicReference<>();
    private final AtomicReference<RecordingsSnapshot> recordingsCell = new AtomicReference<>();
    private final AtomicReference<LibraryCycle> libraryCell = new AtomicReference<>();

    private volatile MonitorOptions options;
    private volatile boolean started;
    private volatile boolean closed;

    public PollingMediaStateMonitor(MediaServerClient client, Publisher publisher, MonitorOptions options) {
        this(client, publisher, options, Clock.systemUTC());
    }

    public PollingMediaStateMonitor(MediaServerClient client, Publisher publisher, MonitorOptions options, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entities = new EntityPublisher(Objects.requireNonNull(publisher, "publisher must not be null"),
                options.getKeyPrefix());
        this.classifier = new MediaClassifier(client, new TranscodeAnalyzer(), clock);
        this.programResolver = new LiveProgramResolver(client, client);
        this.identities = new SessionIdentityManager(options.getKeyPrefix());
        this.commander = new PlaybackCommander(identities, client);
        this.recordings = new RecordingsTracker(client, clock);
        this.libraryStats = new LibraryStatsCache(client, clock);
        this.libraryLists = new LibraryListsTracker(client, client, clock);
        for (Category category : Category.values()) {
            states.put(category, new CategoryState(category));
        }
        this.scheduler = new PollScheduler(
                Executors.newScheduledThreadPool(Category.values().length, daemonThreads("mediastate-poll")),
                Executors.newCachedThreadPool(daemonThreads("mediastate-fetch")));
        registerLoops();
    }

    @Override
    public synchronized void start() {
        if (started || closed) {
            return;
        }
        started = true;
        MonitorOptions current = options;
        for (Category category : Category.values()) {
            if (current.isActive(category)) {
                scheduler.start(category, current.getInterval(category));
            } else {
                states.get(category).disable();
            }
        }
        logger.info("Media state monitor started");
    }

    @Override
    public SessionSnapshot getSessions() {
        return sessionCell.get();
    }

    @Override
    public Optional<ClassifiedSession> getSession(String key) {
        return Optional.ofNullable(sessionCell.get().sessions().get(key));
    }

    @Override
    public SessionControls getControls() {
        return commander;
    }

    @Override
    public Map<Category, CategoryStatus> getCategoryStatus() {
        Map<Category, CategoryStatus> status = new EnumMap<>(Category.class);
        states.forEach((category, state) -> status.put(category, state.snapshot()));
        return Collections.unmodifiableMap(status);
    }

    @Override
    public MonitorOptions getOptions() {
        return options;
    }

    @Override
    public synchronized void updateOptions(MonitorOptions newOptions) {
        Objects.requireNonNull(newOptions, "options must not be null");
        MonitorOptions previous = options;
        if (!previous.getKeyPrefix().equals(newOptions.getKeyPrefix())) {
            logger.warn("Key prefix changes apply to new monitors only; keeping '{}'", previous.getKeyPrefix());
            newOptions = newOptions.withKeyPrefix(previous.getKeyPrefix());
        }
        options = newOptions;

        for (Feature feature : Feature.values()) {
            if (previous.isEnabled(feature) && !newOptions.isEnabled(feature)) {
                entities.remove(EntityPublisher.entityKind(feature));
                logger.info("Disabled {}", feature);
            }
        }
        for (Category category : Category.values()) {
            scheduler.setTimeout(category, newOptions.getPollTimeout());
            boolean wasActive = previous.isActive(category);
            boolean active = newOptions.isActive(category);
            if (!active) {
                scheduler.stop(category);
                states.get(category).disable();
                clearCell(category);
            } else if (started && states.get(category).health() != CategoryHealth.CONFIG_ERROR
                    && (!wasActive || !previous.getInterval(category).equals(newOptions.getInterval(category)))) {
                if (!wasActive) {
                    states.get(category).reset();
                }
                scheduler.start(category, newOptions.getInterval(category));
            }
        }
    }

    @Override
    public synchronized void resume(Category category) {
        Objects.requireNonNull(category, "category must not be null");
        CategoryState state = states.get(category);
        if (state.health() != CategoryHealth.CONFIG_ERROR) {
            return;
        }
        state.reset();
        if (started && options.isActive(category)) {
            scheduler.start(category, options.getInterval(category));
        }
        logger.info("Resumed {} polling", category.id());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.close();
        client.close();
        logger.info("Media state monitor closed");
    }

    /**
     * Run one poll of a category on the calling thread.
     */
    boolean pollNow(Category category) {
        return scheduler.pollNow(category);
    }

    Optional<ServerStats> lastServerStats() {
        return Optional.ofNullable(serverStatsCell.get());
    }

    Optional<RecordingsSnapshot> lastRecordings() {
        return Optional.ofNullable(recordingsCell.get());
    }

    Optional<LibraryStats> lastLibraryStats() {
        return Optional.ofNullable(libraryCell.get()).map(LibraryCycle::stats);
    }

    private void registerLoops() {
        Category sessions = Category.SESSIONS;
        scheduler.register(sessions, options.getPollTimeout(), this::pollSessions,
                outcome(sessions, this::commitSessions));
        scheduler.register(Category.SERVER_STATS, options.getPollTimeout(), this::pollServerStats,
                outcome(Category.SERVER_STATS, this::commitServerStats));
        scheduler.register(Category.RECORDINGS, options.getPollTimeout(), recordings::refresh,
                outcome(Category.RECORDINGS, this::commitRecordings));
        scheduler.register(Category.LIBRARY, options.getPollTimeout(), this::pollLibrary,
                outcome(Category.LIBRARY, this::commitLibrary));
    }

    // ---- sessions ----

    private SessionCycle pollSessions() throws TransportException {
        Instant now = clock.instant();
        JsonNode payload = client.fetch(Endpoint.SESSIONS);
        if (!payload.isArray() && !payload.has("Items")) {
            throw new TransportException(TransportException.Kind.MALFORMED, "Session payload is not a list");
        }
        List<ClassifiedSession> classified = new ArrayList<>();
        for (RawSession raw : RawSession.listOf(payload)) {
            ClassifiedSession session = classifier.classify(raw);
            if (session.media() instanceof LiveTv live) {
                LiveTv resolved = programResolver.resolve(live, now);
                session = session.withMedia(resolved,
                        MediaClassifier.playbackPercent(resolved.position(), resolved.duration()));
            }
            classified.add(session);
        }
        return new SessionCycle(now, classified);
    }

    private void commitSessions(SessionCycle cycle) {
        SessionSnapshot snapshot = identities.reconcile(cycle.sessions(), cycle.polledAt());
        sessionCell.set(snapshot);
        entities.publishSessions(snapshot);

        MonitorOptions current = options;
        if (current.isEnabled(Feature.ACTIVE_STREAMS)) {
            entities.publishActiveStreams(aggregation.activeStreams(snapshot));
        }
        if (current.isEnabled(Feature.BANDWIDTH)) {
            entities.publishBandwidth(aggregation.bandwidth(snapshot));
        }
        if (current.isEnabled(Feature.TRANSCODING_LOAD)) {
            entities.publishTranscodingLoad(aggregation.transcodingLoad(snapshot));
        }
        if (current.isEnabled(Feature.MULTISESSION)) {
            entities.publishMultisessionUsers(aggregation.multisessionUsers(snapshot));
        }
        logger.debug("Session poll: {} sessions, {} added, {} removed",
                snapshot.sessions().size(), snapshot.added().size(), snapshot.removed().size());
    }

    // ---- server stats ----

    private ServerStatsCycle pollServerStats() throws TransportException {
        List<ActivityEntry> activity = AggregationEngine.recentActivity(client.fetch(Endpoint.ACTIVITY_LOG));
        ServerInfo info;
        try {
            info = ServerInfo.from(client.fetch(Endpoint.SYSTEM_INFO));
        } catch (TransportException ex) {
            if (ex.isUnauthorized()) {
                throw ex;
            }
            logger.debug("System info unavailable: {}", ex.getMessage());
            ServerStats previous = serverStatsCell.get();
            info = previous == null ? ServerInfo.UNKNOWN : previous.serverInfo();
        }
        return new ServerStatsCycle(activity, info);
    }

    private void commitServerStats(ServerStatsCycle cycle) {
        ServerStats stats = aggregation.serverStats(sessionCell.get(), cycle.activity(), cycle.info());
        serverStatsCell.set(stats);
        if (options.isEnabled(Feature.SERVER_STATS)) {
            entities.publishServerStats(stats);
        }
    }

    // ---- recordings ----

    private void commitRecordings(RecordingsSnapshot snapshot) {
        recordingsCell.set(snapshot);
        if (options.isEnabled(Feature.RECORDINGS)) {
            entities.publishRecordings(snapshot);
        }
    }

    // ---- library ----

    private LibraryCycle pollLibrary() throws TransportException {
        MonitorOptions current = options;
        TransportException statsFailure = null;
        if (current.isEnabled(Feature.LIBRARY_STATS)) {
            try {
                libraryStats.refresh();
            } catch (TransportException ex) {
                if (ex.isUnauthorized()) {
                    throw ex;
                }
                logger.warn("Library stats refresh failed, keeping cached values: {}", ex.getMessage());
                statsFailure = ex;
            }
        }
        Set<Feature> listFeatures = EnumSet.noneOf(Feature.class);
        for (Feature feature : List.of(Feature.LATEST_MOVIES, Feature.LATEST_EPISODES, Feature.UPCOMING_EPISODES)) {
            if (current.isEnabled(feature)) {
                listFeatures.add(feature);
            }
        }
        Map<Feature, List<LibraryItem>> lists;
        try {
            lists = libraryLists.refresh(listFeatures, current.getListSize());
        } catch (TransportException ex) {
            if (ex.isUnauthorized() || statsFailure != null || !current.isEnabled(Feature.LIBRARY_STATS)) {
                throw ex;
            }
            lists = libraryLists.current();
        }
        if (statsFailure != null && listFeatures.isEmpty()) {
            throw statsFailure;
        }
        return new LibraryCycle(libraryStats.current().orElse(null), lists);
    }

    private void commitLibrary(LibraryCycle cycle) {
        libraryCell.set(cycle);
        MonitorOptions current = options;
        if (current.isEnabled(Feature.LIBRARY_STATS) && cycle.stats() != null) {
            entities.publishLibraryStats(cycle.stats());
        }
        cycle.lists().forEach((feature, items) -> {
            if (current.isEnabled(feature)) {
                entities.publishLibraryList(feature, items);
            }
        });
    }

    // ---- failures ----

    private <T> PollOutcome<T> outcome(Category category, Consumer<T> commit) {
        return new PollOutcome<>() {
            @Override
            public void onSuccess(T result) {
                // same lock as updateOptions, so a category disabled mid-poll stays disabled
                synchronized (PollingMediaStateMonitor.this) {
                    if (!options.isActive(category)) {
                        logger.debug("Discarding {} poll result, category was disabled", category.id());
                        return;
                    }
                    commit.accept(result);
                    states.get(category).recordSuccess(clock.instant());
                }
            }

            @Override
            public void onFailure(TransportException failure) {
                synchronized (PollingMediaStateMonitor.this) {
                    if (options.isActive(category)) {
                        handleFailure(category, failure);
                    }
                }
            }
        };
    }

    private void handleFailure(Category category, TransportException failure) {
        CategoryState state = states.get(category);
        if (failure.isUnauthorized()) {
            state.recordConfigError(failure.getMessage());
            logger.error("Server rejected credentials while polling {}; polling halted until resumed",
                    category.id());
            markUnavailable(category, state.lastSuccess());
            return;
        }
        logger.warn("Polling {} failed ({}): {}", category.id(), failure.getKind(), failure.getMessage());
        if (state.recordFailure(failure.getMessage(), options.getFailureThreshold())) {
            markUnavailable(category, state.lastSuccess());
        }
    }

    private void markUnavailable(Category category, Instant lastSuccess) {
        MonitorOptions current = options;
        if (category == Category.SESSIONS) {
            sessionCell.get().sessions().keySet().forEach(key -> entities.markSessionUnavailable(key, lastSuccess));
        }
        for (Feature feature : Feature.values()) {
            if (feature.category() == category && current.isEnabled(feature)) {
                entities.markUnavailable(EntityPublisher.entityKind(feature), lastSuccess);
            }
        }
    }

    private void clearCell(Category category) {
        switch (category) {
            case SERVER_STATS -> serverStatsCell.set(null);
            case RECORDINGS -> recordingsCell.set(null);
            case LIBRARY -> libraryCell.set(null);
            case SESSIONS -> {
                // sessions never deactivate
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record SessionCycle(Instant polledAt, List<ClassifiedSession> sessions) {
    }

    private record ServerStatsCycle(List<ActivityEntry> activity, ServerInfo info) {
    }

    private record LibraryCycle(LibraryStats stats, Map<Feature, List<LibraryItem>> lists) {
    }
}

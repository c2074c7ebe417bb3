package org.endlesssource.mediastate.examples;

import org.endlesssource.mediastate.MediaStateFactory;
import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.CommandException;
import org.endlesssource.mediastate.api.EntityKind;
import org.endlesssource.mediastate.api.MediaStateMonitor;
import org.endlesssource.mediastate.api.Publisher;
import org.endlesssource.mediastate.api.ServerConnection;
import org.endlesssource.mediastate.api.SessionControls;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Scanner;

public final class PlaybackControlCliExample {

    public static void main(String[] args) {
        ServerConnection connection;
        try {
            connection = ServerConnection.fromEnv();
        } catch (IllegalArgumentException e) {
            System.out.println("Configuration error: " + e.getMessage());
            return;
        }

        try (MediaStateMonitor monitor = MediaStateFactory.createMonitor("emby", connection, new SilentPublisher());
             Scanner scanner = new Scanner(System.in)) {
            monitor.start();
            System.out.println("Playback Control CLI");
            printHelp();

            String selected = null;
            while (true) {
                if (selected != null && monitor.getSession(selected).isEmpty()) {
                    selected = null;
                }

                System.out.print("emby> ");
                if (!scanner.hasNextLine()) {
                    break;
                }

                String line = scanner.nextLine().trim();
                if (line.isEmpty()) {
                    continue;
                }

                String[] parts = line.split("\\s+", 2);
                String cmd = parts[0].toLowerCase();
                String arg = parts.length > 1 ? parts[1].trim() : "";
                SessionControls controls = monitor.getControls();

                switch (cmd) {
                    case "help" -> printHelp();
                    case "quit", "exit" -> {
                        return;
                    }
                    case "list" -> printSessions(keys(monitor), monitor, selected);
                    case "select" -> selected = selectSessionByIndex(keys(monitor), arg, selected);
                    case "info" -> printSession(monitor, selected);
                    case "play" -> runControl(selected, "play", controls::play);
                    case "pause" -> runControl(selected, "pause", controls::pause);
                    case "stop" -> runControl(selected, "stop", controls::stop);
                    case "seek" -> runSeek(controls, selected, arg);
                    default -> System.out.println("Unknown command: " + cmd + " (type 'help')");
                }
            }
        } catch (RuntimeException e) {
            System.err.println("Playback control CLI failed: " + e.getMessage());
        }
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  help                Show this help");
        System.out.println("  list                List sessions from the last poll");
        System.out.println("  select <index>      Select session by index from list");
        System.out.println("  info                Show selected session");
        System.out.println("  play|pause|stop     Playback controls");
        System.out.println("  seek <mm:ss|sec>    Seek to position");
        System.out.println("  exit                Quit");
    }

    private static List<String> keys(MediaStateMonitor monitor) {
        return new ArrayList<>(monitor.getSessions().sessions().keySet());
    }

    private static void printSessions(List<String> keys, MediaStateMonitor monitor, String selected) {
        if (keys.isEmpty()) {
            System.out.println("No sessions.");
            return;
        }
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            String marker = key.equals(selected) ? "*" : " ";
            String state = monitor.getSession(key).map(session -> session.state().id()).orElse("?");
            System.out.printf("%s [%d] %s (%s)%n", marker, i, key, state);
        }
    }

    private static String selectSessionByIndex(List<String> keys, String arg, String current) {
        if (arg.isEmpty()) {
            System.out.println("Usage: select <index>");
            return current;
        }
        try {
            int idx = Integer.parseInt(arg);
            if (idx < 0 || idx >= keys.size()) {
                System.out.println("Invalid index.");
                return current;
            }
            System.out.println("Selected: " + keys.get(idx));
            return keys.get(idx);
        } catch (NumberFormatException e) {
            System.out.println("Invalid index.");
            return current;
        }
    }

    private static void printSession(MediaStateMonitor monitor, String selected) {
        if (selected == null) {
            System.out.println("No session selected.");
            return;
        }
        Optional<ClassifiedSession> found = monitor.getSession(selected);
        if (found.isEmpty()) {
            System.out.println("Session is gone.");
            return;
        }
        ClassifiedSession session = found.get();
        String title = Optional.ofNullable(session.mediaName()).orElse("Nothing playing");
        String position = Optional.ofNullable(session.mediaPosition())
                .map(PlaybackControlCliExample::formatDuration)
                .orElse("--:--");
        String duration = Optional.ofNullable(session.mediaDuration())
                .map(PlaybackControlCliExample::formatDuration)
                .orElse("--:--");
        System.out.printf("%s on %s: %s [%s/%s] %s%n", session.userName(), session.deviceName(), title, position,
                duration, session.transcode().method().id());
    }

    private static void runControl(String selected, String name, ControlCall call) {
        if (selected == null) {
            System.out.println("No session selected.");
            return;
        }
        try {
            call.invoke(selected);
            System.out.println(name + ": ok");
        } catch (CommandException e) {
            System.out.println(name + ": failed (" + e.getMessage() + ")");
        }
    }

    private static void runSeek(SessionControls controls, String selected, String arg) {
        if (arg.isEmpty()) {
            System.out.println("Usage: seek <mm:ss|sec>");
            return;
        }
        Optional<Duration> target = parseTime(arg);
        if (target.isEmpty()) {
            System.out.println("Invalid time. Use mm:ss or seconds.");
            return;
        }
        runControl(selected, "seek", key -> controls.seek(key, target.get()));
    }

    private static Optional<Duration> parseTime(String value) {
        try {
            if (value.contains(":")) {
                String[] parts = value.split(":");
                if (parts.length != 2) {
                    return Optional.empty();
                }
                long minutes = Long.parseLong(parts[0]);
                long seconds = Long.parseLong(parts[1]);
                if (minutes < 0 || seconds < 0 || seconds >= 60) {
                    return Optional.empty();
                }
                return Optional.of(Duration.ofSeconds(minutes * 60 + seconds));
            }
            long seconds = Long.parseLong(value);
            if (seconds < 0) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String formatDuration(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        long minutes = totalSeconds / 60;
        long seconds = totalSeconds % 60;
        return String.format("%d:%02d", minutes, seconds);
    }

    private interface ControlCall {
        void invoke(String sessionKey) throws CommandException;
    }

    private static final class SilentPublisher implements Publisher {
        @Override
        public void publish(EntityKind kind, String key, Object state, Map<String, Object> attributes) {
        }

        @Override
        public void markUnavailable(EntityKind kind, String key, Instant lastUpdated) {
        }

        @Override
        public void remove(EntityKind kind, String key) {
        }
    }

    private PlaybackControlCliExample() {
    }
}

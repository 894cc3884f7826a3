package com.assistant.relevance.router.config;

import com.assistant.relevance.router.RouterSettings;
import com.assistant.relevance.similarity.ScoringConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Keeps labeled snapshots of router configurations with an active version, rollback
 * and a canary split by chat id. Only the most recent {@value #MAX_PERSISTED_SNAPSHOTS}
 * snapshots are persisted.
 */
public class RouterVersionStore {
    private static final Logger log = LoggerFactory.getLogger(RouterVersionStore.class);

    static final int MAX_PERSISTED_SNAPSHOTS = 50;
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Clock clock;
    private final Random random;

    private final List<RouterVersionSnapshot> snapshots = new ArrayList<>();
    private String activeVersionId;
    private CanaryStatus canary = CanaryStatus.disabled();

    public RouterVersionStore() {
        this(Clock.systemUTC(), new Random());
    }

    public RouterVersionStore(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Replaces the in-memory state with the persisted one.
     *
     * @throws RouterConfigException if the file cannot be read or is not a version file
     */
    public synchronized void load(Path file) {
        StoreFile stored;
        try {
            stored = objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), StoreFile.class);
        } catch (IOException e) {
            throw new RouterConfigException("Invalid router version file " + file + ": " + e.getMessage(), e);
        }
        if (stored == null || stored.snapshots() == null) {
            throw new RouterConfigException("Invalid router version file " + file);
        }
        snapshots.clear();
        for (RouterVersionSnapshot snapshot : stored.snapshots()) {
            if (snapshot == null || snapshot.id() == null) {
                continue;
            }
            snapshots.add(new RouterVersionSnapshot(
                    snapshot.id(),
                    snapshot.createdAt() != null ? snapshot.createdAt() : Instant.now(clock).toString(),
                    snapshot.label() != null ? snapshot.label() : "snapshot",
                    snapshot.routes(),
                    ScoringConfig.clampAlpha(snapshot.hybridAlpha()),
                    RouterSettings.clampGap(snapshot.minScoreGap())));
        }
        activeVersionId = stored.activeVersionId();
        canary = stored.canary() != null ? stored.canary() : CanaryStatus.disabled();
        log.info("router.versions.loaded file={} snapshots={} active={}", file, snapshots.size(), activeVersionId);
    }

    public synchronized void save(Path file) {
        List<RouterVersionSnapshot> kept = snapshots.subList(
                Math.max(0, snapshots.size() - MAX_PERSISTED_SNAPSHOTS), snapshots.size());
        StoreFile stored = new StoreFile(1, Instant.now(clock).toString(), activeVersionId, canary,
                new ArrayList<>(kept));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, objectMapper.writeValueAsString(stored) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RouterConfigException("Failed to write router version file " + file + ": " + e.getMessage(), e);
        }
        log.info("router.versions.saved file={} snapshots={}", file, kept.size());
    }

    /**
     * Records a snapshot of the settings and makes it the active version.
     */
    public synchronized RouterVersionSnapshot createSnapshot(String label, RouterSettings settings) {
        String safeLabel = label == null || label.isBlank() ? "snapshot" : label.trim();
        RouterVersionSnapshot snapshot = new RouterVersionSnapshot(
                newId(),
                Instant.now(clock).toString(),
                safeLabel,
                RouteEntries.toEntries(settings.routes()),
                settings.hybridAlpha(),
                settings.minScoreGap());
        snapshots.add(snapshot);
        activeVersionId = snapshot.id();
        log.info("router.versions.snapshot id={} label={} routes={}", snapshot.id(), safeLabel, settings.routes().size());
        return snapshot;
    }

    /**
     * Snapshots, newest first.
     */
    public synchronized List<RouterVersionSnapshot> listSnapshots() {
        List<RouterVersionSnapshot> sorted = new ArrayList<>(snapshots);
        sorted.sort(Comparator.comparing(RouterVersionSnapshot::createdAt).reversed());
        return sorted;
    }

    public synchronized Optional<RouterVersionSnapshot> getSnapshot(String versionId) {
        return snapshots.stream().filter(s -> s.id().equals(versionId)).findFirst();
    }

    public synchronized Optional<RouterVersionSnapshot> getActiveSnapshot() {
        return activeVersionId == null ? Optional.empty() : getSnapshot(activeVersionId);
    }

    /**
     * Makes an existing snapshot the active version.
     */
    public synchronized Optional<RouterVersionSnapshot> rollbackTo(String versionId) {
        Optional<RouterVersionSnapshot> snapshot = getSnapshot(versionId);
        snapshot.ifPresent(s -> {
            activeVersionId = s.id();
            log.info("router.versions.rollback id={}", s.id());
        });
        return snapshot;
    }

    /**
     * Serves the snapshot to {@code splitPercent} percent of chats.
     *
     * @return false when the snapshot does not exist
     */
    public synchronized boolean setCanary(String versionId, int splitPercent) {
        if (getSnapshot(versionId).isEmpty()) {
            return false;
        }
        canary = new CanaryStatus(true, splitPercent, versionId);
        log.info("router.versions.canary id={} split={}", versionId, canary.splitPercent());
        return true;
    }

    public synchronized void disableCanary() {
        canary = CanaryStatus.disabled();
    }

    public synchronized CanaryStatus getCanaryStatus() {
        return canary;
    }

    /**
     * Chooses the settings for a chat: the canary snapshot when the chat's bucket
     * {@code |chatId| % 100} falls below the split, otherwise {@code fallback}.
     */
    public synchronized RouterSettings resolveSettingsForChat(long chatId, RouterSettings fallback) {
        if (!canary.enabled() || canary.versionId() == null || canary.splitPercent() <= 0) {
            return fallback;
        }
        Optional<RouterVersionSnapshot> snapshot = getSnapshot(canary.versionId());
        if (snapshot.isEmpty()) {
            return fallback;
        }
        long bucket = Math.abs(chatId % 100);
        if (bucket >= canary.splitPercent()) {
            return fallback;
        }
        return snapshot.get().toSettings();
    }

    private String newId() {
        StringBuilder suffix = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "rv-" + Long.toString(clock.millis(), 36) + "-" + suffix;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StoreFile(
            int version,
            String updatedAt,
            String activeVersionId,
            CanaryStatus canary,
            List<RouterVersionSnapshot> snapshots
    ) {}
}

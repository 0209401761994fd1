package de.mirkosertic.docconsolidator.cache;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the per-folder merge cache sidecar.
 * <p>
 * Each entity folder carries its own sidecar, so entries are never shared between
 * folders. An unreadable or malformed sidecar is treated as absent, which forces a
 * re-merge.
 */
public class MergeCache {

    private static final Logger logger = LoggerFactory.getLogger(MergeCache.class);

    private static final String KEY_FOLDER = "folder";
    private static final String KEY_FINGERPRINT = "fingerprint";
    private static final String KEY_TIMESTAMP = "timestamp";

    private final String sidecarName;
    private final Yaml yaml;

    public MergeCache(final String sidecarName) {
        this.sidecarName = sidecarName;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    public Path sidecarPath(final Path folder) {
        return folder.resolve(sidecarName);
    }

    /**
     * @return the stored entry, or {@code null} if the sidecar does not exist or cannot be parsed
     */
    @SuppressWarnings("unchecked")
    public @Nullable MergeCacheEntry load(final Path folder) {
        final Path sidecar = sidecarPath(folder);
        if (!Files.exists(sidecar)) {
            return null;
        }

        try (final Reader reader = Files.newBufferedReader(sidecar)) {
            final Object loaded = yaml.load(reader);
            if (!(loaded instanceof Map)) {
                logger.debug("Merge cache sidecar is empty: {}", sidecar);
                return null;
            }
            final Map<String, Object> map = (Map<String, Object>) loaded;
            final Object fingerprint = map.get(KEY_FINGERPRINT);
            final Object timestamp = map.get(KEY_TIMESTAMP);
            if (fingerprint == null || timestamp == null) {
                logger.warn("Incomplete merge cache sidecar: {}", sidecar);
                return null;
            }
            final Object storedFolder = map.getOrDefault(KEY_FOLDER, folder.getFileName().toString());
            final Instant instant = timestamp instanceof Date date
                    ? date.toInstant()
                    : Instant.parse(timestamp.toString());
            return new MergeCacheEntry(storedFolder.toString(), fingerprint.toString(), instant);
        } catch (final IOException e) {
            logger.warn("Failed to read merge cache sidecar: {}", sidecar, e);
            return null;
        } catch (final YAMLException | DateTimeParseException e) {
            logger.warn("Invalid merge cache sidecar: {}", sidecar, e);
            return null;
        }
    }

    /**
     * Whether the stored fingerprint for {@code folder} equals {@code fingerprint}.
     */
    public boolean matches(final Path folder, final String fingerprint) {
        final MergeCacheEntry entry = load(folder);
        return entry != null && entry.fingerprint().equals(fingerprint);
    }

    /**
     * Remove the sidecar of {@code folder}.
     *
     * @return whether a sidecar existed
     */
    public boolean invalidate(final Path folder) throws IOException {
        final boolean deleted = Files.deleteIfExists(sidecarPath(folder));
        if (deleted) {
            logger.debug("Removed merge cache sidecar of {}", folder.getFileName());
        }
        return deleted;
    }

    /**
     * Persist the entry. Called only after the merged output was written and verified.
     * The sidecar is written to a temporary sibling first and moved into place.
     *
     * @throws IOException if the write fails
     */
    public void save(final Path folder, final MergeCacheEntry entry) throws IOException {
        final Path sidecar = sidecarPath(folder);
        final Path temp = sidecar.resolveSibling(sidecar.getFileName() + ".tmp");

        final Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_FOLDER, entry.folder());
        map.put(KEY_FINGERPRINT, entry.fingerprint());
        map.put(KEY_TIMESTAMP, entry.timestamp().toString());

        try (final Writer writer = Files.newBufferedWriter(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(map, writer);
        }
        try {
            Files.move(temp, sidecar, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(temp, sidecar, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Saved merge cache for {}: {}", entry.folder(), entry.fingerprint());
    }
}

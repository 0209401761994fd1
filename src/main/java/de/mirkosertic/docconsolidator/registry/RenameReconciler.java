package de.mirkosertic.docconsolidator.registry;

import de.mirkosertic.docconsolidator.fs.FolderSnapshot;
import de.mirkosertic.docconsolidator.fs.SafeCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the folders under the destination root in line with the desired folder names
 * of the entity table.
 * <p>
 * Algorithm, per entity in table order:
 * <ol>
 *   <li>Skip entities with a blank desired or history name.</li>
 *   <li>Defer an entity whose existing desired folder is still the history folder of another
 *       pending entity, until that entity has moved it away. Entities left waiting on each
 *       other form a rename cycle; they stay unchanged and are reported as open issues.</li>
 *   <li>If the (history, desired) pair was already handled in this pass, only advance the history.
 *       Handling a pair advances every row that started the pass on the same pair.</li>
 *   <li>If the history folder exists under another name, rename it, or move its files into the
 *       existing desired folder with {@link SafeCopier} and remove it once empty. A history file
 *       is deleted only once its content is known to be in the desired folder.</li>
 *   <li>Otherwise make sure the desired folder exists and advance the history.</li>
 * </ol>
 * <p>
 * An I/O failure is confined to its entity: the history stays unchanged so the next run
 * retries, and the failure is reported in the {@link ReconciliationResult}.
 */
public class RenameReconciler {

    private static final Logger logger = LoggerFactory.getLogger(RenameReconciler.class);

    private final SafeCopier copier;

    public RenameReconciler(final SafeCopier copier) {
        this.copier = copier;
    }

    public ReconciliationResult reconcile(final List<Entity> entities, final Path destinationRoot) {
        final long startTime = System.currentTimeMillis();
        final Pass pass = new Pass();
        for (final Entity entity : entities) {
            pass.startHistories.put(entity, entity.historyFolderName());
        }

        final List<Entity> pending = new ArrayList<>(entities);
        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            for (final Iterator<Entity> it = pending.iterator(); it.hasNext(); ) {
                final Entity entity = it.next();
                if (waitsForAnother(entity, pending, destinationRoot)) {
                    continue;
                }
                it.remove();
                progress = true;
                reconcileEntity(entity, entities, destinationRoot, pass);
            }
        }
        for (final Entity entity : pending) {
            pass.openIssues.add("Rename cycle, folder left unchanged: "
                    + entity.historyFolderName() + " -> " + entity.desiredFolderName());
        }

        final long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Reconciliation: {} renamed, {} merged, {} created, {} files moved in {}ms",
                pass.renamed, pass.merged, pass.created, pass.filesMoved, elapsed);
        return new ReconciliationResult(pass.renamed, pass.merged, pass.created, pass.filesMoved,
                pass.historiesUpdated, pass.openIssues, pass.failures, elapsed);
    }

    /**
     * Whether the desired folder of {@code entity} exists and is still to be renamed away by another
     * pending entity.
     */
    private static boolean waitsForAnother(final Entity entity, final List<Entity> pending, final Path destinationRoot) {
        final String desired = entity.desiredFolderName();
        final String history = entity.historyFolderName();
        if (desired.isEmpty() || history.isEmpty() || history.equals(desired)
                || !Files.isDirectory(destinationRoot.resolve(desired))) {
            return false;
        }
        for (final Entity other : pending) {
            if (other != entity
                    && other.historyFolderName().equals(desired)
                    && !other.desiredFolderName().isEmpty()
                    && !other.desiredFolderName().equals(desired)) {
                return true;
            }
        }
        return false;
    }

    private void reconcileEntity(final Entity entity, final List<Entity> entities, final Path destinationRoot,
                                 final Pass pass) {
        final String desired = entity.desiredFolderName();
        final String history = entity.historyFolderName();
        if (desired.isEmpty() || history.isEmpty()) {
            return;
        }

        final String pair = history + '\u0000' + desired;
        if (pass.failedPairs.contains(pair)) {
            return;
        }
        if (pass.completedPairs.contains(pair)) {
            if (!history.equals(desired)) {
                entity.confirmFolder(desired);
                pass.historiesUpdated++;
            }
            return;
        }

        final Path historyPath = destinationRoot.resolve(history);
        final Path desiredPath = destinationRoot.resolve(desired);
        try {
            if (!history.equals(desired) && Files.isDirectory(historyPath)) {
                if (!Files.exists(desiredPath) || Files.isSameFile(historyPath, desiredPath)) {
                    Files.move(historyPath, desiredPath);
                    pass.renamed++;
                    logger.info("RENAMED: {} -> {}", history, desired);
                } else {
                    pass.filesMoved += mergeInto(historyPath, desiredPath, pass);
                    pass.merged++;
                    if (removeIfEmpty(historyPath)) {
                        logger.info("DELETED empty folder: {}", history);
                    } else {
                        pass.openIssues.add("Folder not empty after merge into " + desired + ": " + history);
                    }
                }
            } else if (!Files.isDirectory(desiredPath)) {
                Files.createDirectories(desiredPath);
                pass.created++;
                logger.info("CREATED folder: {}", desired);
            }
            if (!history.equals(desired)) {
                // Every row that started the pass on this pair follows the folder
                for (final Entity other : entities) {
                    if (history.equals(pass.startHistories.get(other))
                            && other.historyFolderName().equals(history)
                            && other.desiredFolderName().equals(desired)) {
                        other.confirmFolder(desired);
                        pass.historiesUpdated++;
                    }
                }
            }
            pass.completedPairs.add(pair);
        } catch (final IOException e) {
            pass.failedPairs.add(pair);
            pass.failures.add("Rename " + history + " -> " + desired + " failed: " + e);
        }
    }

    /**
     * Copy every file of the history folder into the desired folder. The history file is removed
     * when the copy is new, or when the file it was matched with has identical bytes. Anything else
     * stays behind for review.
     */
    private int mergeInto(final Path historyPath, final Path desiredPath, final Pass pass) throws IOException {
        final Set<String> present = new HashSet<>();
        for (final Path existing : FolderSnapshot.capture(desiredPath).files()) {
            present.add(existing.getFileName().toString());
        }

        int moved = 0;
        for (final Path file : FolderSnapshot.capture(historyPath).files()) {
            final String name = file.getFileName().toString();
            try {
                final Path target = copier.copy(file, desiredPath.resolve(name));
                final boolean freshCopy = present.add(target.getFileName().toString());
                if (!freshCopy && Files.mismatch(file, target) != -1) {
                    pass.openIssues.add("Kept " + historyPath.getFileName() + "/" + name
                            + ", it differs from " + desiredPath.getFileName() + "/" + target.getFileName());
                    logger.warn("KEPT {}: {}/{} has the same size but different content",
                            name, desiredPath.getFileName(), target.getFileName());
                    continue;
                }
                Files.delete(file);
                moved++;
                logger.info("MOVED {}: {} -> {}/{}", name, historyPath.getFileName(), desiredPath.getFileName(), target.getFileName());
            } catch (final IOException e) {
                pass.failures.add("Moving " + file + " into " + desiredPath + " failed: " + e);
            }
        }
        return moved;
    }

    private static boolean removeIfEmpty(final Path folder) throws IOException {
        if (!FolderSnapshot.capture(folder).isEmpty()) {
            return false;
        }
        Files.delete(folder);
        return true;
    }

    /**
     * Counters and findings of one reconciliation pass.
     */
    private static final class Pass {
        private final Map<Entity, String> startHistories = new IdentityHashMap<>();
        private final Set<String> completedPairs = new HashSet<>();
        private final Set<String> failedPairs = new HashSet<>();
        private final List<String> openIssues = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();
        private int renamed;
        private int merged;
        private int created;
        private int filesMoved;
        private int historiesUpdated;
    }
}

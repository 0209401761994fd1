package de.mirkosertic.docconsolidator.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable listing of one directory, captured before a stage mutates it.
 * Files the stage creates afterwards are not part of the snapshot.
 */
public record FolderSnapshot(
        Path folder,
        /** Regular files, sorted by name. */
        List<Path> files,
        /** Sub-directories, sorted by name. */
        List<Path> directories
) {

    public FolderSnapshot {
        files = List.copyOf(files);
        directories = List.copyOf(directories);
    }

    public static FolderSnapshot capture(final Path folder) throws IOException {
        final List<Path> files = new ArrayList<>();
        final List<Path> directories = new ArrayList<>();
        try (final Stream<Path> entries = Files.list(folder)) {
            entries.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .forEach(entry -> {
                        if (Files.isDirectory(entry)) {
                            directories.add(entry);
                        } else if (Files.isRegularFile(entry)) {
                            files.add(entry);
                        }
                    });
        }
        return new FolderSnapshot(folder, files, directories);
    }

    /**
     * The entity folders directly below the destination root. Hidden directories are skipped.
     */
    public static List<Path> entityFolders(final Path destinationRoot) throws IOException {
        return capture(destinationRoot).directories().stream()
                .filter(dir -> !dir.getFileName().toString().startsWith("."))
                .toList();
    }

    public boolean isEmpty() {
        return files.isEmpty() && directories.isEmpty();
    }

    public boolean containsFile(final String fileName) {
        return files.stream().anyMatch(file -> file.getFileName().toString().equals(fileName));
    }
}

package de.mirkosertic.docconsolidator.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A flat directory of PDFs. A reference matches the first PDF, by name, whose
 * name contains {@code (<reference>)}, ignoring case.
 * <p>
 * The directory is listed once on first use and the listing is reused for
 * every lookup of the run.
 */
public class DirectorySourceStore implements SourceStore {

    private static final Logger logger = LoggerFactory.getLogger(DirectorySourceStore.class);

    private final Path directory;
    private List<Path> listing;

    public DirectorySourceStore(final Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<Path> find(final String reference) throws IOException {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        final String needle = "(" + reference.trim().toLowerCase(Locale.ROOT) + ")";
        for (final Path candidate : listing()) {
            if (candidate.getFileName().toString().toLowerCase(Locale.ROOT).contains(needle)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<Path> listing() throws IOException {
        if (listing == null) {
            try (final Stream<Path> entries = Files.list(directory)) {
                listing = entries
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .toList();
            }
            logger.info("Source store {} holds {} PDFs", directory, listing.size());
        }
        return listing;
    }

    public Path directory() {
        return directory;
    }
}

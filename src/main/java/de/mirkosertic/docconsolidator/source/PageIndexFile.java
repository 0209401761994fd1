package de.mirkosertic.docconsolidator.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Plain text reference index with one {@code <document-name> <page>} entry per line.
 * <p>
 * Lines with fewer than two tokens or a non-numeric page are ignored. A code matches
 * every line whose document name contains it, ignoring case.
 */
public class PageIndexFile implements ReferenceIndex {

    private static final Logger logger = LoggerFactory.getLogger(PageIndexFile.class);

    private final List<Entry> entries;

    private record Entry(String documentName, int page) {
    }

    private PageIndexFile(final List<Entry> entries) {
        this.entries = entries;
    }

    public static PageIndexFile load(final Path file) throws IOException {
        final List<Entry> entries = new ArrayList<>();
        int ignored = 0;
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.IGNORE)
                        .onUnmappableCharacter(CodingErrorAction.IGNORE)))) {
            String line;
            while ((line = reader.readLine()) != null) {
                final String[] parts = line.trim().split("\\s+");
                if (parts.length < 2) {
                    continue;
                }
                try {
                    entries.add(new Entry(parts[0].toLowerCase(Locale.ROOT), Integer.parseInt(parts[1])));
                } catch (final NumberFormatException e) {
                    ignored++;
                }
            }
        }
        logger.info("Loaded {} index entries from {} ({} lines ignored)", entries.size(), file, ignored);
        return new PageIndexFile(entries);
    }

    @Override
    public List<Integer> pagesFor(final String code) {
        if (code == null || code.isBlank()) {
            return List.of();
        }
        final String needle = code.trim().toLowerCase(Locale.ROOT);
        final TreeSet<Integer> pages = new TreeSet<>();
        for (final Entry entry : entries) {
            if (entry.documentName().contains(needle)) {
                pages.add(entry.page());
            }
        }
        return List.copyOf(pages);
    }

    public int size() {
        return entries.size();
    }
}

package de.mirkosertic.docconsolidator.fs;

import de.mirkosertic.docconsolidator.config.ApplicationConfig;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers the {@link DocumentRole} of a file from its name and derives the
 * names the pipeline writes (backups, extracted pages).
 */
public class DocumentClassifier {

    private static final String PDF_EXTENSION = ".pdf";
    private static final Pattern EXTRACTED_RANGE = Pattern.compile("^\\d+\\.pdf$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_SUFFIX = Pattern.compile("\\(([^)]+)\\)(?:_dup\\d+)?\\.pdf$", Pattern.CASE_INSENSITIVE);

    private final String mergedOutputName;
    private final String backupMarker;

    public DocumentClassifier(final String mergedOutputName, final String backupMarker) {
        this.mergedOutputName = mergedOutputName;
        this.backupMarker = backupMarker;
    }

    public static DocumentClassifier from(final ApplicationConfig config) {
        return new DocumentClassifier(config.getMergedOutputName(), config.getBackupMarker());
    }

    public DocumentRole classify(final Path file) {
        return classify(file.getFileName().toString());
    }

    public DocumentRole classify(final String fileName) {
        if (fileName.startsWith(".")) {
            return DocumentRole.OTHER;
        }
        if (fileName.equalsIgnoreCase(mergedOutputName)) {
            return DocumentRole.MERGED_OUTPUT;
        }
        if (!isPdf(fileName)) {
            return DocumentRole.OTHER;
        }
        if (EXTRACTED_RANGE.matcher(fileName).matches()) {
            return DocumentRole.EXTRACTED_RANGE;
        }
        if (hasBackupMarker(fileName)) {
            return DocumentRole.BACKUP_COPY;
        }
        return DocumentRole.SOURCE_ORIGINAL;
    }

    public static boolean isPdf(final String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
    }

    public boolean hasBackupMarker(final String fileName) {
        return baseName(fileName).toLowerCase(Locale.ROOT).contains(backupMarker.toLowerCase(Locale.ROOT));
    }

    /**
     * The document code of a source original: the first two hyphen-separated segments
     * of the parenthesized suffix, so {@code Drawing(AB-12-34).pdf} yields {@code AB-12}.
     * Names with fewer than two segments carry no code.
     */
    public Optional<String> documentCode(final String fileName) {
        if (classify(fileName) != DocumentRole.SOURCE_ORIGINAL) {
            return Optional.empty();
        }
        return codeOf(fileName);
    }

    static Optional<String> codeOf(final String fileName) {
        final Matcher matcher = CODE_SUFFIX.matcher(fileName);
        if (!matcher.find()) {
            return Optional.empty();
        }
        final String[] segments = matcher.group(1).trim().split("-");
        if (segments.length < 2 || segments[0].isBlank() || segments[1].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(segments[0].trim() + "-" + segments[1].trim());
    }

    public OptionalInt extractedPage(final String fileName) {
        if (classify(fileName) != DocumentRole.EXTRACTED_RANGE) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(baseName(fileName)));
        } catch (final NumberFormatException e) {
            // more digits than an int holds, not a page we ever wrote
            return OptionalInt.empty();
        }
    }

    public String backupName(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + backupMarker;
        }
        return fileName.substring(0, dot) + backupMarker + fileName.substring(dot);
    }

    public static String extractedRangeName(final int page) {
        return page + PDF_EXTENSION;
    }

    /**
     * Merge order: extracted ranges by page number, then source originals, then backups,
     * each of the latter two ordered case-insensitively with the exact name as tie breaker.
     */
    public Comparator<Path> mergeOrder() {
        return Comparator.<Path>comparingInt(file -> rank(classify(file)))
                .thenComparingLong(file -> extractedPage(file.getFileName().toString()).orElse(Integer.MAX_VALUE))
                .thenComparing(file -> file.getFileName().toString(), String.CASE_INSENSITIVE_ORDER)
                .thenComparing(file -> file.getFileName().toString());
    }

    private static int rank(final DocumentRole role) {
        return switch (role) {
            case EXTRACTED_RANGE -> 0;
            case SOURCE_ORIGINAL -> 1;
            case BACKUP_COPY -> 2;
            case MERGED_OUTPUT, OTHER -> 3;
        };
    }

    private static String baseName(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

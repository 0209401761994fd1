package de.mirkosertic.docconsolidator.util;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Utility class for bringing extracted page text into a canonical form.
 *
 * <p>Two extractions of the same visible text must produce the same string, whatever
 * the producing application wrote into the content stream:</p>
 * <ul>
 *   <li>NFKC normalization expands ligatures and full-width forms</li>
 *   <li>Control characters, zero-width characters and replacement characters are dropped</li>
 *   <li>Unicode space variants become an ASCII space</li>
 *   <li>Runs of whitespace collapse into a single space, the result is trimmed</li>
 * </ul>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +             // Control chars before TAB
        "\u000B-\u000C" +             // Control chars between TAB and CR (excluding LF)
        "\u000E-\u001F" +             // Control chars after CR
        "\u007F-\u009F" +             // DEL and C1 controls
        "\u200B-\u200D" +             // Zero-width space, non-joiner, joiner
        "\uFEFF" +                    // Byte order mark
        "\uFFFD" +                    // Replacement character
        "]"
    );

    private static final Pattern UNICODE_SPACES = Pattern.compile("[\u00A0\u1680\u2000-\u200A\u202F\u205F\u3000]");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * @param text the text to canonicalize (may be null)
     * @return canonical text, empty for null input
     */
    public static String canonicalize(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String cleaned = Normalizer.normalize(text, Normalizer.Form.NFKC);
        cleaned = INVALID_CHARS.matcher(cleaned).replaceAll("");
        cleaned = UNICODE_SPACES.matcher(cleaned).replaceAll(" ");
        cleaned = WHITESPACE_RUN.matcher(cleaned).replaceAll(" ");
        return cleaned.trim();
    }
}

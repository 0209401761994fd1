package de.mirkosertic.docconsolidator.hash;

import de.mirkosertic.docconsolidator.util.TextCleaner;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes the page-scope fingerprint: SHA-256 over the canonical content of one page.
 * <p>
 * The canonical content consists of the media box and every text run PDFBox extracts,
 * each with its start position rounded to 0.1pt, its font size and its text run through
 * {@link TextCleaner#canonicalize(String)}. A page without extractable text is identified
 * by its decoded content stream plus the raw bytes of the XObjects it references, so two
 * scans of different sheets never collapse into one.
 * <p>
 * Fingerprints are only comparable within one merge pass and are never stored.
 */
public class PageFingerprinter {

    public String fingerprint(final PDDocument document, final int pageIndex) throws IOException {
        final PDPage page = document.getPage(pageIndex);
        final MessageDigest digest = Digests.newDigest();

        final PDRectangle mediaBox = page.getMediaBox();
        update(digest, "box:" + tenths(mediaBox.getLowerLeftX()) + "," + tenths(mediaBox.getLowerLeftY())
                + "," + tenths(mediaBox.getWidth()) + "," + tenths(mediaBox.getHeight()));

        final List<String> runs = textRuns(document, pageIndex);
        if (!runs.isEmpty()) {
            for (final String run : runs) {
                update(digest, run);
            }
        } else {
            update(digest, "stream:");
            try (final InputStream contents = page.getContents()) {
                digest.update(contents.readAllBytes());
            }
            updateWithXObjects(digest, page.getResources());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static List<String> textRuns(final PDDocument document, final int pageIndex) throws IOException {
        final RunRecordingStripper stripper = new RunRecordingStripper();
        stripper.setSortByPosition(true);
        stripper.setStartPage(pageIndex + 1);
        stripper.setEndPage(pageIndex + 1);
        stripper.getText(document);
        return stripper.runs;
    }

    private static void updateWithXObjects(final MessageDigest digest, final PDResources resources) throws IOException {
        if (resources == null) {
            return;
        }
        for (final COSName name : resources.getXObjectNames()) {
            final COSBase base = resources.getCOSObject().getCOSDictionary(COSName.XOBJECT).getDictionaryObject(name);
            if (base instanceof COSStream stream) {
                update(digest, "xobject:" + name.getName());
                try (final InputStream raw = stream.createRawInputStream()) {
                    digest.update(raw.readAllBytes());
                }
            }
        }
    }

    private static void update(final MessageDigest digest, final String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) '\n');
    }

    static long tenths(final float value) {
        return Math.round(value * 10.0d);
    }

    /**
     * Collects one entry per text run instead of writing text to the output.
     */
    private static final class RunRecordingStripper extends PDFTextStripper {

        private final List<String> runs = new ArrayList<>();

        @Override
        protected void writeString(final String text, final List<TextPosition> textPositions) {
            final String canonical = TextCleaner.canonicalize(text);
            if (canonical.isEmpty() || textPositions.isEmpty()) {
                return;
            }
            final TextPosition first = textPositions.get(0);
            runs.add("text:" + tenths(first.getXDirAdj()) + "," + tenths(first.getYDirAdj())
                    + "," + tenths(first.getFontSizeInPt()) + ":" + canonical);
        }
    }
}

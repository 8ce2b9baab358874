package com.craftcatalogue.service.report;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Flowing page layout on top of PDFBox.
 * Keeps a vertical cursor, starts a new page (with the report title) whenever
 * the next element does not fit, and stamps "Page X of Y" on every page in
 * {@link #finish()}.
 */
final class PdfReportWriter implements Closeable {

    static final float MARGIN = 36f;

    private static final float TITLE_SIZE = 16f;
    private static final float FOOTER_SIZE = 9f;
    private static final float CELL_PADDING = 3f;
    private static final String ELLIPSIS = "...";

    private final PDDocument document;
    private final PDRectangle pageSize;
    private final String title;

    private final PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

    private PDPageContentStream content;
    private float y;

    PdfReportWriter(PDDocument document, PDRectangle pageSize, String title) {
        this.document = document;
        this.pageSize = pageSize;
        this.title = title;
    }

    PDFont regular() {
        return regular;
    }

    PDFont bold() {
        return bold;
    }

    float contentWidth() {
        return pageSize.getWidth() - 2 * MARGIN;
    }

    // ========================================================================
    // Page Flow
    // ========================================================================

    /**
     * Start a new page headed by the report title.
     */
    void newPage() throws IOException {
        closeContent();
        PDPage page = new PDPage(pageSize);
        document.addPage(page);
        content = new PDPageContentStream(document, page);
        y = pageSize.getHeight() - MARGIN;

        String shownTitle = fit(title, bold, TITLE_SIZE, contentWidth());
        float titleWidth = width(shownTitle, bold, TITLE_SIZE);
        writeAt(shownTitle, bold, TITLE_SIZE, (pageSize.getWidth() - titleWidth) / 2, y - TITLE_SIZE);
        y -= TITLE_SIZE + 14f;
    }

    /**
     * Make sure {@code height} points fit above the footer, breaking the page if not.
     *
     * @return true if a new page was started
     */
    boolean ensureSpace(float height) throws IOException {
        if (content == null || y - height < MARGIN + FOOTER_SIZE + 8f) {
            newPage();
            return true;
        }
        return false;
    }

    void space(float height) {
        y -= height;
    }

    // ========================================================================
    // Text
    // ========================================================================

    /**
     * One line of text, truncated to the content width.
     */
    void line(String text, PDFont font, float size) throws IOException {
        float height = size + 4f;
        ensureSpace(height);
        writeAt(fit(text, font, size, contentWidth()), font, size, MARGIN, y - size);
        y -= height;
    }

    /**
     * One centered line of text.
     */
    void centeredLine(String text, PDFont font, float size) throws IOException {
        float height = size + 4f;
        ensureSpace(height);
        String shown = fit(text, font, size, contentWidth());
        writeAt(shown, font, size, (pageSize.getWidth() - width(shown, font, size)) / 2, y - size);
        y -= height;
    }

    /**
     * Text wrapped at word boundaries over as many lines (and pages) as needed.
     */
    void paragraph(String text, PDFont font, float size) throws IOException {
        for (String wrapped : wrap(sanitize(text, font), font, size, contentWidth())) {
            line(wrapped, font, size);
        }
    }

    // ========================================================================
    // Tables
    // ========================================================================

    /**
     * Draw a table whose header row repeats at the top of every page it spans.
     * Cell text is truncated to its column width.
     */
    void table(String[] headers, float[] widths, boolean[] rightAligned, List<String[]> rows,
               float fontSize) throws IOException {
        float rowHeight = fontSize + 2 * CELL_PADDING + 2f;

        ensureSpace(rowHeight * 2);
        row(headers, widths, rightAligned, bold, fontSize + 1, rowHeight, 0.75f);

        boolean shaded = false;
        for (String[] cells : rows) {
            if (ensureSpace(rowHeight)) {
                row(headers, widths, rightAligned, bold, fontSize + 1, rowHeight, 0.75f);
            }
            row(cells, widths, rightAligned, regular, fontSize, rowHeight, shaded ? 0.9f : 1f);
            shaded = !shaded;
        }
    }

    private void row(String[] cells, float[] widths, boolean[] rightAligned, PDFont font, float size,
                     float height, float grey) throws IOException {
        float x = MARGIN;
        float bottom = y - height;
        for (int i = 0; i < widths.length; i++) {
            if (grey < 1f) {
                content.setNonStrokingColor(grey, grey, grey);
                content.addRect(x, bottom, widths[i], height);
                content.fill();
                content.setNonStrokingColor(0f, 0f, 0f);
            }
            content.setLineWidth(0.5f);
            content.addRect(x, bottom, widths[i], height);
            content.stroke();

            String value = i < cells.length ? cells[i] : "";
            String shown = fit(value, font, size, widths[i] - 2 * CELL_PADDING);
            float textX = rightAligned[i]
                ? x + widths[i] - CELL_PADDING - width(shown, font, size)
                : x + CELL_PADDING;
            writeAt(shown, font, size, textX, bottom + CELL_PADDING + 1f);
            x += widths[i];
        }
        y = bottom;
    }

    // ========================================================================
    // Finishing
    // ========================================================================

    /**
     * Close the last page and number all pages.
     */
    void finish() throws IOException {
        if (content == null) {
            newPage();
        }
        closeContent();

        int total = document.getNumberOfPages();
        for (int i = 0; i < total; i++) {
            PDPage page = document.getPage(i);
            try (PDPageContentStream footer = new PDPageContentStream(
                    document, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                String label = "Page " + (i + 1) + " of " + total;
                float labelX = (pageSize.getWidth() - width(label, regular, FOOTER_SIZE)) / 2;
                footer.beginText();
                footer.setFont(regular, FOOTER_SIZE);
                footer.newLineAtOffset(labelX, MARGIN / 2);
                footer.showText(label);
                footer.endText();
            }
        }
    }

    @Override
    public void close() throws IOException {
        closeContent();
    }

    // ========================================================================
    // Private Helpers
    // ========================================================================

    private void closeContent() throws IOException {
        if (content != null) {
            content.close();
            content = null;
        }
    }

    private void writeAt(String text, PDFont font, float size, float x, float baseline) throws IOException {
        content.beginText();
        content.setFont(font, size);
        content.newLineAtOffset(x, baseline);
        content.showText(text);
        content.endText();
    }

    float width(String text, PDFont font, float size) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    /**
     * Sanitized text cut down (with an ellipsis) to fit the given width.
     */
    String fit(String text, PDFont font, float size, float maxWidth) throws IOException {
        String clean = sanitize(text, font);
        if (width(clean, font, size) <= maxWidth) {
            return clean;
        }
        // longest prefix that still fits with the ellipsis
        int low = 0;
        int high = clean.length() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (width(clean.substring(0, mid) + ELLIPSIS, font, size) <= maxWidth) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low == 0 ? "" : clean.substring(0, low) + ELLIPSIS;
    }

    private List<String> wrap(String text, PDFont font, float size, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (current.length() > 0 && width(candidate, font, size) > maxWidth) {
                lines.add(current.toString());
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    /**
     * Replace line breaks with spaces and characters the font cannot encode with '?'.
     */
    static String sanitize(String text, PDFont font) {
        if (text == null) {
            return "";
        }
        StringBuilder clean = new StringBuilder(text.length());
        for (int codePoint : text.codePoints().toArray()) {
            if (Character.isWhitespace(codePoint)) {
                clean.append(' ');
                continue;
            }
            String character = new String(Character.toChars(codePoint));
            try {
                font.encode(character);
                clean.append(character);
            } catch (IllegalArgumentException | IOException e) {
                clean.append('?');
            }
        }
        return clean.toString();
    }
}

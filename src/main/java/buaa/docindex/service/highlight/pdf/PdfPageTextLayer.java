package buaa.docindex.service.highlight.pdf;

import buaa.docindex.service.highlight.PageTextLayer;
import buaa.docindex.service.highlight.TextRegion;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.color.PDColor;
import org.apache.pdfbox.pdmodel.graphics.color.PDDeviceRGB;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationHighlight;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF单页文本层
 *
 * <p>首次检索时用 {@link PDFTextStripper} 收集本页字形位置，
 * 文本统一小写并把连续空白压缩为单个空格，每个字符都对应其字形，
 * 据此把匹配到的字符区间换算为页面坐标。</p>
 */
public class PdfPageTextLayer implements PageTextLayer {

    private static final PDColor HIGHLIGHT_COLOR = new PDColor(new float[]{1f, 1f, 0f}, PDDeviceRGB.INSTANCE);

    /** 字形高度之外为下行部分预留的比例 */
    private static final float DESCENT_RATIO = 0.25f;

    private final PDDocument document;
    private final PDPage page;
    private final int pageNumber;

    private String pageText;
    private List<TextPosition> glyphs;

    PdfPageTextLayer(PDDocument document, PDPage page, int pageNumber) {
        this.document = document;
        this.page = page;
        this.pageNumber = pageNumber;
    }

    @Override
    public int getPageNumber() {
        return pageNumber;
    }

    @Override
    public List<TextRegion> search(String text) {
        ensureTextLoaded();
        String needle = normalize(text);
        List<TextRegion> regions = new ArrayList<>();
        if (needle.isEmpty()) {
            return regions;
        }

        int from = 0;
        int index;
        while ((index = pageText.indexOf(needle, from)) >= 0) {
            TextRegion region = toRegion(index, index + needle.length(), text);
            if (region != null) {
                regions.add(region);
            }
            from = index + needle.length();
        }
        return regions;
    }

    @Override
    public void mark(TextRegion region) {
        PDAnnotationHighlight highlight = new PDAnnotationHighlight();
        highlight.setRectangle(new PDRectangle(
            region.getLeft(),
            region.getBottom(),
            region.getRight() - region.getLeft(),
            region.getTop() - region.getBottom()));
        highlight.setQuadPoints(region.getQuadPoints());
        highlight.setColor(HIGHLIGHT_COLOR);
        highlight.constructAppearances(document);

        try {
            addAnnotation(highlight);
        } catch (IOException e) {
            throw new UncheckedIOException("第" + pageNumber + "页标注写入失败", e);
        }
    }

    private void addAnnotation(PDAnnotation annotation) throws IOException {
        List<PDAnnotation> annotations = page.getAnnotations();
        annotations.add(annotation);
        page.setAnnotations(annotations);
    }

    /**
     * 将字符区间转换为区域，按基线分行，每行一组四边形
     */
    private TextRegion toRegion(int start, int end, String matchedText) {
        List<List<TextPosition>> lines = new ArrayList<>();
        List<TextPosition> currentLine = null;
        TextPosition previous = null;
        for (int i = start; i < end; i++) {
            TextPosition glyph = glyphs.get(i);
            if (glyph == null) {
                continue;
            }
            if (previous == null || startsNewLine(previous, glyph)) {
                currentLine = new ArrayList<>();
                lines.add(currentLine);
            }
            currentLine.add(glyph);
            previous = glyph;
        }
        if (lines.isEmpty()) {
            return null;
        }

        PDRectangle cropBox = page.getCropBox();
        float pageTop = cropBox.getLowerLeftY() + cropBox.getHeight();
        float offsetX = cropBox.getLowerLeftX();

        float[] quadPoints = new float[lines.size() * 8];
        float regionLeft = Float.MAX_VALUE;
        float regionBottom = Float.MAX_VALUE;
        float regionRight = -Float.MAX_VALUE;
        float regionTop = -Float.MAX_VALUE;

        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            float left = Float.MAX_VALUE;
            float right = -Float.MAX_VALUE;
            float baseline = -Float.MAX_VALUE;
            float height = 0f;
            for (TextPosition glyph : lines.get(lineIndex)) {
                left = Math.min(left, glyph.getXDirAdj());
                right = Math.max(right, glyph.getXDirAdj() + glyph.getWidthDirAdj());
                baseline = Math.max(baseline, glyph.getYDirAdj());
                height = Math.max(height, glyph.getHeightDir());
            }
            left += offsetX;
            right += offsetX;
            float top = pageTop - baseline + height;
            float bottom = pageTop - baseline - height * DESCENT_RATIO;

            int q = lineIndex * 8;
            quadPoints[q] = left;
            quadPoints[q + 1] = top;
            quadPoints[q + 2] = right;
            quadPoints[q + 3] = top;
            quadPoints[q + 4] = left;
            quadPoints[q + 5] = bottom;
            quadPoints[q + 6] = right;
            quadPoints[q + 7] = bottom;

            regionLeft = Math.min(regionLeft, left);
            regionRight = Math.max(regionRight, right);
            regionTop = Math.max(regionTop, top);
            regionBottom = Math.min(regionBottom, bottom);
        }
        return new TextRegion(pageNumber, matchedText, quadPoints,
            regionLeft, regionBottom, regionRight, regionTop);
    }

    private static boolean startsNewLine(TextPosition previous, TextPosition current) {
        float tolerance = Math.max(previous.getHeightDir(), 1f) / 2;
        return Math.abs(current.getYDirAdj() - previous.getYDirAdj()) > tolerance;
    }

    private void ensureTextLoaded() {
        if (pageText != null) {
            return;
        }
        try {
            GlyphCollector collector = new GlyphCollector();
            collector.setStartPage(pageNumber);
            collector.setEndPage(pageNumber);
            collector.getText(document);
            pageText = collector.text.toString();
            glyphs = collector.glyphs;
        } catch (IOException e) {
            throw new UncheckedIOException("第" + pageNumber + "页文本提取失败", e);
        }
    }

    /**
     * 小写并压缩空白，与页面文本的规范化方式一致
     */
    static String normalize(String text) {
        StringBuilder normalized = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isSpace(c)) {
                if (normalized.length() > 0 && normalized.charAt(normalized.length() - 1) != ' ') {
                    normalized.append(' ');
                }
            } else {
                normalized.append(Character.toLowerCase(c));
            }
        }
        int length = normalized.length();
        if (length > 0 && normalized.charAt(length - 1) == ' ') {
            normalized.setLength(length - 1);
        }
        return normalized.toString();
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * 收集字形，文本与字形列表逐字符对齐，分隔符对应的字形为 null
     */
    private static final class GlyphCollector extends PDFTextStripper {

        private final StringBuilder text = new StringBuilder();
        private final List<TextPosition> glyphs = new ArrayList<>();

        GlyphCollector() throws IOException {
            super();
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String string, List<TextPosition> textPositions) {
            for (TextPosition position : textPositions) {
                String unicode = position.getUnicode();
                if (unicode == null) {
                    continue;
                }
                for (int i = 0; i < unicode.length(); i++) {
                    append(unicode.charAt(i), position);
                }
            }
        }

        @Override
        protected void writeWordSeparator() {
            append(' ', null);
        }

        @Override
        protected void writeLineSeparator() {
            append(' ', null);
        }

        private void append(char c, TextPosition position) {
            if (isSpace(c)) {
                if (text.length() == 0 || text.charAt(text.length() - 1) == ' ') {
                    return;
                }
                text.append(' ');
                glyphs.add(null);
                return;
            }
            text.append(Character.toLowerCase(c));
            glyphs.add(position);
        }
    }
}

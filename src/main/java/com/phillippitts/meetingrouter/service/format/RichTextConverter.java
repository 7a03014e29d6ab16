package com.phillippitts.meetingrouter.service.format;

import com.phillippitts.meetingrouter.domain.RichTextBlock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts light markdown into the comment service's rich-text block list.
 *
 * <p>Rules, applied line by line:
 * <ul>
 *   <li>Backslash-escaped punctuation is unescaped.</li>
 *   <li>A heading marker ({@code #} to {@code ######} plus whitespace) is stripped and the rest of
 *       the line is bold.</li>
 *   <li>{@code [label](http(s)://url)} becomes its own block with a {@code link} attribute, plus
 *       the line's bold attribute if any. Surrounding text becomes plain blocks with the line's
 *       attributes.</li>
 *   <li>A newline block separates lines; none follows the last line.</li>
 *   <li>An empty line, or empty text after the last link, still yields an empty-text block.</li>
 * </ul>
 */
public final class RichTextConverter {

    private static final Pattern ESCAPED = Pattern.compile("\\\\([\\\\`*_{}\\[\\]()#+\\-.!&])");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\((https?://[^\\s)]+)\\)");

    private RichTextConverter() {}

    public static List<RichTextBlock> toBlocks(String markdown) {
        String source = markdown == null ? "" : markdown;
        String[] lines = source.split("\n", -1);
        List<RichTextBlock> blocks = new ArrayList<>();

        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            appendLine(blocks, lines[lineIndex]);
            if (lineIndex < lines.length - 1) {
                blocks.add(RichTextBlock.newline());
            }
        }
        return blocks;
    }

    private static void appendLine(List<RichTextBlock> blocks, String rawLine) {
        String line = unescape(rawLine);
        Map<String, Object> lineAttributes = Map.of();

        Matcher heading = HEADING.matcher(line);
        if (heading.find()) {
            line = line.substring(heading.end());
            lineAttributes = Map.of(RichTextBlock.BOLD, true);
        }

        Matcher link = LINK.matcher(line);
        int lastIndex = 0;
        while (link.find()) {
            if (link.start() > lastIndex) {
                blocks.add(new RichTextBlock(line.substring(lastIndex, link.start()), lineAttributes));
            }
            Map<String, Object> linkAttributes = new LinkedHashMap<>(lineAttributes);
            linkAttributes.put(RichTextBlock.LINK, link.group(2));
            blocks.add(new RichTextBlock(link.group(1), linkAttributes));
            lastIndex = link.end();
        }

        if (lastIndex < line.length() || line.isEmpty()) {
            blocks.add(new RichTextBlock(line.substring(lastIndex), lineAttributes));
        }
    }

    static String unescape(String value) {
        return ESCAPED.matcher(value).replaceAll("$1");
    }
}

package io.docanalytics.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

/**
 * Splits a Markdown document into topics at its level-1 headings.
 * <p>
 * Each topic's content starts at its heading line and runs up to the next level-1 heading.
 * Text before the first heading, or a document without headings, is filed under
 * {@link #NO_TOPIC}. A heading that repeats an earlier one replaces that earlier section.
 * CR and CRLF line endings are read as LF, and topic content is returned with LF endings.
 * Topic names are the heading source with its markers removed, inline markup included.
 * Instances are thread-safe.
 */
public final class TopicExtractor {

    public static final String NO_TOPIC = "(No Topic)";

    private static final Pattern LINE_ENDING = Pattern.compile("\\r\\n?");
    private static final Pattern CLOSING_SEQUENCE = Pattern.compile("(^|[ \\t]+)#+$");

    private final Parser parser = Parser.builder()
        .includeSourceSpans(IncludeSourceSpans.BLOCKS)
        .build();

    public Map<String, String> extract(String content) throws DocumentAnalyticsException {
        if (content == null || content.isBlank()) {
            throw new DocumentAnalyticsException("Invalid document content");
        }
        String normalized = LINE_ENDING.matcher(content).replaceAll("\n");
        List<String> lines = Arrays.asList(normalized.split("\n", -1));
        List<HeadingPosition> headings = findTopLevelHeadings(normalized, lines);
        Map<String, String> topics = new LinkedHashMap<>();

        if (headings.isEmpty()) {
            topics.put(NO_TOPIC, normalized);
            return topics;
        }

        int firstLine = headings.get(0).line();
        if (firstLine > 0) {
            String preamble = String.join("\n", lines.subList(0, firstLine));
            if (!preamble.isBlank()) {
                topics.put(NO_TOPIC, preamble);
            }
        }
        for (int i = 0; i < headings.size(); i++) {
            HeadingPosition heading = headings.get(i);
            int end = i + 1 < headings.size() ? headings.get(i + 1).line() : lines.size();
            topics.put(heading.title(), String.join("\n", lines.subList(heading.line(), end)));
        }
        return topics;
    }

    private List<HeadingPosition> findTopLevelHeadings(String content, List<String> lines) {
        Node document = parser.parse(content);
        List<HeadingPosition> headings = new ArrayList<>();
        document.accept(new AbstractVisitor() {
            @Override
            public void visit(Heading heading) {
                if (heading.getLevel() != 1) {
                    return;
                }
                List<SourceSpan> spans = heading.getSourceSpans();
                if (spans.isEmpty()) {
                    return;
                }
                String title = titleOf(spans, lines);
                if (title.isEmpty()) {
                    title = NO_TOPIC;
                }
                headings.add(new HeadingPosition(spans.get(0).getLineIndex(), title));
            }
        });
        return headings;
    }

    /**
     * Heading source without its markers: an ATX heading spans one line, a setext heading spans
     * its text lines plus the underline.
     */
    private static String titleOf(List<SourceSpan> spans, List<String> lines) {
        if (spans.size() == 1) {
            String line = sourceOf(spans.get(0), lines).strip();
            int pos = 0;
            while (pos < line.length() && line.charAt(pos) == '#') {
                pos++;
            }
            String text = line.substring(pos).strip();
            return CLOSING_SEQUENCE.matcher(text).replaceFirst("").strip();
        }
        List<String> textLines = new ArrayList<>(spans.size() - 1);
        for (SourceSpan span : spans.subList(0, spans.size() - 1)) {
            textLines.add(sourceOf(span, lines));
        }
        return String.join("\n", textLines).strip();
    }

    private static String sourceOf(SourceSpan span, List<String> lines) {
        String line = lines.get(span.getLineIndex());
        int from = Math.min(span.getColumnIndex(), line.length());
        int to = Math.min(from + span.getLength(), line.length());
        return line.substring(from, to);
    }

    private record HeadingPosition(int line, String title) {
    }
}

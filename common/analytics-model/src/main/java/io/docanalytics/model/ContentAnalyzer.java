package io.docanalytics.model;

/**
 * Counts lines, words and characters of a text span.
 * <p>
 * Trailing whitespace is stripped before lines are counted; only empty input has no lines, and
 * whitespace-only input is one empty line. Words are
 * whitespace-delimited tokens. Characters are counted per line in code points; the newline
 * separators themselves are not counted.
 */
public final class ContentAnalyzer {

    private ContentAnalyzer() {
    }

    public static ContentMetrics analyze(String content) {
        if (content == null || content.isEmpty()) {
            return ContentMetrics.ZERO;
        }
        String stripped = stripTrailing(content);
        String[] lines = stripped.split("\n", -1);
        long words = 0;
        long chars = 0;
        for (String line : lines) {
            words += countWords(line);
            chars += line.codePointCount(0, line.length());
        }
        return new ContentMetrics(lines.length, words, chars);
    }

    private static String stripTrailing(String content) {
        int end = content.length();
        while (end > 0) {
            int cp = content.codePointBefore(end);
            if (!isSpace(cp)) {
                break;
            }
            end -= Character.charCount(cp);
        }
        return content.substring(0, end);
    }

    private static boolean isSpace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp);
    }

    static int countWords(String line) {
        int count = 0;
        boolean inWord = false;
        for (int i = 0; i < line.length(); ) {
            int cp = line.codePointAt(i);
            if (isSpace(cp)) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                count++;
            }
            i += Character.charCount(cp);
        }
        return count;
    }
}

package com.machinebridge.core.ast;

import com.machinebridge.core.model.LineAndCharacter;
import com.machinebridge.core.model.LineAndCharacterRange;
import com.machinebridge.core.model.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable parsed representation of one source file.
 *
 * <p>Holds the original text, the machine factory call sites in file order, and the quote
 * character the file prefers for new string literals. Offsets are UTF-16 indices into
 * {@link #text()}.
 */
public final class SourceFile {

    public static final char DOUBLE_QUOTE = '"';
    public static final char SINGLE_QUOTE = '\'';

    private final String fileName;
    private final String text;
    private final List<FactoryCall> factoryCalls;
    private final char preferredQuote;
    private final int[] lineStarts;

    public SourceFile(String fileName, String text, List<FactoryCall> factoryCalls, char preferredQuote) {
        this.fileName = Objects.requireNonNull(fileName, "fileName must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.factoryCalls = factoryCalls != null ? List.copyOf(factoryCalls) : List.of();
        if (preferredQuote != DOUBLE_QUOTE && preferredQuote != SINGLE_QUOTE) {
            throw new IllegalArgumentException("preferredQuote must be a single or double quote");
        }
        this.preferredQuote = preferredQuote;
        this.lineStarts = computeLineStarts(text);
    }

    public String fileName() {
        return fileName;
    }

    public String text() {
        return text;
    }

    /**
     * Machine factory calls in declaration order. The index in this list is the machine index.
     */
    public List<FactoryCall> factoryCalls() {
        return factoryCalls;
    }

    public char preferredQuote() {
        return preferredQuote;
    }

    public String textOf(TextRange range) {
        return text.substring(range.start(), range.end());
    }

    /**
     * Maps a character offset to a zero-based line and column.
     *
     * @param offset offset in {@code [0, text.length()]}
     * @return line and column
     */
    public LineAndCharacter lineAndCharacterOf(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("offset out of bounds: " + offset);
        }
        int line = lineOf(offset);
        return new LineAndCharacter(line, offset - lineStarts[line]);
    }

    public LineAndCharacterRange lineAndCharacterRangeOf(TextRange range) {
        return new LineAndCharacterRange(lineAndCharacterOf(range.start()), lineAndCharacterOf(range.end()));
    }

    /**
     * Returns the leading whitespace of the line containing {@code offset}.
     *
     * @param offset any offset on the line
     * @return indentation text, possibly empty
     */
    public String lineIndentAt(int offset) {
        int start = lineStarts[lineOf(offset)];
        int end = start;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(start, end);
    }

    /**
     * Returns true if both offsets lie on the same line.
     */
    public boolean sameLine(int first, int second) {
        return lineOf(first) == lineOf(second);
    }

    private int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (ch == '\n' || ch == '\u2028' || ch == '\u2029') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "SourceFile{" +
            "fileName='" + fileName + '\'' +
            ", length=" + text.length() +
            ", factoryCalls=" + factoryCalls.size() +
            '}';
    }
}

package com.machinebridge.core.ast.javascript;

import com.machinebridge.parser.JsLexer;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the ANTLR {@link JsLexer} over a source text and keeps the default-channel tokens.
 *
 * <p>ANTLR indexes characters by code point while the rest of the project works with UTF-16
 * offsets, so token positions are translated when the text contains supplementary characters.
 */
final class JsTokenizer {

    private JsTokenizer() {
        // Utility class - no instantiation
    }

    static List<JsToken> tokenize(String text) {
        JsLexer lexer = new JsLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();

        int[] offsets = codePointOffsets(text);
        List<JsToken> tokens = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL || token.getType() == Token.EOF) {
                continue;
            }
            int start = toUtf16(offsets, token.getStartIndex());
            int end = toUtf16(offsets, token.getStopIndex() + 1);
            tokens.add(new JsToken(token.getType(), start, end, text.substring(start, end)));
        }
        return tokens;
    }

    /**
     * Returns the UTF-16 offset of every code point index, or {@code null} when both coincide.
     */
    private static int[] codePointOffsets(String text) {
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints == text.length()) {
            return null;
        }
        int[] offsets = new int[codePoints + 1];
        int utf16 = 0;
        for (int i = 0; i < codePoints; i++) {
            offsets[i] = utf16;
            utf16 += Character.charCount(text.codePointAt(utf16));
        }
        offsets[codePoints] = utf16;
        return offsets;
    }

    private static int toUtf16(int[] offsets, int codePointIndex) {
        return offsets == null ? codePointIndex : offsets[codePointIndex];
    }
}

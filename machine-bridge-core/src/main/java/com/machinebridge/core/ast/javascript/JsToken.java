package com.machinebridge.core.ast.javascript;

/**
 * A default-channel token produced by {@link com.machinebridge.parser.JsLexer}.
 *
 * @param type token type constant from {@code JsLexer}
 * @param start UTF-16 start offset (inclusive)
 * @param end UTF-16 end offset (exclusive)
 * @param text token text
 */
record JsToken(int type, int start, int end, String text) {

    boolean is(int tokenType, String tokenText) {
        return type == tokenType && text.equals(tokenText);
    }
}

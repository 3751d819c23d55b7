package com.machinebridge.core.codechange;

import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.model.TextRange;

import java.util.List;

/**
 * The bracketed, comma-separated layout shared by object and array literals.
 *
 * @param range range from the opening to the closing bracket (inclusive)
 * @param items ranges of the members or elements
 * @param commas offset of the comma following each item, or -1
 * @param padded whether single-line content is padded with spaces, as in {@code { a: 1 }}
 */
record LiteralList(TextRange range, List<TextRange> items, List<Integer> commas, boolean padded) {

    static LiteralList of(JsAst.ObjectLiteral object) {
        List<TextRange> items = object.members().stream().map(JsAst.Member::range).toList();
        return new LiteralList(object.range(), items, object.commaOffsets(), true);
    }

    static LiteralList of(JsAst.ArrayLiteral array) {
        List<TextRange> items = array.elements().stream().map(JsAst.Expression::range).toList();
        return new LiteralList(array.range(), items, array.commaOffsets(), false);
    }

    TextRange inner() {
        return new TextRange(range.start() + 1, range.end() - 1);
    }

    int size() {
        return items.size();
    }
}

package com.machinebridge.core.ast.javascript;

import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.model.TextRange;
import com.machinebridge.parser.JsLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent reader that turns a token window into {@link JsAst} literal trees.
 *
 * <p>Object literals, array literals, primitive literals, identifiers and function expressions
 * are modelled. Any other expression is consumed up to the next separator at bracket depth zero
 * and returned as an {@link JsAst.OpaqueExpression}, so malformed or unfamiliar code never stops
 * the reader.
 */
final class LiteralReader {

    private static final Set<String> TYPE_OPERATORS = Set.of("as", "satisfies");

    private final String text;
    private final List<JsToken> tokens;
    private int pos;

    LiteralReader(String text, List<JsToken> tokens, int pos) {
        this.text = text;
        this.tokens = tokens;
        this.pos = pos;
    }

    int position() {
        return pos;
    }

    boolean at(int type) {
        return pos < tokens.size() && tokens.get(pos).type() == type;
    }

    void advance() {
        pos++;
    }

    /**
     * Reads one expression, stopping before the separator that ends it.
     */
    JsAst.Expression readExpression() {
        int startPos = pos;
        JsAst.Expression primary = readPrimary();
        if (primary != null) {
            if (atTerminator()) {
                return primary;
            }
            if (pos < tokens.size()
                && tokens.get(pos).type() == JsLexer.Identifier
                && TYPE_OPERATORS.contains(tokens.get(pos).text())) {
                skipToTerminator();
                return primary;
            }
        }
        skipToTerminator();
        return opaque(startPos);
    }

    private JsAst.Expression readPrimary() {
        if (pos >= tokens.size()) {
            return null;
        }
        JsToken token = tokens.get(pos);
        TextRange range = new TextRange(token.start(), token.end());
        switch (token.type()) {
            case JsLexer.OpenBrace:
                return readObject();
            case JsLexer.OpenBracket:
                return readArray();
            case JsLexer.StringLiteral:
                pos++;
                return stringLiteral(token);
            case JsLexer.TemplateStringLiteral: {
                String body = token.text().substring(1, token.text().length() - 1);
                if (JsStrings.hasSubstitution(body)) {
                    return null;
                }
                pos++;
                return new JsAst.TemplateLiteral(range, JsStrings.decodeTemplate(body));
            }
            case JsLexer.NumericLiteral:
                pos++;
                return new JsAst.NumericLiteral(range, token.text());
            case JsLexer.OpenParen:
                return tryReadArrowFunction(pos);
            case JsLexer.Identifier:
                return readIdentifierExpression(token, range);
            default:
                return null;
        }
    }

    private JsAst.Expression readIdentifierExpression(JsToken token, TextRange range) {
        switch (token.text()) {
            case "true":
                pos++;
                return new JsAst.BooleanLiteral(range, true);
            case "false":
                pos++;
                return new JsAst.BooleanLiteral(range, false);
            case "null":
                pos++;
                return new JsAst.NullLiteral(range);
            case "function":
                return readFunction(pos);
            case "async":
                if (peekIs(1, JsLexer.Identifier, "function")) {
                    return readFunction(pos);
                }
                if (peekType(1) == JsLexer.OpenParen) {
                    return tryReadArrowFunction(pos);
                }
                if (peekType(1) == JsLexer.Identifier && peekType(2) == JsLexer.Arrow) {
                    return readArrowBody(pos, pos + 3);
                }
                break;
            default:
                break;
        }
        if (peekType(1) == JsLexer.Arrow) {
            return readArrowBody(pos, pos + 2);
        }
        pos++;
        return new JsAst.Identifier(range, token.text());
    }

    private JsAst.Expression readFunction(int startPos) {
        while (pos < tokens.size() && tokens.get(pos).type() != JsLexer.OpenParen) {
            pos++;
        }
        skipBalanced();
        while (pos < tokens.size() && tokens.get(pos).type() != JsLexer.OpenBrace) {
            if (atTerminator()) {
                return null;
            }
            pos++;
        }
        skipBalanced();
        return function(startPos, false);
    }

    /**
     * Reads {@code (params) => body} or {@code async (params) => body}; returns null and leaves
     * the position untouched when the parenthesis does not start an arrow function.
     */
    private JsAst.Expression tryReadArrowFunction(int startPos) {
        int saved = pos;
        if (tokens.get(pos).type() != JsLexer.OpenParen) {
            pos++;
        }
        skipBalanced();
        if (at(JsLexer.Colon)) {
            // return type annotation
            while (pos < tokens.size() && !at(JsLexer.Arrow) && !atTerminator()) {
                if (isOpener(tokens.get(pos).type())) {
                    skipBalanced();
                } else {
                    pos++;
                }
            }
        }
        if (!at(JsLexer.Arrow)) {
            pos = saved;
            return null;
        }
        return readArrowBody(startPos, pos + 1);
    }

    private JsAst.Expression readArrowBody(int startPos, int bodyPos) {
        pos = bodyPos;
        if (at(JsLexer.OpenBrace)) {
            skipBalanced();
        } else {
            skipToTerminator();
        }
        return function(startPos, true);
    }

    private JsAst.FunctionExpression function(int startPos, boolean arrow) {
        TextRange range = rangeFrom(startPos);
        return new JsAst.FunctionExpression(range, arrow, text.substring(range.start(), range.end()));
    }

    private JsAst.ObjectLiteral readObject() {
        int open = pos;
        pos++;
        List<JsAst.Member> members = new ArrayList<>();
        List<Integer> commas = new ArrayList<>();
        while (pos < tokens.size() && !at(JsLexer.CloseBrace)) {
            int type = tokens.get(pos).type();
            if (type == JsLexer.Comma || type == JsLexer.CloseParen
                || type == JsLexer.CloseBracket || type == JsLexer.SemiColon) {
                pos++;
                continue;
            }
            JsAst.Member member = readMember();
            if (!at(JsLexer.Comma) && !at(JsLexer.CloseBrace)) {
                skipToTerminator();
            }
            members.add(member);
            if (at(JsLexer.Comma)) {
                commas.add(tokens.get(pos).start());
                pos++;
            } else {
                commas.add(-1);
            }
        }
        int end = closeAt(JsLexer.CloseBrace);
        return new JsAst.ObjectLiteral(new TextRange(tokens.get(open).start(), end), members, commas);
    }

    private JsAst.Member readMember() {
        int startPos = pos;
        JsToken token = tokens.get(pos);

        if (token.type() == JsLexer.Ellipsis) {
            pos++;
            JsAst.Expression expression = readExpression();
            return new JsAst.SpreadAssignment(rangeFrom(startPos), expression);
        }

        JsAst.MethodKind accessor = null;
        if (token.type() == JsLexer.Identifier && isNameStart(peekType(1))) {
            accessor = switch (token.text()) {
                case "get" -> JsAst.MethodKind.GET;
                case "set" -> JsAst.MethodKind.SET;
                case "async" -> JsAst.MethodKind.METHOD;
                default -> null;
            };
        }
        if (accessor == null && token.is(JsLexer.Identifier, "async") && peekType(1) == JsLexer.Star) {
            accessor = JsAst.MethodKind.METHOD;
        }
        if (accessor != null || token.type() == JsLexer.Star) {
            pos++;
            if (at(JsLexer.Star)) {
                pos++;
            }
            JsAst.PropertyName name = readPropertyName();
            skipMethodRest();
            return new JsAst.MethodMember(rangeFrom(startPos), accessor != null ? accessor : JsAst.MethodKind.METHOD, name);
        }

        JsAst.PropertyName name = readPropertyName();
        if (name == null) {
            skipToTerminator();
            return new JsAst.ShorthandProperty(rangeFrom(startPos), textFrom(startPos));
        }
        if (at(JsLexer.QuestionMark)) {
            pos++;
        }
        if (at(JsLexer.Colon)) {
            pos++;
            JsAst.Expression value = readExpression();
            return new JsAst.PropertyAssignment(
                new TextRange(token.start(), Math.max(value.range().end(), tokens.get(pos - 1).end())), name, value);
        }
        if (at(JsLexer.OpenParen) || at(JsLexer.LessThan)) {
            skipMethodRest();
            return new JsAst.MethodMember(rangeFrom(startPos), JsAst.MethodKind.METHOD, name);
        }
        if (at(JsLexer.Comma) || at(JsLexer.CloseBrace)) {
            return new JsAst.ShorthandProperty(rangeFrom(startPos), textFrom(startPos));
        }
        // shorthand with default value, or anything else
        skipToTerminator();
        return new JsAst.ShorthandProperty(rangeFrom(startPos), textFrom(startPos));
    }

    private JsAst.PropertyName readPropertyName() {
        if (pos >= tokens.size()) {
            return null;
        }
        JsToken token = tokens.get(pos);
        TextRange range = new TextRange(token.start(), token.end());
        switch (token.type()) {
            case JsLexer.Identifier:
                pos++;
                return new JsAst.Identifier(range, token.text());
            case JsLexer.StringLiteral:
                pos++;
                return stringLiteral(token);
            case JsLexer.NumericLiteral:
                pos++;
                return new JsAst.NumericLiteral(range, token.text());
            case JsLexer.PrivateIdentifier:
                pos++;
                return new JsAst.PrivateName(range, token.text().substring(1));
            case JsLexer.OpenBracket: {
                int startPos = pos;
                pos++;
                JsAst.Expression expression = readExpression();
                closeAt(JsLexer.CloseBracket);
                return new JsAst.ComputedPropertyName(rangeFrom(startPos), expression);
            }
            default:
                return null;
        }
    }

    private JsAst.ArrayLiteral readArray() {
        int open = pos;
        pos++;
        List<JsAst.Expression> elements = new ArrayList<>();
        List<Integer> commas = new ArrayList<>();
        while (pos < tokens.size() && !at(JsLexer.CloseBracket)) {
            int type = tokens.get(pos).type();
            if (type == JsLexer.CloseParen || type == JsLexer.CloseBrace || type == JsLexer.SemiColon) {
                pos++;
                continue;
            }
            if (type == JsLexer.Comma) {
                // hole
                elements.add(new JsAst.OpaqueExpression(TextRange.at(tokens.get(pos).start()), ""));
                commas.add(tokens.get(pos).start());
                pos++;
                continue;
            }
            elements.add(readExpression());
            if (at(JsLexer.Comma)) {
                commas.add(tokens.get(pos).start());
                pos++;
            } else {
                commas.add(-1);
            }
        }
        int end = closeAt(JsLexer.CloseBracket);
        return new JsAst.ArrayLiteral(new TextRange(tokens.get(open).start(), end), elements, commas);
    }

    private void skipMethodRest() {
        if (at(JsLexer.LessThan)) {
            int depth = 0;
            while (pos < tokens.size()) {
                int type = tokens.get(pos).type();
                pos++;
                if (type == JsLexer.LessThan) {
                    depth++;
                } else if (type == JsLexer.MoreThan && --depth == 0) {
                    break;
                }
            }
        }
        if (at(JsLexer.OpenParen)) {
            skipBalanced();
        }
        while (pos < tokens.size() && !at(JsLexer.OpenBrace)) {
            if (atTerminator()) {
                return;
            }
            pos++;
        }
        skipBalanced();
    }

    /**
     * Consumes tokens up to the next separator at bracket depth zero.
     */
    void skipToTerminator() {
        while (pos < tokens.size() && !atTerminator()) {
            if (isOpener(tokens.get(pos).type())) {
                skipBalanced();
            } else {
                pos++;
            }
        }
    }

    /**
     * Consumes a bracketed group starting at the current opener.
     */
    private void skipBalanced() {
        int depth = 0;
        while (pos < tokens.size()) {
            int type = tokens.get(pos).type();
            pos++;
            if (isOpener(type)) {
                depth++;
            } else if (isCloser(type)) {
                depth--;
            }
            if (depth <= 0) {
                return;
            }
        }
    }

    private boolean atTerminator() {
        if (pos >= tokens.size()) {
            return true;
        }
        int type = tokens.get(pos).type();
        return type == JsLexer.Comma || type == JsLexer.SemiColon || isCloser(type);
    }

    /**
     * Consumes the expected closer and returns its end offset, or the end of the last consumed
     * token when the group is unterminated.
     */
    private int closeAt(int closer) {
        if (at(closer)) {
            int end = tokens.get(pos).end();
            pos++;
            return end;
        }
        return pos > 0 ? tokens.get(Math.min(pos, tokens.size()) - 1).end() : text.length();
    }

    private JsAst.StringLiteral stringLiteral(JsToken token) {
        String raw = token.text();
        return new JsAst.StringLiteral(
            new TextRange(token.start(), token.end()),
            JsStrings.decode(raw.substring(1, raw.length() - 1)),
            raw.charAt(0));
    }

    private JsAst.OpaqueExpression opaque(int startPos) {
        if (pos == startPos) {
            int offset = startPos < tokens.size() ? tokens.get(startPos).start() : text.length();
            return new JsAst.OpaqueExpression(TextRange.at(offset), "");
        }
        TextRange range = rangeFrom(startPos);
        return new JsAst.OpaqueExpression(range, text.substring(range.start(), range.end()));
    }

    private TextRange rangeFrom(int startPos) {
        int start = tokens.get(startPos).start();
        int end = pos > startPos ? tokens.get(pos - 1).end() : start;
        return new TextRange(start, end);
    }

    private String textFrom(int startPos) {
        TextRange range = rangeFrom(startPos);
        return text.substring(range.start(), range.end());
    }

    private int peekType(int offset) {
        int index = pos + offset;
        return index < tokens.size() ? tokens.get(index).type() : -1;
    }

    private boolean peekIs(int offset, int type, String tokenText) {
        int index = pos + offset;
        return index < tokens.size() && tokens.get(index).is(type, tokenText);
    }

    private static boolean isNameStart(int type) {
        return type == JsLexer.Identifier || type == JsLexer.StringLiteral || type == JsLexer.NumericLiteral
            || type == JsLexer.OpenBracket || type == JsLexer.PrivateIdentifier;
    }

    private static boolean isOpener(int type) {
        return type == JsLexer.OpenBrace || type == JsLexer.OpenBracket || type == JsLexer.OpenParen;
    }

    private static boolean isCloser(int type) {
        return type == JsLexer.CloseBrace || type == JsLexer.CloseBracket || type == JsLexer.CloseParen;
    }
}

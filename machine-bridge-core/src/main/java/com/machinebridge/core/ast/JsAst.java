package com.machinebridge.core.ast;

import com.machinebridge.core.model.TextRange;

import java.util.List;
import java.util.Objects;

/**
 * Literal-tree node types for JavaScript and TypeScript source code.
 *
 * <p>These records model the subset of expression syntax a machine configuration is written in:
 * object and array literals, string/number/boolean/null literals, identifiers and function
 * expressions. Every other expression is kept as an {@link OpaqueExpression} so that its source
 * text and range survive without being interpreted.
 *
 * <p>All ranges are UTF-16 offsets into {@link SourceFile#text()}.
 *
 * @see com.machinebridge.core.ast.javascript.JavaScriptSourceParser
 */
public final class JsAst {

    private JsAst() {
        // Utility class - no instantiation
    }

    /**
     * Any expression node.
     */
    public interface Expression {
        TextRange range();
    }

    /**
     * The name part of a property assignment.
     */
    public interface PropertyName {
        TextRange range();
    }

    /**
     * A member of an object literal.
     */
    public interface Member {
        TextRange range();
    }

    /**
     * Expressions whose value is a plain string ({@code "a"}, {@code 'a'}, {@code `a`}).
     */
    public interface StringLike extends Expression {
        String value();
    }

    /**
     * Object literal such as {@code { a: 1, b }}.
     *
     * @param range range from the opening to the closing brace (inclusive)
     * @param members members in declaration order
     * @param commaOffsets offset of the comma following each member, or -1 when none follows
     */
    public record ObjectLiteral(TextRange range, List<Member> members, List<Integer> commaOffsets) implements Expression {
        public ObjectLiteral {
            Objects.requireNonNull(range, "range must not be null");
            members = members != null ? List.copyOf(members) : List.of();
            commaOffsets = commaOffsets != null ? List.copyOf(commaOffsets) : List.of();
            if (commaOffsets.size() != members.size()) {
                throw new IllegalArgumentException("commaOffsets must align with members");
            }
        }

        /**
         * Offset just after the opening brace.
         */
        public int innerStart() {
            return range.start() + 1;
        }

        /**
         * Offset of the closing brace.
         */
        public int innerEnd() {
            return range.end() - 1;
        }

        public boolean hasTrailingComma() {
            return !members.isEmpty() && commaOffsets.get(members.size() - 1) >= 0;
        }
    }

    /**
     * Array literal such as {@code ['a', 'b']}. Holes are represented by {@link OpaqueExpression}s
     * with an empty range.
     *
     * @param range range from the opening to the closing bracket (inclusive)
     * @param elements elements in order
     * @param commaOffsets offset of the comma following each element, or -1 when none follows
     */
    public record ArrayLiteral(TextRange range, List<Expression> elements, List<Integer> commaOffsets) implements Expression {
        public ArrayLiteral {
            Objects.requireNonNull(range, "range must not be null");
            elements = elements != null ? List.copyOf(elements) : List.of();
            commaOffsets = commaOffsets != null ? List.copyOf(commaOffsets) : List.of();
            if (commaOffsets.size() != elements.size()) {
                throw new IllegalArgumentException("commaOffsets must align with elements");
            }
        }

        public int innerStart() {
            return range.start() + 1;
        }

        public int innerEnd() {
            return range.end() - 1;
        }

        public boolean hasTrailingComma() {
            return !elements.isEmpty() && commaOffsets.get(elements.size() - 1) >= 0;
        }
    }

    /**
     * Quoted string literal.
     *
     * @param range literal range including quotes
     * @param value decoded value
     * @param quote quote character used in source
     */
    public record StringLiteral(TextRange range, String value, char quote) implements StringLike, PropertyName {
    }

    /**
     * Template literal. Only templates without {@code ${}} substitutions carry a value; others are
     * kept as {@link OpaqueExpression}.
     *
     * @param range literal range including backticks
     * @param value cooked value
     */
    public record TemplateLiteral(TextRange range, String value) implements StringLike {
    }

    /**
     * Numeric literal, kept as written.
     *
     * @param range literal range
     * @param raw source text, e.g. {@code 0x10} or {@code 1_000}
     */
    public record NumericLiteral(TextRange range, String raw) implements Expression, PropertyName {
    }

    /**
     * {@code true} or {@code false}.
     */
    public record BooleanLiteral(TextRange range, boolean value) implements Expression {
    }

    /**
     * {@code null}.
     */
    public record NullLiteral(TextRange range) implements Expression {
    }

    /**
     * Bare identifier, either as an expression ({@code undefined}, {@code someVar}) or as a
     * property name.
     */
    public record Identifier(TextRange range, String name) implements Expression, PropertyName {

        public boolean isUndefined() {
            return "undefined".equals(name);
        }
    }

    /**
     * Function expression or arrow function.
     *
     * @param range whole function range
     * @param arrow true for arrow functions
     * @param text source text of the function
     */
    public record FunctionExpression(TextRange range, boolean arrow, String text) implements Expression {
    }

    /**
     * Any expression the literal reader does not model (calls, member access, operators, ...).
     *
     * @param range expression range
     * @param text source text
     */
    public record OpaqueExpression(TextRange range, String text) implements Expression {
    }

    /**
     * Computed property name {@code [expression]}.
     */
    public record ComputedPropertyName(TextRange range, Expression expression) implements PropertyName {
    }

    /**
     * Private name {@code #name}.
     */
    public record PrivateName(TextRange range, String name) implements PropertyName {
    }

    /**
     * {@code name: value}.
     *
     * @param range member range from name start to value end
     * @param name property name
     * @param value initializer
     */
    public record PropertyAssignment(TextRange range, PropertyName name, Expression value) implements Member {
        public PropertyAssignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * Shorthand member {@code { name }}.
     */
    public record ShorthandProperty(TextRange range, String name) implements Member {
    }

    /**
     * Spread member {@code { ...other }}.
     */
    public record SpreadAssignment(TextRange range, Expression expression) implements Member {
    }

    /**
     * Method, getter or setter member.
     *
     * @param range member range
     * @param kind member kind
     * @param name member name
     */
    public record MethodMember(TextRange range, MethodKind kind, PropertyName name) implements Member {
    }

    /**
     * Kind of a {@link MethodMember}.
     */
    public enum MethodKind {
        METHOD,
        GET,
        SET
    }
}

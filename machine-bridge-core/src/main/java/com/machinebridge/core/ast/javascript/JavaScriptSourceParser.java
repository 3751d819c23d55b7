package com.machinebridge.core.ast.javascript;

import com.machinebridge.core.ast.FactoryCall;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.ast.SourceParser;
import com.machinebridge.core.model.TextRange;
import com.machinebridge.parser.JsLexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link SourceParser} for JavaScript and TypeScript files.
 *
 * <p>The source is tokenized with the ANTLR-generated {@link JsLexer}. Factory call sites are
 * located on the token stream and their arguments are read into {@link JsAst} trees by a
 * recursive-descent {@link LiteralReader}. The parser never fails on unfamiliar syntax: whatever
 * it does not model is kept as an opaque expression.
 *
 * <p><b>Recognised call shapes:</b>
 * <ul>
 *   <li>{@code createMachine({...})}</li>
 *   <li>{@code xstate.createMachine({...})} and optional-chained variants</li>
 *   <li>{@code createMachine<Context, Events>({...})}</li>
 * </ul>
 * Function declarations ({@code function createMachine(...)}) and method declarations
 * ({@code createMachine(config) {...}}) with a factory name are not call sites.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceFile file = new JavaScriptSourceParser().parse("machine.ts", text);
 * for (FactoryCall call : file.factoryCalls()) {
 *     call.config().ifPresent(config -> ...);
 * }
 * }</pre>
 */
public class JavaScriptSourceParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(JavaScriptSourceParser.class);

    private static final String PARSER_ID = "javascript";
    private static final Set<String> EXTENSIONS = Set.of("js", "jsx", "mjs", "cjs", "ts", "tsx", "mts", "cts");

    @Override
    public String getId() {
        return PARSER_ID;
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public SourceFile parse(String fileName, String text, Set<String> factoryNames) {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(factoryNames, "factoryNames must not be null");

        List<JsToken> tokens = JsTokenizer.tokenize(text);
        List<FactoryCall> calls = locateFactoryCalls(text, tokens, factoryNames);
        char quote = preferredQuote(tokens);

        log.debug("Parsed {}: {} tokens, {} factory call(s), preferred quote {}",
            fileName, tokens.size(), calls.size(), quote);
        return new SourceFile(fileName, text, calls, quote);
    }

    private List<FactoryCall> locateFactoryCalls(String text, List<JsToken> tokens, Set<String> factoryNames) {
        List<FactoryCall> calls = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            JsToken token = tokens.get(i);
            if (token.type() != JsLexer.Identifier || !factoryNames.contains(token.text())) {
                continue;
            }
            if (i > 0 && tokens.get(i - 1).is(JsLexer.Identifier, "function")) {
                continue;
            }
            int open = skipTypeArguments(tokens, i + 1);
            if (open < 0 || open >= tokens.size() || tokens.get(open).type() != JsLexer.OpenParen) {
                continue;
            }

            LiteralReader reader = new LiteralReader(text, tokens, open + 1);
            List<JsAst.Expression> arguments = new ArrayList<>();
            while (!reader.at(JsLexer.CloseParen) && reader.position() < tokens.size()) {
                if (reader.at(JsLexer.Comma)) {
                    reader.advance();
                    continue;
                }
                int before = reader.position();
                arguments.add(reader.readExpression());
                if (reader.position() == before) {
                    // stray closer
                    reader.advance();
                }
            }
            if (!reader.at(JsLexer.CloseParen)) {
                log.debug("Unterminated call to {} at offset {}", token.text(), token.start());
                continue;
            }
            int close = reader.position();
            if (close + 1 < tokens.size() && tokens.get(close + 1).type() == JsLexer.OpenBrace) {
                // method declaration
                continue;
            }

            int start = calleeStart(tokens, i);
            calls.add(new FactoryCall(new TextRange(start, tokens.get(close).end()), token.text(), arguments));
        }
        return calls;
    }

    /**
     * Returns the index after optional {@code <...>} type arguments, or -1 if they do not close.
     */
    private static int skipTypeArguments(List<JsToken> tokens, int index) {
        if (index >= tokens.size() || tokens.get(index).type() != JsLexer.LessThan) {
            return index;
        }
        int depth = 0;
        for (int j = index; j < tokens.size(); j++) {
            int type = tokens.get(j).type();
            if (type == JsLexer.LessThan) {
                depth++;
            } else if (type == JsLexer.MoreThan) {
                depth--;
                if (depth == 0) {
                    return j + 1;
                }
            } else if (type == JsLexer.SemiColon) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Walks back over an {@code a.b.} or {@code a?.b?.} receiver chain.
     */
    private static int calleeStart(List<JsToken> tokens, int nameIndex) {
        int start = tokens.get(nameIndex).start();
        int j = nameIndex - 1;
        while (j >= 1) {
            int type = tokens.get(j).type();
            if ((type != JsLexer.Dot && type != JsLexer.QuestionDot)
                || tokens.get(j - 1).type() != JsLexer.Identifier) {
                break;
            }
            start = tokens.get(j - 1).start();
            j -= 2;
        }
        return start;
    }

    /**
     * Quote character of the first import/export module specifier, double quote by default.
     */
    private static char preferredQuote(List<JsToken> tokens) {
        for (int i = 1; i < tokens.size(); i++) {
            JsToken token = tokens.get(i);
            if (token.type() != JsLexer.StringLiteral) {
                continue;
            }
            JsToken previous = tokens.get(i - 1);
            boolean specifier = previous.is(JsLexer.Identifier, "from")
                || (previous.is(JsLexer.Identifier, "import") && (i < 2 || tokens.get(i - 2).type() != JsLexer.Dot));
            if (specifier) {
                return token.text().charAt(0);
            }
        }
        return SourceFile.DOUBLE_QUOTE;
    }
}

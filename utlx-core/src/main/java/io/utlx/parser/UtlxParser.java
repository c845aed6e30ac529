/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.utlx.parser;

import io.utlx.common.Config;
import io.utlx.common.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static io.utlx.parser.TokenType.*;

/**
 * Recursive descent parser for scripts. Parsing runs in three phases, header,
 * separator and content, and every diagnostic is tagged with the phase it was
 * found in. Malformed elements of object, array and argument lists are reported
 * once, replaced by {@link Expr.Errored} and skipped, so that independent
 * mistakes further on are still found. A parser instance is used once.
 */
public class UtlxParser extends BaseParser {

    static final Logger logger = LoggerFactory.getLogger(UtlxParser.class);

    // binding levels, lower binds tighter, see BinaryOperator for 3 to 10
    static final int CONDITIONAL = 11;
    static final int PIPE = 12;

    private static final TokenType[] LIST_RECOVERY = {COMMA, R_CURLY, R_BRACKET, R_PAREN, SEPARATOR, LET, FUNCTION, IF};
    private static final TokenType[] HEADER_VALUES = {IDENT, NUMBER, STRING};

    private final List<Diagnostic> lexErrors;
    private final String source;

    private int depth;

    public UtlxParser(Resource resource, Config config) {
        this(new UtlxLexer(resource), config);
    }

    private UtlxParser(UtlxLexer lexer, Config config) {
        super(lexer.resource, BaseLexer.tokenize(lexer), config);
        this.lexErrors = lexer.getErrors();
        this.source = resource.getText();
    }

    public static ParseResult parse(String text, Config config) {
        return new UtlxParser(Resource.text(text), config).parse();
    }

    public ParseResult parse() {
        long start = System.currentTimeMillis();
        Program program;
        try {
            for (Diagnostic lexError : lexErrors) {
                report(lexError);
            }
            List<Directive> directives = header();
            separator();
            Expr content = content();
            program = new Program(directives, content);
        } catch (ParserException e) {
            logger.debug("parse aborted: {}", e.getMessage());
            return new ParseResult.Aborted(getDiagnostics());
        }
        if (logger.isDebugEnabled()) {
            logger.debug("parsed {} tokens in {} ms, errors: {}", tokens.size(),
                    System.currentTimeMillis() - start, getErrorCount());
        }
        if (getErrorCount() == 0) {
            return new ParseResult.Success(program, getDiagnostics());
        }
        return new ParseResult.Partial(program, getDiagnostics());
    }

    // ========== Header ==========

    private List<Directive> header() {
        section = ScriptSection.HEADER;
        List<Directive> directives = new ArrayList<>();
        Token first = peekToken();
        boolean versionSeen = false;
        while (true) {
            Token token = peekToken();
            Directive directive;
            if (token.type == SEPARATOR || token.type == EOF) {
                break;
            } else if (token.type == DIRECTIVE) {
                directive = versionDirective(versionSeen);
                versionSeen = versionSeen || directive != null;
            } else if (token.type == INPUT || token.type == OUTPUT) {
                Token arg = peekToken(1);
                if (onSameLine(token, arg) && !peekAnyOf(arg, HEADER_VALUES)) {
                    break; // something like input.name, content has started
                }
                directive = formatDirective();
            } else if (token.type == SCHEMA) {
                directive = schemaDirective();
            } else if (token.type == IDENT && onSameLine(token, peekToken(1)) && peekAnyOf(peekToken(1), HEADER_VALUES)) {
                error("unknown directive '" + token.text + "'");
                skipLine(token);
                continue;
            } else {
                break;
            }
            if (directive != null) {
                directives.add(directive);
            }
        }
        if (!versionSeen) {
            warning(first, "missing '%utlx' version directive");
        }
        return directives;
    }

    private Directive versionDirective(boolean versionSeen) {
        Token token = next();
        String name = token.text.substring(1);
        if (!Directive.UTLX.equals(name)) {
            error(token, "unknown directive '" + token.text + "'");
            skipLine(token);
            return null;
        }
        if (versionSeen) {
            error(token, "duplicate '%utlx' directive");
            skipLine(token);
            return null;
        }
        Token version = peekToken();
        if (!onSameLine(token, version) || version.type != NUMBER) {
            error(token, "expected version after '%utlx'");
            skipLine(token);
            return null;
        }
        return new Directive(name, restOfLine(token), token.getLocation());
    }

    private Directive formatDirective() {
        Token token = next();
        Token format = peekToken();
        if (!onSameLine(token, format)) {
            error(token, "expected format after '" + token.text + "'");
            return null;
        }
        return new Directive(token.text, restOfLine(token), token.getLocation());
    }

    private Directive schemaDirective() {
        Token token = next();
        int mark = position();
        boolean typeFound = false;
        boolean pathFound = false;
        while (onSameLine(token, peekToken()) && peek() != EOF) {
            Token current = next();
            if (current.type == IDENT && "type".equals(current.text) && peekIf(COLON)
                    && onSameLine(token, peekToken(1)) && peekToken(1).type == IDENT) {
                typeFound = true;
                break;
            }
            pathFound = true;
        }
        rewind(mark);
        if (!pathFound || !typeFound) {
            error(token, "expected '<path> type:<format>' after 'schema'");
            skipLine(token);
            return null;
        }
        return new Directive(token.text, restOfLine(token), token.getLocation());
    }

    /**
     * Consumes the tokens after the directive name on its line and returns their source text.
     */
    private String restOfLine(Token name) {
        Token first = null;
        Token last = null;
        while (onSameLine(name, peekToken()) && peek() != EOF && peek() != SEPARATOR) {
            last = next();
            if (first == null) {
                first = last;
            }
        }
        if (first == null) {
            return "";
        }
        return source.substring(first.pos, last.pos + last.text.length());
    }

    private void skipLine(Token token) {
        while (onSameLine(token, peekToken()) && peek() != EOF && peek() != SEPARATOR) {
            next();
        }
    }

    private static boolean onSameLine(Token a, Token b) {
        return a.line == b.line && b.type != EOF;
    }

    private static boolean peekAnyOf(Token token, TokenType[] types) {
        for (TokenType type : types) {
            if (token.type == type) {
                return true;
            }
        }
        return false;
    }

    // ========== Separator ==========

    private void separator() {
        if (peekIf(SEPARATOR)) {
            next();
            section = ScriptSection.CONTENT;
            return;
        }
        error("expected '---' separator");
        int mark = position();
        while (peek() != EOF && peek() != SEPARATOR) {
            next();
        }
        if (peekIf(SEPARATOR)) {
            next();
        } else {
            // no separator anywhere, treat what follows the header as content
            rewind(mark);
        }
        section = ScriptSection.CONTENT;
    }

    // ========== Content ==========

    private Expr content() {
        section = ScriptSection.CONTENT;
        if (peekIf(EOF)) {
            Token token = peekToken();
            error("expected expression but found end of input");
            return new Expr.Errored("", token.getLocation());
        }
        Expr expr = expr(PIPE);
        if (!peekIf(EOF)) {
            Token token = peekToken();
            if (token.type == SEPARATOR) {
                section = ScriptSection.SEPARATOR;
                error("unexpected second '---' separator");
                section = ScriptSection.CONTENT;
            } else {
                error("unexpected " + describe(token) + " after expression");
            }
            while (!peekIf(EOF)) {
                next();
            }
        }
        return expr;
    }

    Expr expr(int level) {
        if (++depth > config.getMaxDepth()) {
            abort(DiagnosticCode.RESOURCE_EXHAUSTED, "expression nesting deeper than " + config.getMaxDepth());
        }
        try {
            Expr lhs = unary();
            while (true) {
                Token token = peekToken();
                if (token.type == QUES && level >= CONDITIONAL) {
                    next();
                    Expr then = expr(CONDITIONAL);
                    Expr otherwise;
                    if (consumeSoft(COLON, ":")) {
                        otherwise = expr(CONDITIONAL);
                    } else {
                        otherwise = new Expr.Errored("", peekToken().getLocation());
                    }
                    lhs = new Expr.Conditional(lhs, then, otherwise, token.getLocation());
                    continue;
                }
                if (token.type == PIPE_GT && level >= PIPE) {
                    next();
                    Expr target = expr(PIPE); // right associative
                    lhs = new Expr.Pipe(lhs, target, token.getLocation());
                    continue;
                }
                BinaryOperator op = BinaryOperator.fromToken(token.type);
                if (op == null || op.level > level) {
                    break;
                }
                next();
                Expr rhs = expr(op.rightAssoc ? op.level : op.level - 1);
                lhs = new Expr.Binary(op, lhs, rhs, token.getLocation());
            }
            return lhs;
        } finally {
            depth--;
        }
    }

    private Expr unary() {
        Token token = peekToken();
        if (token.type != NOT && token.type != MINUS) {
            return postfix(primary());
        }
        next();
        UnaryOperator op = token.type == NOT ? UnaryOperator.NOT : UnaryOperator.NEGATE;
        // prefix chains recurse here without passing through expr()
        if (++depth > config.getMaxDepth()) {
            abort(DiagnosticCode.RESOURCE_EXHAUSTED, "expression nesting deeper than " + config.getMaxDepth());
        }
        try {
            return new Expr.Unary(op, unary(), token.getLocation());
        } finally {
            depth--;
        }
    }

    private Expr postfix(Expr expr) {
        while (true) {
            Token token = peekToken();
            switch (token.type) {
                case DOT:
                case QUES_DOT: {
                    next();
                    boolean attribute = consumeIf(AT);
                    Token keyToken = peekToken();
                    String key = propertyName(keyToken);
                    if (key == null) {
                        error("expected property name after '" + token.text + "' but found " + describe(keyToken));
                        return new Expr.Errored(token.text, token.getLocation());
                    }
                    next();
                    expr = new Expr.Member(expr, key, token.type == QUES_DOT, attribute, token.getLocation());
                    break;
                }
                case L_BRACKET: {
                    next();
                    Expr index = expr(PIPE);
                    consumeSoft(R_BRACKET, "]");
                    expr = new Expr.Index(expr, index, token.getLocation());
                    break;
                }
                case L_PAREN: {
                    next();
                    List<Expr> args = delimited(R_PAREN, ")", this::element);
                    expr = new Expr.Call(expr, args, expr.location());
                    break;
                }
                default:
                    return expr;
            }
        }
    }

    private Expr primary() {
        Token token = peekToken();
        switch (token.type) {
            case NUMBER:
            case STRING:
                next();
                return new Expr.Literal(token.value, token.getLocation());
            case TRUE:
                next();
                return new Expr.Literal(Boolean.TRUE, token.getLocation());
            case FALSE:
                next();
                return new Expr.Literal(Boolean.FALSE, token.getLocation());
            case NULL:
                next();
                return new Expr.Literal(null, token.getLocation());
            case IDENT:
                if (peekToken(1).type == EQ_GT) {
                    return lambda();
                }
                next();
                return new Expr.Identifier(token.text, token.getLocation());
            case INPUT:
            case OUTPUT:
                next();
                return new Expr.Identifier(token.text, token.getLocation());
            case L_PAREN:
                if (isLambdaAhead()) {
                    return lambda();
                }
                next();
                Expr inner = expr(PIPE);
                consumeSoft(R_PAREN, ")");
                return inner;
            case L_CURLY:
                return objectLiteral();
            case L_BRACKET:
                return arrayLiteral();
            case IF:
                return ifExpr();
            case LET:
                return letExpr();
            case FUNCTION:
                return functionDecl();
            default:
                error("expected expression but found " + describe(token));
                return new Expr.Errored("", token.getLocation());
        }
    }

    private boolean isLambdaAhead() {
        int i = 1; // past the opening paren
        if (peekToken(i).type == R_PAREN) {
            return peekToken(i + 1).type == EQ_GT;
        }
        while (peekToken(i).type == IDENT) {
            i++;
            if (peekToken(i).type == COMMA) {
                i++;
            } else if (peekToken(i).type == R_PAREN) {
                return peekToken(i + 1).type == EQ_GT;
            } else {
                return false;
            }
        }
        return false;
    }

    private Expr lambda() {
        Token start = peekToken();
        List<String> params = new ArrayList<>();
        if (start.type == IDENT) {
            params.add(next().text);
        } else {
            next(); // (
            while (peekIf(IDENT)) {
                params.add(next().text);
                consumeIf(COMMA);
            }
            next(); // )
        }
        next(); // =>
        Expr body = expr(PIPE);
        return new Expr.Lambda(params, body, null, start.getLocation());
    }

    private Expr ifExpr() {
        Token token = next();
        consumeSoft(L_PAREN, "(");
        Expr condition = expr(PIPE);
        consumeSoft(R_PAREN, ")");
        Expr then = expr(CONDITIONAL);
        Expr otherwise;
        if (consumeIf(ELSE)) {
            otherwise = expr(CONDITIONAL);
        } else {
            otherwise = new Expr.Literal(null, token.getLocation());
        }
        return new Expr.Conditional(condition, then, otherwise, token.getLocation());
    }

    private Expr letExpr() {
        Token token = next();
        Token name = peekToken();
        if (name.type != IDENT) {
            error("expected variable name after 'let' but found " + describe(name));
            return new Expr.Errored(token.text, token.getLocation());
        }
        next();
        consumeSoft(EQ, "=");
        Expr value = expr(PIPE);
        bindingEnd();
        Expr body = expr(PIPE);
        return new Expr.Let(name.text, value, body, token.getLocation());
    }

    private Expr functionDecl() {
        Token token = next();
        Token name = peekToken();
        if (name.type != IDENT) {
            error("expected function name but found " + describe(name));
            return new Expr.Errored(token.text, token.getLocation());
        }
        next();
        List<String> params;
        if (consumeSoft(L_PAREN, "(")) {
            params = delimited(R_PAREN, ")", this::parameter);
        } else {
            params = List.of();
        }
        Expr body;
        if (consumeSoft(L_CURLY, "{")) {
            body = expr(PIPE);
            consumeSoft(R_CURLY, "}");
        } else {
            body = new Expr.Errored("", peekToken().getLocation());
        }
        bindingEnd();
        Expr rest = expr(PIPE);
        Expr.Lambda lambda = new Expr.Lambda(params, body, name.text, token.getLocation());
        return new Expr.Let(name.text, lambda, rest, token.getLocation());
    }

    private void bindingEnd() {
        if (!consumeIf(SEMI) && !consumeIf(COMMA)) {
            consumeIf(IN);
        }
    }

    private String parameter() {
        Token token = peekToken();
        if (token.type != IDENT) {
            error("expected parameter name but found " + describe(token));
            return null;
        }
        next();
        return token.text;
    }

    // ========== Composite Literals ==========

    private Expr objectLiteral() {
        Token token = next();
        List<Expr.ObjectEntry> entries = delimited(R_CURLY, "}", this::objectEntry);
        return new Expr.ObjectLiteral(entries, token.getLocation());
    }

    private Expr.ObjectEntry objectEntry() {
        Token token = peekToken();
        if (token.type == DOT_DOT_DOT) {
            next();
            return new Expr.Spread(expr(PIPE), token.getLocation());
        }
        boolean attribute = consumeIf(AT);
        Token keyToken = peekToken();
        String key = keyToken.type == NUMBER ? keyToken.text : propertyName(keyToken);
        if (key == null) {
            error("expected property name but found " + describe(keyToken));
            return null;
        }
        next();
        if (!consumeIf(COLON)) {
            Token found = peekToken();
            error("expected ':' after property name '" + key + "' but found " + describe(found));
            return new Expr.Property(key, new Expr.Errored("", found.getLocation()), attribute, token.getLocation());
        }
        return new Expr.Property(key, expr(PIPE), attribute, token.getLocation());
    }

    private Expr arrayLiteral() {
        Token token = next();
        List<Expr> elements = delimited(R_BRACKET, "]", this::element);
        return new Expr.ArrayLiteral(elements, token.getLocation());
    }

    private Expr element() {
        Token token = peekToken();
        if (token.type == DOT_DOT_DOT) {
            next();
            return new Expr.Spread(expr(PIPE), token.getLocation());
        }
        return expr(PIPE);
    }

    /**
     * Parses comma separated items up to and including the closing token.
     * A malformed item is reported once and skipped, parsing resumes at the next
     * comma, or at a keyword that starts a new construct. A trailing comma is allowed.
     */
    private <T> List<T> delimited(TokenType close, String closeText, Supplier<T> item) {
        List<T> list = new ArrayList<>();
        while (true) {
            TokenType type = peek();
            if (type == close || type == EOF || type == SEPARATOR) {
                break;
            }
            int errorsBefore = getErrorCount();
            T value = item.get();
            if (value != null) {
                list.add(value);
            }
            if (consumeIf(COMMA)) {
                continue;
            }
            if (peekIf(close)) {
                break;
            }
            if (getErrorCount() == errorsBefore) {
                error("expected ',' or '" + closeText + "' but found " + describe(peekToken()));
            }
            recoverTo(LIST_RECOVERY);
            if (peek().keyword) {
                continue; // let, function or if, the next item starts here
            }
            if (!consumeIf(COMMA)) {
                break;
            }
        }
        consumeSoft(close, closeText);
        return list;
    }

    private static String propertyName(Token token) {
        if (token.type == IDENT || token.type.keyword) {
            return token.text;
        }
        if (token.type == STRING) {
            return (String) token.value;
        }
        return null;
    }

}

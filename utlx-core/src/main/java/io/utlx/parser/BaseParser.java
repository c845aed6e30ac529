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
import java.util.Set;

import static io.utlx.parser.TokenType.*;

/**
 * Token navigation and error bookkeeping shared by parsers. All state is held
 * per instance: the current section, the diagnostics and the error counters.
 * Recovery is explicit, a parse method records an error and then calls
 * {@link #recoverTo(TokenType...)} to skip to a synchronization token.
 */
public abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    protected final Resource resource;
    protected final List<Token> tokens;
    protected final Config config;
    private final int size;

    private int position = 0;

    protected ScriptSection section = ScriptSection.HEADER;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int errorCount;
    private int lastErrorPosition = -1;
    private int lastRecoveryPosition = -1;

    protected BaseParser(Resource resource, List<Token> tokens, Config config) {
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        this.resource = resource;
        this.tokens = tokens;
        this.config = config;
        size = tokens.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, position - 7);
        int end = Math.min(position + 7, size);
        for (int i = start; i < end; i++) {
            if (i == 0) {
                sb.append("| ");
            }
            if (i == position) {
                sb.append(">>");
            }
            sb.append(tokens.get(i));
            sb.append(' ');
        }
        if (position == size) {
            sb.append(">>");
        }
        sb.append("| section: ").append(section);
        return sb.toString();
    }

    // ========== Diagnostics ==========

    protected void error(String message) {
        error(peekToken(), message);
    }

    /**
     * Records a parse error at the given token. A second error at the token of
     * the previous error is a consequence of it and is dropped.
     */
    protected void error(Token token, String message) {
        if (token.pos == lastErrorPosition) {
            logger.trace("suppressed cascading error: {} at {}", message, token.getPositionDisplay());
            return;
        }
        lastErrorPosition = token.pos;
        report(Diagnostic.error(DiagnosticCode.PARSE_ERROR, section, token.getLocation(), message));
    }

    protected void warning(Token token, String message) {
        report(Diagnostic.warning(DiagnosticCode.PARSE_ERROR, section, token.getLocation(), message));
    }

    /**
     * Adds a diagnostic and enforces the error limit and the fail-fast settings.
     *
     * @throws ParserException when parsing has to stop
     */
    protected void report(Diagnostic diagnostic) {
        if (!diagnostic.isError()) {
            diagnostics.add(diagnostic);
            return;
        }
        if (errorCount == config.getMaxErrors()) {
            diagnostics.add(new Diagnostic("too many errors, stopped after " + errorCount,
                    diagnostic.line(), diagnostic.column(), diagnostic.section(),
                    DiagnosticCode.TOO_MANY_ERRORS, Severity.ERROR, null));
            throw new ParserException("too many errors: " + errorCount);
        }
        errorCount++;
        diagnostics.add(diagnostic);
        if (config.isFailFast() || !config.isRecovery()) {
            throw new ParserException(diagnostic.toString() + "\nparser state: " + this);
        }
    }

    protected void abort(DiagnosticCode code, String message) {
        Token token = peekToken();
        diagnostics.add(new Diagnostic(message, token.line + 1, token.col + 1, section, code, Severity.ERROR, null));
        throw new ParserException(message);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public int getErrorCount() {
        return errorCount;
    }

    // ========== Error Recovery Methods ==========

    /**
     * Skip tokens until we find a recovery point.
     * Includes infinite loop detection - if called from the same position twice,
     * forces skip of at least one token to guarantee progress.
     *
     * @param recoveryTokens tokens that indicate a safe recovery point
     * @return true if a recovery token was found, false if EOF reached
     */
    protected boolean recoverTo(TokenType... recoveryTokens) {
        if (position == lastRecoveryPosition) {
            if (peek() != EOF) {
                next();
            }
        }
        lastRecoveryPosition = position;
        Set<TokenType> recoverySet = Set.of(recoveryTokens);
        while (true) {
            TokenType current = peek();
            if (current == EOF || recoverySet.contains(current)) {
                return current != EOF;
            }
            next();
        }
    }

    /**
     * Consume token if present, or record an error.
     *
     * @param token the expected token type
     * @param text how the token is shown in the error message
     * @return true if consumed
     */
    protected boolean consumeSoft(TokenType token, String text) {
        if (consumeIf(token)) {
            return true;
        }
        error("expected '" + text + "' but found " + describe(peekToken()));
        return false;
    }

    protected static String describe(Token token) {
        return token.type == EOF ? "end of input" : "'" + token.text + "'";
    }

    // ========== Token Navigation ==========

    protected TokenType peek() {
        return peekToken().type;
    }

    protected Token peekToken() {
        return position < size ? tokens.get(position) : Token.EMPTY;
    }

    protected Token peekToken(int offset) {
        int index = position + offset;
        return index < size ? tokens.get(index) : Token.EMPTY;
    }

    protected int position() {
        return position;
    }

    protected void rewind(int mark) {
        position = mark;
    }

    protected boolean consumeIf(TokenType token) {
        if (peekIf(token)) {
            next();
            return true;
        }
        return false;
    }

    protected boolean peekIf(TokenType token) {
        return peek() == token;
    }

    // Array overload - use with pre-allocated static arrays to avoid allocation
    protected boolean peekAnyOf(TokenType[] types) {
        TokenType current = peek();
        for (TokenType type : types) {
            if (current == type) {
                return true;
            }
        }
        return false;
    }

    // never moves past EOF
    protected Token next() {
        Token token = peekToken();
        if (token.type != EOF) {
            position++;
        }
        return token;
    }

}

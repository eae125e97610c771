package com.charlib.tool.parser;

import java.util.ArrayList;
import java.util.List;

import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.parser.LibertyToken.TokenType;

/**
 * Tokenizer for Liberty (.lib) source text.
 *
 * Handles block and line comments and backslash-newline continuations.
 * Everything that is not punctuation, whitespace or a quoted string is a WORD.
 */
public class LibertyTokenizer {

    private static final String PUNCTUATION = "(){}:;,\"";

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;
    private boolean sawNewline = true;
    private int start = 0;

    public LibertyTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source.
     */
    public List<LibertyToken> tokenize() {
        List<LibertyToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
            sawNewline = false;
        }

        tokens.add(new LibertyToken(TokenType.EOF, "", line, column, true, pos, pos));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                advanceLine();
                sawNewline = true;
            } else if (c == '\\' && isContinuation(pos)) {
                skipContinuation();
            } else if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private LibertyToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;
        start = pos;

        switch (c) {
            case '(':
                advance();
                return token(TokenType.LPAREN, "(", startLine, startCol);
            case ')':
                advance();
                return token(TokenType.RPAREN, ")", startLine, startCol);
            case '{':
                advance();
                return token(TokenType.LBRACE, "{", startLine, startCol);
            case '}':
                advance();
                return token(TokenType.RBRACE, "}", startLine, startCol);
            case ':':
                advance();
                return token(TokenType.COLON, ":", startLine, startCol);
            case ';':
                advance();
                return token(TokenType.SEMICOLON, ";", startLine, startCol);
            case ',':
                advance();
                return token(TokenType.COMMA, ",", startLine, startCol);
            case '"':
                return readStringLiteral(startLine, startCol);
            default:
                return readWord(startLine, startCol);
        }
    }

    private LibertyToken readStringLiteral(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advance(); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '"') {
                advance();
                return token(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
            }
            if (c == '\\' && isContinuation(pos)) {
                skipContinuation();
            } else if (c == '\\' && peekChar(1) == '"') {
                sb.append('"');
                advance();
                advance();
            } else if (c == '\n') {
                sb.append(c);
                advanceLine();
            } else {
                sb.append(c);
                advance();
            }
        }

        throw new MalformedSourceException(fileName + ":" + startLine + ":" + startCol + ": Unterminated string literal");
    }

    private LibertyToken readWord(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || PUNCTUATION.indexOf(c) >= 0) {
                break;
            }
            if (c == '\\' && isContinuation(pos)) {
                break;
            }
            if (c == '/' && (peekChar(1) == '*' || peekChar(1) == '/')) {
                break;
            }
            sb.append(c);
            advance();
        }

        return token(TokenType.WORD, sb.toString(), startLine, startCol);
    }

    private LibertyToken token(TokenType type, String value, int startLine, int startCol) {
        return new LibertyToken(type, value, startLine, startCol, sawNewline, start, pos);
    }

    /**
     * A backslash followed only by blanks up to the end of the line.
     */
    private boolean isContinuation(int at) {
        int i = at + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r') {
                return false;
            }
            i++;
        }
        return true;
    }

    private void skipContinuation() {
        advance(); // backslash
        while (pos < source.length() && source.charAt(pos) != '\n') {
            advance();
        }
        if (pos < source.length()) {
            advanceLine();
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        advance();
        advance();
        while (pos < source.length()) {
            if (source.charAt(pos) == '*' && peekChar(1) == '/') {
                advance();
                advance();
                return;
            }
            if (source.charAt(pos) == '\n') {
                advanceLine();
            } else {
                advance();
            }
        }
        throw new MalformedSourceException(fileName + ":" + startLine + ": Unterminated comment");
    }

    private char peekChar(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private void advance() {
        pos++;
        column++;
    }

    private void advanceLine() {
        pos++;
        line++;
        column = 1;
    }
}

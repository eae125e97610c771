package com.charlib.tool.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the Liberty tokenizer.
 */
@Data
@AllArgsConstructor
public class LibertyToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;
    /** True when a line break (not a backslash continuation) precedes this token. */
    private boolean newlineBefore;
    /** Character offsets of the token in the source, end exclusive. */
    private int offset;
    private int endOffset;

    public enum TokenType {
        WORD,
        STRING_LITERAL,
        LPAREN,
        RPAREN,
        LBRACE,
        RBRACE,
        COLON,
        SEMICOLON,
        COMMA,
        EOF
    }

    public String describe() {
        return type == TokenType.EOF ? "end of input" : type + " '" + value + "'";
    }
}

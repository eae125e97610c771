package com.charlib.tool.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.charlib.tool.exception.MalformedSourceException;
import com.charlib.tool.parser.LibertyToken.TokenType;
import com.charlib.tool.tree.AttributeType;
import com.charlib.tool.tree.AttributeValue;
import com.charlib.tool.tree.node.AttributeNode;
import com.charlib.tool.tree.node.GroupNode;
import com.charlib.tool.tree.node.LibertyNode;

/**
 * Parser for Liberty source text.
 * Converts tokens into a tree of {@link GroupNode}s and {@link AttributeNode}s.
 *
 * <pre>
 * group     := WORD '(' values ')' '{' statement* '}'
 * complex   := WORD '(' values ')' ';'?
 * simple    := WORD ':' value ';'?
 * </pre>
 *
 * A simple attribute value without a trailing semicolon ends at the line break.
 */
public class LibertyParser {
    private static final Logger log = LoggerFactory.getLogger(LibertyParser.class);

    private final List<LibertyToken> tokens;
    private final String source;
    private final String fileName;
    private int pos = 0;

    public LibertyParser(List<LibertyToken> tokens, String source, String fileName) {
        this.tokens = tokens;
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Parse all top-level groups.
     */
    public List<GroupNode> parse() {
        List<GroupNode> topGroups = new ArrayList<>();
        int end = 0;

        while (!isAtEnd()) {
            if (check(TokenType.SEMICOLON)) {
                advance();
                continue;
            }
            int line = peek().getLine();
            LibertyNode statement = parseStatement(end);
            end = previous().getEndOffset();
            if (statement instanceof GroupNode group) {
                topGroups.add(group);
            } else {
                log.debug("Ignoring top-level attribute at line {}", line);
            }
        }

        return topGroups;
    }

    /**
     * @param previousEnd source offset where the previous sibling (or the enclosing '{') ends
     */
    private LibertyNode parseStatement(int previousEnd) {
        LibertyToken nameToken = expect(TokenType.WORD);
        String name = nameToken.getValue();
        String leadingText = source.substring(previousEnd, nameToken.getOffset());

        if (check(TokenType.COLON)) {
            advance();
            return parseSimpleAttribute(nameToken, leadingText);
        }

        if (check(TokenType.LPAREN)) {
            advance();
            List<AttributeValue> args = parseValueList();
            expect(TokenType.RPAREN);

            if (check(TokenType.LBRACE)) {
                advance();
                return parseGroupBody(nameToken, args, leadingText);
            }

            skipOptionalSemicolon();
            return AttributeNode.builder()
                    .name(name)
                    .type(AttributeType.COMPLEX)
                    .values(args)
                    .sourceFile(fileName)
                    .sourceLine(nameToken.getLine())
                    .sourceText(spanFrom(nameToken))
                    .leadingText(leadingText)
                    .build();
        }

        throw error("Expected ':' or '(' after '" + name + "'", peek());
    }

    private GroupNode parseGroupBody(LibertyToken typeToken, List<AttributeValue> args, String leadingText) {
        List<String> names = new ArrayList<>();
        for (AttributeValue arg : args) {
            names.add(arg.text());
        }
        String headerText = spanFrom(typeToken);
        String description = typeToken.getValue() + "(" + String.join(", ", names) + ")";

        List<LibertyNode> children = new ArrayList<>();
        int end = previous().getEndOffset();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error("Unterminated group '" + description + "' opened at line " + typeToken.getLine(), peek());
            }
            if (check(TokenType.SEMICOLON)) {
                advance();
                continue;
            }
            children.add(parseStatement(end));
            end = previous().getEndOffset();
        }
        expect(TokenType.RBRACE);
        skipOptionalSemicolon();

        log.debug("Parsed group {} at line {}", description, typeToken.getLine());
        return GroupNode.builder()
                .groupType(typeToken.getValue())
                .names(names)
                .children(children)
                .sourceFile(fileName)
                .sourceLine(typeToken.getLine())
                .sourceText(spanFrom(typeToken))
                .leadingText(leadingText)
                .headerText(headerText)
                .footerText(source.substring(end, previous().getEndOffset()))
                .build();
    }

    private AttributeNode parseSimpleAttribute(LibertyToken nameToken, String leadingText) {
        List<LibertyToken> valueTokens = new ArrayList<>();

        while (!isAtEnd() && !check(TokenType.SEMICOLON) && !check(TokenType.RBRACE)) {
            LibertyToken token = peek();
            if (!valueTokens.isEmpty() && token.isNewlineBefore()) {
                break;
            }
            if (token.getType() != TokenType.WORD && token.getType() != TokenType.STRING_LITERAL) {
                throw error("Unexpected " + token.describe() + " in value of '" + nameToken.getValue() + "'", token);
            }
            valueTokens.add(advance());
        }

        if (valueTokens.isEmpty()) {
            throw error("Missing value for attribute '" + nameToken.getValue() + "'", peek());
        }
        skipOptionalSemicolon();

        AttributeValue value;
        if (valueTokens.size() == 1) {
            value = toValue(valueTokens.get(0));
        } else {
            StringBuilder sb = new StringBuilder();
            for (LibertyToken token : valueTokens) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(token.getValue());
            }
            value = AttributeValue.word(sb.toString());
        }

        return AttributeNode.builder()
                .name(nameToken.getValue())
                .type(AttributeType.SIMPLE)
                .values(List.of(value))
                .sourceFile(fileName)
                .sourceLine(nameToken.getLine())
                .sourceText(spanFrom(nameToken))
                .leadingText(leadingText)
                .build();
    }

    private List<AttributeValue> parseValueList() {
        List<AttributeValue> values = new ArrayList<>();
        if (check(TokenType.RPAREN)) {
            return values;
        }

        while (true) {
            LibertyToken token = peek();
            if (token.getType() != TokenType.WORD && token.getType() != TokenType.STRING_LITERAL) {
                throw error("Expected a value but found " + token.describe(), token);
            }
            values.add(toValue(advance()));

            if (check(TokenType.COMMA)) {
                advance();
            } else if (check(TokenType.RPAREN)) {
                return values;
            } else if (!check(TokenType.WORD) && !check(TokenType.STRING_LITERAL)) {
                throw error("Expected ',' or ')' but found " + peek().describe(), peek());
            }
            // Space-separated values are accepted as separate values.
        }
    }

    static AttributeValue toValue(LibertyToken token) {
        if (token.getType() == TokenType.STRING_LITERAL) {
            return AttributeValue.string(token.getValue());
        }
        return isNumeric(token.getValue())
                ? AttributeValue.number(token.getValue())
                : AttributeValue.word(token.getValue());
    }

    static boolean isNumeric(String text) {
        if (text.isEmpty()) {
            return false;
        }
        char first = text.charAt(0);
        if (!Character.isDigit(first) && first != '-' && first != '+' && first != '.') {
            return false;
        }
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Source text from {@code first} through the last consumed token.
     */
    private String spanFrom(LibertyToken first) {
        return source.substring(first.getOffset(), previous().getEndOffset());
    }

    private void skipOptionalSemicolon() {
        if (check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private MalformedSourceException error(String message, LibertyToken at) {
        return new MalformedSourceException(fileName + ":" + at.getLine() + ":" + at.getColumn() + ": " + message);
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private LibertyToken peek() {
        return tokens.get(pos);
    }

    private LibertyToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private LibertyToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private LibertyToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error("Expected " + type + " but found " + peek().describe(), peek());
    }
}

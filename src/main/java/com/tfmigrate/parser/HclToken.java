package com.tfmigrate.parser;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Represents a token from the HCL tokenizer.
 * <p>
 * The text is the exact source slice, so concatenating a run of tokens
 * reproduces the original bytes. Tokens are never edited; transformations
 * build new token lists.
 */
@Value
@AllArgsConstructor
public class HclToken {
    TokenType type;
    String text;
    @EqualsAndHashCode.Exclude
    int line;
    @EqualsAndHashCode.Exclude
    int column;

    public enum TokenType {
        IDENTIFIER,
        NUMBER_LIT,
        OQUOTE,
        CQUOTE,
        QUOTED_LIT,
        TEMPLATE_INTERP,
        TEMPLATE_CONTROL,
        TEMPLATE_SEQ_END,
        OHEREDOC,
        CHEREDOC,
        STRING_LIT,
        OBRACE,
        CBRACE,
        OBRACK,
        CBRACK,
        OPAREN,
        CPAREN,
        EQUAL,
        COMMA,
        DOT,
        COLON,
        QUESTION,
        ARROW,
        ELLIPSIS,
        OPERATOR,
        COMMENT,
        WHITESPACE,
        NEWLINE,
        INVALID,
        EOF
    }

    /**
     * Creates a synthetic token with no source position.
     */
    public static HclToken of(TokenType type, String text) {
        return new HclToken(type, text, 0, 0);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isIdentifier(String name) {
        return type == TokenType.IDENTIFIER && text.equals(name);
    }

    /**
     * Whitespace, newlines and comments carry no meaning for the scanner.
     */
    public boolean isTrivia() {
        return type == TokenType.WHITESPACE || type == TokenType.NEWLINE || type == TokenType.COMMENT;
    }

    /**
     * A {@code #} or {@code //} comment, which always runs to the end of its line.
     */
    public boolean isLineComment() {
        return type == TokenType.COMMENT && (text.startsWith("#") || text.startsWith("//"));
    }

    /**
     * Tokens that open a nested structure closed by a matching token.
     */
    public boolean opensNesting() {
        return type == TokenType.OBRACE || type == TokenType.OBRACK || type == TokenType.OPAREN
                || type == TokenType.TEMPLATE_INTERP || type == TokenType.TEMPLATE_CONTROL
                || type == TokenType.OQUOTE || type == TokenType.OHEREDOC;
    }

    public boolean closesNesting() {
        return type == TokenType.CBRACE || type == TokenType.CBRACK || type == TokenType.CPAREN
                || type == TokenType.TEMPLATE_SEQ_END || type == TokenType.CQUOTE || type == TokenType.CHEREDOC;
    }
}

package com.tfmigrate.parser;

import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.parser.exception.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lossless tokenizer for HCL configuration source.
 * <p>
 * Whitespace, newlines and comments are kept as tokens so that joining the
 * text of every token gives back the input unchanged.
 */
public class HclTokenizer {
    private static final Logger log = LoggerFactory.getLogger(HclTokenizer.class);

    private enum Mode {
        BRACE,
        INTERP,
        TEMPLATE,
        HEREDOC
    }

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private final Deque<Mode> modes = new ArrayDeque<>();
    private final Deque<String> heredocMarkers = new ArrayDeque<>();
    private boolean heredocLineStart;

    public HclTokenizer(String source, String fileName) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source.
     */
    public List<HclToken> tokenize() {
        List<HclToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            Mode mode = modes.peek();
            if (mode == Mode.TEMPLATE) {
                tokens.add(scanTemplate());
            } else if (mode == Mode.HEREDOC) {
                tokens.add(scanHeredoc());
            } else {
                tokens.add(scanNormal());
            }
        }

        if (modes.contains(Mode.TEMPLATE)) {
            throw new ParseException("Unterminated quoted string", fileName, line);
        }
        if (modes.contains(Mode.HEREDOC)) {
            throw new ParseException("Unterminated heredoc " + heredocMarkers.peek(), fileName, line);
        }

        tokens.add(new HclToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {} into {} tokens", fileName, tokens.size());
        return tokens;
    }

    private HclToken scanNormal() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        if (c == '\n') {
            return token(TokenType.NEWLINE, 1, startLine, startCol);
        }
        if (c == '\r' && peekChar(1) == '\n') {
            return token(TokenType.NEWLINE, 2, startLine, startCol);
        }
        if (c == ' ' || c == '\t' || c == '\r') {
            int end = pos;
            while (end < source.length()) {
                char w = source.charAt(end);
                if (w == ' ' || w == '\t' || (w == '\r' && charAt(end + 1) != '\n')) {
                    end++;
                } else {
                    break;
                }
            }
            return token(TokenType.WHITESPACE, end - pos, startLine, startCol);
        }
        if (c == '#' || (c == '/' && peekChar(1) == '/')) {
            return token(TokenType.COMMENT, lineCommentLength(), startLine, startCol);
        }
        if (c == '/' && peekChar(1) == '*') {
            int close = source.indexOf("*/", pos + 2);
            if (close < 0) {
                throw new ParseException("Unterminated block comment", fileName, startLine);
            }
            return token(TokenType.COMMENT, close + 2 - pos, startLine, startCol);
        }
        if (c == '"') {
            modes.push(Mode.TEMPLATE);
            return token(TokenType.OQUOTE, 1, startLine, startCol);
        }
        if (c == '<' && peekChar(1) == '<' && isHeredocStart()) {
            return readHeredocOpen(startLine, startCol);
        }
        if (Character.isDigit(c)) {
            return readNumber(startLine, startCol);
        }
        if (Character.isLetter(c) || c == '_') {
            int end = pos + 1;
            while (end < source.length() && isIdentifierPart(source.charAt(end))) {
                end++;
            }
            return token(TokenType.IDENTIFIER, end - pos, startLine, startCol);
        }

        switch (c) {
            case '{':
                modes.push(Mode.BRACE);
                return token(TokenType.OBRACE, 1, startLine, startCol);
            case '}':
                return closeBrace(1, startLine, startCol);
            case '~':
                if (peekChar(1) == '}' && modes.peek() == Mode.INTERP) {
                    return closeBrace(2, startLine, startCol);
                }
                return token(TokenType.INVALID, 1, startLine, startCol);
            case '[':
                return token(TokenType.OBRACK, 1, startLine, startCol);
            case ']':
                return token(TokenType.CBRACK, 1, startLine, startCol);
            case '(':
                return token(TokenType.OPAREN, 1, startLine, startCol);
            case ')':
                return token(TokenType.CPAREN, 1, startLine, startCol);
            case ',':
                return token(TokenType.COMMA, 1, startLine, startCol);
            case ':':
                return token(TokenType.COLON, 1, startLine, startCol);
            case '?':
                return token(TokenType.QUESTION, 1, startLine, startCol);
            case '.':
                if (peekChar(1) == '.' && peekChar(2) == '.') {
                    return token(TokenType.ELLIPSIS, 3, startLine, startCol);
                }
                return token(TokenType.DOT, 1, startLine, startCol);
            case '=':
                if (peekChar(1) == '=') {
                    return token(TokenType.OPERATOR, 2, startLine, startCol);
                }
                if (peekChar(1) == '>') {
                    return token(TokenType.ARROW, 2, startLine, startCol);
                }
                return token(TokenType.EQUAL, 1, startLine, startCol);
            case '!':
            case '<':
            case '>':
                return token(TokenType.OPERATOR, peekChar(1) == '=' ? 2 : 1, startLine, startCol);
            case '&':
            case '|':
                return token(TokenType.OPERATOR, peekChar(1) == c ? 2 : 1, startLine, startCol);
            case '+':
            case '-':
            case '*':
            case '/':
            case '%':
                return token(TokenType.OPERATOR, 1, startLine, startCol);
            default:
                log.debug("Unexpected character '{}' at line {}", c, startLine);
                return token(TokenType.INVALID, 1, startLine, startCol);
        }
    }

    private HclToken closeBrace(int length, int startLine, int startCol) {
        Mode top = modes.peek();
        if (top == Mode.INTERP) {
            modes.pop();
            return token(TokenType.TEMPLATE_SEQ_END, length, startLine, startCol);
        }
        if (top == Mode.BRACE) {
            modes.pop();
        }
        return token(TokenType.CBRACE, length, startLine, startCol);
    }

    private HclToken scanTemplate() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        if (c == '"') {
            modes.pop();
            return token(TokenType.CQUOTE, 1, startLine, startCol);
        }
        HclToken opener = templateOpener(startLine, startCol);
        if (opener != null) {
            return opener;
        }
        if (c == '\n') {
            throw new ParseException("Unterminated quoted string", fileName, startLine);
        }

        int end = pos;
        while (end < source.length()) {
            char t = source.charAt(end);
            if (t == '"' || t == '\n') {
                break;
            }
            if (t == '\\' && end + 1 < source.length()) {
                end += 2;
                continue;
            }
            if ((t == '$' || t == '%') && charAt(end + 1) == t && charAt(end + 2) == '{') {
                end += 3;
                continue;
            }
            if ((t == '$' || t == '%') && charAt(end + 1) == '{') {
                break;
            }
            end++;
        }
        return token(TokenType.QUOTED_LIT, end - pos, startLine, startCol);
    }

    private HclToken scanHeredoc() {
        int startLine = line;
        int startCol = column;

        if (heredocLineStart) {
            int eol = source.indexOf('\n', pos);
            String lineText = source.substring(pos, eol < 0 ? source.length() : eol);
            String trimmedLine = lineText.endsWith("\r") ? lineText.substring(0, lineText.length() - 1) : lineText;
            if (trimmedLine.strip().equals(heredocMarkers.peek())) {
                modes.pop();
                heredocMarkers.pop();
                heredocLineStart = false;
                return token(TokenType.CHEREDOC, trimmedLine.length(), startLine, startCol);
            }
        }
        heredocLineStart = false;

        HclToken opener = templateOpener(startLine, startCol);
        if (opener != null) {
            return opener;
        }

        int end = pos;
        while (end < source.length()) {
            char t = source.charAt(end);
            if (t == '\n') {
                end++;
                heredocLineStart = true;
                break;
            }
            if ((t == '$' || t == '%') && charAt(end + 1) == t && charAt(end + 2) == '{') {
                end += 3;
                continue;
            }
            if ((t == '$' || t == '%') && charAt(end + 1) == '{') {
                break;
            }
            end++;
        }
        return token(TokenType.STRING_LIT, end - pos, startLine, startCol);
    }

    private HclToken templateOpener(int startLine, int startCol) {
        char c = source.charAt(pos);
        if ((c == '$' || c == '%') && peekChar(1) == '{') {
            modes.push(Mode.INTERP);
            int length = peekChar(2) == '~' ? 3 : 2;
            return token(c == '$' ? TokenType.TEMPLATE_INTERP : TokenType.TEMPLATE_CONTROL, length, startLine, startCol);
        }
        return null;
    }

    private boolean isHeredocStart() {
        int i = pos + 2;
        if (charAt(i) == '-') {
            i++;
        }
        return Character.isLetter(charAt(i)) || charAt(i) == '_';
    }

    private HclToken readHeredocOpen(int startLine, int startCol) {
        int i = pos + 2;
        if (charAt(i) == '-') {
            i++;
        }
        int markerStart = i;
        while (i < source.length() && isIdentifierPart(source.charAt(i))) {
            i++;
        }
        String marker = source.substring(markerStart, i);
        if (charAt(i) == '\r') {
            i++;
        }
        if (charAt(i) != '\n') {
            throw new ParseException("Heredoc marker " + marker + " must be followed by a newline", fileName, startLine);
        }
        i++;
        modes.push(Mode.HEREDOC);
        heredocMarkers.push(marker);
        heredocLineStart = true;
        return token(TokenType.OHEREDOC, i - pos, startLine, startCol);
    }

    private HclToken readNumber(int startLine, int startCol) {
        int end = pos;
        while (end < source.length() && Character.isDigit(source.charAt(end))) {
            end++;
        }
        if (charAt(end) == '.' && Character.isDigit(charAt(end + 1))) {
            end++;
            while (end < source.length() && Character.isDigit(source.charAt(end))) {
                end++;
            }
        }
        if (charAt(end) == 'e' || charAt(end) == 'E') {
            int exp = end + 1;
            if (charAt(exp) == '+' || charAt(exp) == '-') {
                exp++;
            }
            if (Character.isDigit(charAt(exp))) {
                end = exp;
                while (end < source.length() && Character.isDigit(source.charAt(end))) {
                    end++;
                }
            }
        }
        return token(TokenType.NUMBER_LIT, end - pos, startLine, startCol);
    }

    private int lineCommentLength() {
        int end = pos;
        while (end < source.length() && source.charAt(end) != '\n') {
            end++;
        }
        if (end > pos && source.charAt(end - 1) == '\r' && end < source.length()) {
            end--;
        }
        return end - pos;
    }

    private HclToken token(TokenType type, int length, int startLine, int startCol) {
        String text = source.substring(pos, pos + length);
        for (int i = 0; i < length; i++) {
            if (source.charAt(pos + i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        pos += length;
        return new HclToken(type, text, startLine, startCol);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private char peekChar(int offset) {
        return charAt(pos + offset);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }
}

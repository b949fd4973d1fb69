package com.tfmigrate.parser;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclFile;
import com.tfmigrate.model.HclNode;
import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.parser.exception.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for HCL configuration files.
 * Converts tokens into a tree of bodies, attributes and blocks.
 *
 * Parsing only:
 * - Keeps every token, so untouched nodes print back byte for byte
 * - Treats attribute values as opaque token runs
 *
 * It does NOT evaluate expressions or validate any schema.
 */
public class HclParser {
    private static final Logger log = LoggerFactory.getLogger(HclParser.class);

    private final List<HclToken> tokens;
    private final String fileName;
    private int pos = 0;

    public HclParser(List<HclToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    /**
     * Tokenizes and parses configuration source.
     */
    public static HclFile parseConfig(String source, String fileName) {
        List<HclToken> tokens = new HclTokenizer(source, fileName).tokenize();
        return new HclParser(tokens, fileName).parse();
    }

    /**
     * Tokenizes a standalone expression, without surrounding trivia.
     */
    public static List<HclToken> parseExpression(String expression) {
        List<HclToken> tokens = new HclTokenizer(expression, "<expr>").tokenize();
        HclParser parser = new HclParser(tokens, "<expr>");
        parser.skipTrivia(new ArrayList<>());
        List<HclToken> result = parser.parseExpressionTokens();
        parser.skipTrivia(new ArrayList<>());
        if (!parser.isAtEnd()) {
            throw new ParseException("Unexpected " + parser.peek().getType() + " after expression",
                    "<expr>", parser.peek().getLine());
        }
        return result;
    }

    public HclFile parse() {
        Body root = parseBody(false, true);
        root.setIndent("");
        log.debug("Parsed {} with {} top-level items", fileName, root.getItems().size());
        return new HclFile(fileName, root);
    }

    private Body parseBody(boolean nested, boolean atLineStart) {
        List<HclNode> items = new ArrayList<>();
        String indent = null;

        while (true) {
            List<HclToken> leading = new ArrayList<>();
            skipTrivia(leading);

            HclToken token = peek();
            if (token.is(TokenType.EOF)) {
                if (nested) {
                    throw new ParseException("Unclosed block body", fileName, token.getLine());
                }
                return new Body(items, leading, indent);
            }
            if (token.is(TokenType.CBRACE)) {
                if (!nested) {
                    throw new ParseException("Unexpected closing brace", fileName, token.getLine());
                }
                return new Body(items, leading, indent);
            }
            if (!token.is(TokenType.IDENTIFIER)) {
                throw new ParseException("Expected attribute or block but found " + token.getType()
                        + " '" + token.getText() + "'", fileName, token.getLine());
            }

            if (indent == null) {
                indent = indentOf(leading, atLineStart);
            }
            items.add(parseItem(leading));
        }
    }

    private HclNode parseItem(List<HclToken> leading) {
        HclToken nameToken = advance();
        List<HclToken> gap = new ArrayList<>();
        while (check(TokenType.WHITESPACE)) {
            gap.add(advance());
        }

        if (check(TokenType.EQUAL)) {
            List<HclToken> assign = new ArrayList<>(gap);
            assign.add(advance());
            while (check(TokenType.WHITESPACE)) {
                assign.add(advance());
            }
            List<HclToken> expression = parseExpressionTokens();
            List<HclToken> trailing = parseLineEnd();
            log.debug("Parsed attribute {} at line {}", nameToken.getText(), nameToken.getLine());
            return new Attribute(nameToken.getText(), leading, assign, expression, trailing);
        }

        return parseBlock(nameToken, leading, gap);
    }

    private Block parseBlock(HclToken typeToken, List<HclToken> leading, List<HclToken> header) {
        List<String> labels = new ArrayList<>();

        while (!check(TokenType.OBRACE)) {
            HclToken token = peek();
            if (token.is(TokenType.WHITESPACE) || token.is(TokenType.COMMENT)) {
                header.add(advance());
            } else if (token.is(TokenType.IDENTIFIER)) {
                labels.add(advance().getText());
                header.add(token);
            } else if (token.is(TokenType.OQUOTE)) {
                header.add(advance());
                StringBuilder label = new StringBuilder();
                while (check(TokenType.QUOTED_LIT)) {
                    HclToken part = advance();
                    label.append(part.getText());
                    header.add(part);
                }
                header.add(expect(TokenType.CQUOTE));
                labels.add(label.toString());
            } else {
                throw new ParseException("Expected block label or '{' after " + typeToken.getText()
                        + " but found " + token.getType(), fileName, token.getLine());
            }
        }

        List<HclToken> open = new ArrayList<>();
        open.add(advance());
        int lookahead = pos;
        while (lookahead < tokens.size()
                && (tokens.get(lookahead).is(TokenType.WHITESPACE) || tokens.get(lookahead).is(TokenType.COMMENT))) {
            lookahead++;
        }
        if (lookahead < tokens.size() && tokens.get(lookahead).is(TokenType.NEWLINE)) {
            while (pos <= lookahead) {
                open.add(advance());
            }
        }

        boolean multiLine = open.get(open.size() - 1).is(TokenType.NEWLINE);
        Body body = parseBody(true, multiLine);
        List<HclToken> close = List.of(expect(TokenType.CBRACE));
        List<HclToken> trailing = parseLineEnd();

        log.debug("Parsed block {} {} at line {}", typeToken.getText(), labels, typeToken.getLine());
        return new Block(typeToken.getText(), labels, leading, header, open, body, close, trailing);
    }

    /**
     * Collects the value tokens of one expression: everything up to the first
     * newline or line comment outside any bracket, brace, paren or template.
     * Inline block comments stay part of the value unless they end it.
     */
    private List<HclToken> parseExpressionTokens() {
        List<HclToken> expression = new ArrayList<>();
        int depth = 0;
        int startLine = peek().getLine();

        while (!isAtEnd()) {
            HclToken token = peek();
            if (depth == 0 && (token.is(TokenType.NEWLINE) || token.isLineComment()
                    || token.is(TokenType.CBRACE))) {
                break;
            }
            if (token.opensNesting()) {
                depth++;
            } else if (token.closesNesting()) {
                depth--;
                if (depth < 0) {
                    throw new ParseException("Unbalanced " + token.getText() + " in expression", fileName, token.getLine());
                }
            }
            expression.add(advance());
        }

        if (depth != 0) {
            throw new ParseException("Unbalanced expression", fileName, startLine);
        }
        while (!expression.isEmpty() && (expression.get(expression.size() - 1).is(TokenType.WHITESPACE)
                || expression.get(expression.size() - 1).is(TokenType.COMMENT))) {
            expression.remove(expression.size() - 1);
            pos--;
        }
        if (expression.isEmpty()) {
            throw new ParseException("Missing expression", fileName, startLine);
        }
        return expression;
    }

    private List<HclToken> parseLineEnd() {
        List<HclToken> trailing = new ArrayList<>();
        while (check(TokenType.WHITESPACE) || check(TokenType.COMMENT)) {
            trailing.add(advance());
        }
        if (check(TokenType.NEWLINE)) {
            trailing.add(advance());
        } else if (!isAtEnd() && !check(TokenType.CBRACE)) {
            throw new ParseException("Expected newline but found " + peek().getType()
                    + " '" + peek().getText() + "'", fileName, peek().getLine());
        }
        return trailing;
    }

    private void skipTrivia(List<HclToken> into) {
        while (!isAtEnd() && peek().isTrivia()) {
            into.add(advance());
        }
    }

    /**
     * Indentation of the line an item starts on, read from its leading trivia.
     * Returns null when the item does not start a line.
     */
    static String indentOf(List<HclToken> leading, boolean atLineStart) {
        int lastNewline = -1;
        for (int i = leading.size() - 1; i >= 0; i--) {
            if (leading.get(i).is(TokenType.NEWLINE)) {
                lastNewline = i;
                break;
            }
        }
        if (lastNewline < 0 && !atLineStart) {
            return null;
        }
        int rest = leading.size() - lastNewline - 1;
        if (rest == 0) {
            return "";
        }
        if (rest == 1 && leading.get(leading.size() - 1).is(TokenType.WHITESPACE)) {
            return leading.get(leading.size() - 1).getText();
        }
        return null;
    }

    private boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    private HclToken peek() {
        return tokens.get(pos);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private HclToken advance() {
        HclToken token = peek();
        if (!isAtEnd()) pos++;
        return token;
    }

    private HclToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException("Expected " + type + " but found " + peek().getType(), fileName, peek().getLine());
    }
}

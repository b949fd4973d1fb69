package com.tfmigrate.parser;

import com.tfmigrate.model.Attribute;
import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclFile;
import com.tfmigrate.model.HclNode;
import com.tfmigrate.model.HclNodeVisitor;
import com.tfmigrate.parser.HclToken.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Serializes a configuration tree back to text.
 * <p>
 * Nodes read from source print their original tokens. Nodes built or
 * rewritten by a transformation are laid out with two spaces per nesting
 * level, and their multi-line expressions are re-indented by bracket nesting.
 */
public class HclWriter implements HclNodeVisitor {
    private static final String INDENT_UNIT = "  ";

    private final StringBuilder out = new StringBuilder();
    private final Deque<String> indents = new ArrayDeque<>();

    public String write(HclFile file) {
        reset();
        writeBody(file.getBody(), "");
        return out.toString();
    }

    /**
     * Writes a single block as if it were a top-level item.
     */
    public String write(Block block) {
        reset();
        indents.push("");
        block.accept(this);
        indents.pop();
        return out.toString();
    }

    /**
     * Joins the text of a token run without any layout.
     */
    public static String toText(List<HclToken> tokens) {
        StringBuilder text = new StringBuilder();
        for (HclToken token : tokens) {
            text.append(token.getText());
        }
        return text.toString();
    }

    @Override
    public void visit(Attribute attribute) {
        String indent = indents.peek();
        if (attribute.isSynthetic()) {
            out.append(attribute.getName()).append(" = ");
            appendExpression(attribute.getExpression(), indent);
            out.append('\n');
            return;
        }

        appendTokens(attribute.getLeading());
        out.append(attribute.getName());
        appendTokens(attribute.getAssignTokens());
        if (attribute.isRewritten()) {
            appendExpression(attribute.getExpression(), lineIndent(attribute, indent));
        } else {
            appendTokens(attribute.getExpression());
        }
        appendTokens(attribute.getTrailing());
    }

    @Override
    public void visit(Block block) {
        String indent = indents.peek();
        if (block.isSynthetic()) {
            out.append(block.getType());
            appendLabels(block.getLabels());
            out.append("{\n");
            writeBody(block.getBody(), bodyIndent(block.getBody(), indent));
            closeLine(indent);
            out.append("}\n");
            return;
        }

        String own = lineIndent(block, indent);
        appendTokens(block.getLeading());
        out.append(block.getType());
        if (block.getHeaderTokens() == null) {
            appendLabels(block.getLabels());
        } else {
            appendTokens(block.getHeaderTokens());
        }
        appendTokens(block.getOpenTokens());
        writeBody(block.getBody(), bodyIndent(block.getBody(), own));
        if (block.getBody().hasSyntheticItems()) {
            closeLine(own);
        }
        appendTokens(block.getCloseTokens());
        appendTokens(block.getTrailing());
    }

    private void writeBody(Body body, String indent) {
        indents.push(indent);
        for (HclNode item : body.getItems()) {
            if (item.isSynthetic()) {
                startSyntheticLine(item instanceof Block);
            }
            item.accept(this);
        }
        if (body.getTrailing() != null) {
            appendTokens(body.getTrailing());
        }
        indents.pop();
    }

    private void startSyntheticLine(boolean block) {
        if (out.length() > 0 && !endsWith("\n")) {
            out.append('\n');
        }
        // top-level blocks are separated by a blank line
        if (block && indents.size() == 1 && out.length() > 0 && !endsWith("\n\n")) {
            out.append('\n');
        }
        out.append(indents.peek());
    }

    private void closeLine(String indent) {
        if (out.length() > 0 && endsWith("\n")) {
            out.append(indent);
        }
    }

    private void appendLabels(List<String> labels) {
        out.append(' ');
        for (String label : labels) {
            out.append('"').append(label).append("\" ");
        }
    }

    /**
     * Writes expression tokens, replacing the indentation after every newline.
     * The brackets a line leaves open form one indentation level, however many
     * there are. A line starting with closing brackets is outdented past every
     * level those brackets reach into.
     */
    private void appendExpression(List<HclToken> tokens, String indent) {
        Deque<Integer> levels = new ArrayDeque<>();
        int lineStart = 0;
        while (lineStart <= tokens.size()) {
            int lineEnd = lineStart;
            while (lineEnd < tokens.size() && !tokens.get(lineEnd).is(TokenType.NEWLINE)) {
                lineEnd++;
            }
            List<HclToken> line = tokens.subList(lineStart, lineEnd);
            int first = 0;
            while (first < line.size() && line.get(first).is(TokenType.WHITESPACE)) {
                first++;
            }

            if (lineStart == 0) {
                appendTokens(line);
            } else if (first < line.size()) {
                Deque<Integer> outdented = new ArrayDeque<>(levels);
                int carried = 0;
                for (int i = first; i < line.size() && isBracketClose(line.get(i)); i++) {
                    carried = closeOne(outdented, carried);
                }
                out.append(indent).append(INDENT_UNIT.repeat(outdented.size()));
                appendTokens(line.subList(first, line.size()));
            }

            // brackets left open by a partly closed level join this line's level
            int carried = 0;
            int opened = 0;
            for (HclToken token : line) {
                if (isBracketOpen(token)) {
                    opened++;
                } else if (isBracketClose(token)) {
                    if (opened > 0) {
                        opened--;
                    } else {
                        carried = closeOne(levels, carried);
                    }
                }
            }
            if (opened + carried > 0) {
                levels.push(opened + carried);
            }

            if (lineEnd < tokens.size()) {
                out.append(tokens.get(lineEnd).getText());
            }
            lineStart = lineEnd + 1;
        }
    }

    /**
     * Closes one bracket against the carried count, or else against the top
     * level, which is removed whole.
     *
     * @return the brackets still open after the close
     */
    private static int closeOne(Deque<Integer> levels, int carried) {
        if (carried > 0) {
            return carried - 1;
        }
        if (levels.isEmpty()) {
            return 0;
        }
        return levels.pop() - 1;
    }

    private void appendTokens(List<HclToken> tokens) {
        if (tokens == null) {
            return;
        }
        for (HclToken token : tokens) {
            out.append(token.getText());
        }
    }

    private static String bodyIndent(Body body, String ownerIndent) {
        return body.getIndent() != null ? body.getIndent() : ownerIndent + INDENT_UNIT;
    }

    private static String lineIndent(HclNode node, String fallback) {
        String indent = HclParser.indentOf(node.getLeading(), false);
        return indent != null ? indent : fallback;
    }

    private static boolean isBracketOpen(HclToken token) {
        return token.is(TokenType.OBRACE) || token.is(TokenType.OBRACK) || token.is(TokenType.OPAREN);
    }

    private static boolean isBracketClose(HclToken token) {
        return token.is(TokenType.CBRACE) || token.is(TokenType.CBRACK) || token.is(TokenType.CPAREN);
    }

    private boolean endsWith(String suffix) {
        int length = out.length();
        return length >= suffix.length() && out.substring(length - suffix.length()).equals(suffix);
    }

    private void reset() {
        out.setLength(0);
        indents.clear();
    }
}

package com.tfmigrate.transform.scan;

import com.tfmigrate.parser.HclToken;

/**
 * Tracks nesting while walking a flat token run: braces, brackets, parens,
 * quoted strings and template interpolations.
 */
public class DepthTracker {
    private int braces;
    private int brackets;
    private int parens;
    private int quotes;
    private int templates;
    private boolean underflow;

    public void track(HclToken token) {
        switch (token.getType()) {
            case OBRACE -> braces++;
            case CBRACE -> braces = decrement(braces);
            case OBRACK -> brackets++;
            case CBRACK -> brackets = decrement(brackets);
            case OPAREN -> parens++;
            case CPAREN -> parens = decrement(parens);
            case OQUOTE, OHEREDOC -> quotes++;
            case CQUOTE, CHEREDOC -> quotes = decrement(quotes);
            case TEMPLATE_INTERP, TEMPLATE_CONTROL -> templates++;
            case TEMPLATE_SEQ_END -> templates = decrement(templates);
            default -> {
            }
        }
    }

    /**
     * True when no structure is open at the current position.
     */
    public boolean isTopLevel() {
        return braces == 0 && brackets == 0 && parens == 0 && quotes == 0 && templates == 0;
    }

    /**
     * True when every structure opened so far was closed, and nothing was closed twice.
     */
    public boolean isBalanced() {
        return isTopLevel() && !underflow;
    }

    private int decrement(int depth) {
        if (depth == 0) {
            underflow = true;
            return 0;
        }
        return depth - 1;
    }
}

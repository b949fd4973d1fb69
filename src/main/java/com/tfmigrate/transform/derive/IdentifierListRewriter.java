package com.tfmigrate.transform.derive;

import com.tfmigrate.parser.HclToken;
import com.tfmigrate.parser.HclToken.TokenType;
import com.tfmigrate.transform.scan.ArrayElement;
import com.tfmigrate.transform.scan.ExpressionScanner;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Rewrites attribute-name lists such as lifecycle {@code ignore_changes}.
 * <p>
 * Each entry is matched on its leading identifier, so {@code tags["env"]}
 * follows a rename of {@code tags}. Removed entries take their separator with
 * them; removing every entry leaves {@code []}.
 */
public final class IdentifierListRewriter {
    private static final Logger log = LoggerFactory.getLogger(IdentifierListRewriter.class);

    private IdentifierListRewriter() {
    }

    /**
     * @param tokens     the list value
     * @param renames    old name to new name; may be null
     * @param validNames names allowed to remain after renaming; null keeps every entry, empty drops them all
     * @return the rewritten list, or the original tokens when they are not a list literal
     */
    public static List<HclToken> rewrite(List<HclToken> tokens, Map<String, String> renames,
                                         Collection<String> validNames) {
        List<HclToken> value = ExpressionScanner.trim(tokens);
        List<ArrayElement> elements = ExpressionScanner.parseArray(value);
        if (elements.isEmpty() && !ExpressionScanner.isEmptyArray(value)) {
            return new ArrayList<>(tokens);
        }

        boolean filter = validNames != null;
        List<List<HclToken>> kept = new ArrayList<>();
        for (ArrayElement element : elements) {
            List<HclToken> entry = new ArrayList<>(element.getTokens());
            HclToken root = entry.get(0);
            if (!root.is(TokenType.IDENTIFIER)) {
                kept.add(entry);
                continue;
            }
            String name = root.getText();
            if (renames != null && renames.containsKey(name)) {
                name = renames.get(name);
                entry.set(0, HclToken.of(TokenType.IDENTIFIER, name));
            }
            if (filter && !validNames.contains(name)) {
                log.debug("Dropping {} from attribute list", name);
                continue;
            }
            kept.add(entry);
        }

        return TokenBuilder.tuple(kept);
    }
}

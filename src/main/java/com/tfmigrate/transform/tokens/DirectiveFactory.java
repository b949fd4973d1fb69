package com.tfmigrate.transform.tokens;

import com.tfmigrate.model.Block;
import com.tfmigrate.parser.HclParser;
import com.tfmigrate.parser.HclToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Creates the sibling directives a migration emits next to a rewritten
 * resource: {@code moved} blocks that record a rename, and {@code import}
 * blocks that adopt existing remote objects.
 */
public final class DirectiveFactory {
    private static final Logger log = LoggerFactory.getLogger(DirectiveFactory.class);

    private DirectiveFactory() {
    }

    /**
     * Creates a {@code moved} block between two addresses, such as
     * {@code cloudflare_record.example} and {@code cloudflare_dns_record.example[0]}.
     */
    public static Block movedBlock(String from, String to) {
        return movedBlock(HclParser.parseExpression(from), HclParser.parseExpression(to));
    }

    public static Block movedBlock(List<HclToken> from, List<HclToken> to) {
        Block block = new Block("moved", List.of());
        block.getBody().setAttributeRaw("from", from);
        block.getBody().setAttributeRaw("to", to);
        log.debug("Created moved block");
        return block;
    }

    /**
     * Creates an {@code import} block adopting the object with a literal id.
     */
    public static Block importBlock(String resourceType, String resourceName, String id) {
        return importBlock(resourceType, resourceName, TokenBuilder.stringLiteral(id));
    }

    /**
     * Creates an {@code import} block whose id is an arbitrary expression.
     */
    public static Block importBlock(String resourceType, String resourceName, List<HclToken> idTokens) {
        Block block = new Block("import", List.of());
        block.getBody().setAttributeRaw("to", TokenBuilder.resourceReference(resourceType, resourceName));
        block.getBody().setAttributeRaw("id", idTokens);
        log.debug("Created import block for {}.{}", resourceType, resourceName);
        return block;
    }
}

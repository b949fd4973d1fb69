package com.tfmigrate.model;

import com.tfmigrate.parser.HclParser;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BodyTest {

    private static final String CONFIG = """
        resource "a" "b" {
          first = 1
          rule {
            x = 1
          }
          second = 2
          rule {
            x = 2
          }
        }
        """;

    @Test
    void testFindBlocksReturnsSnapshot() {
        Body body = resourceBody();

        List<Block> rules = body.findBlocks("rule");
        for (Block rule : rules) {
            body.removeBlock(rule);
        }

        assertThat(rules).hasSize(2);
        assertThat(body.getBlocks()).isEmpty();
        assertThat(body.getAttributes()).extracting(Attribute::getName).containsExactly("first", "second");
    }

    @Test
    void testSetAttributeRawKeepsPosition() {
        Body body = resourceBody();

        body.setAttributeRaw("first", TokenBuilder.simpleValue(10));

        assertThat(body.getItems().get(0)).isInstanceOf(Attribute.class);
        assertThat(body.findAttribute("first").orElseThrow().getExpressionText()).isEqualTo("10");
        assertThat(body.findAttribute("first").orElseThrow().isRewritten()).isTrue();
    }

    @Test
    void testInsertAttributeReplacesExisting() {
        Body body = resourceBody();

        body.insertAttribute(3, "first", TokenBuilder.simpleValue(1));

        assertThat(body.getItems()).hasSize(4);
        assertThat(body.indexOf(body.findAttribute("first").orElseThrow())).isEqualTo(2);
    }

    @Test
    void testRenameAttributeInPlace() {
        Body body = resourceBody();

        assertThat(body.renameAttribute("second", "third")).isTrue();
        assertThat(body.renameAttribute("missing", "other")).isFalse();

        assertThat(body.hasAttribute("second")).isFalse();
        assertThat(body.indexOf(body.findAttribute("third").orElseThrow())).isEqualTo(2);
    }

    @Test
    void testBlockCopyIsDeep() {
        Block original = resourceBody().findBlock("rule").orElseThrow();

        Block copy = original.copy();
        copy.getBody().setAttributeRaw("x", TokenBuilder.simpleValue(99));
        copy.getBody().appendNewBlock("extra", List.of());

        assertThat(original.getBody().findAttribute("x").orElseThrow().getExpressionText()).isEqualTo("1");
        assertThat(original.getBody().getBlocks()).isEmpty();
        assertThat(copy.isSynthetic()).isTrue();
    }

    @Test
    void testGetLabel() {
        Block resource = HclParser.parseConfig(CONFIG, "test.tf").getBlocks().get(0);

        assertThat(resource.getLabel(1)).isEqualTo("b");
        assertThat(resource.getLabel(2)).isNull();
    }

    private Body resourceBody() {
        return HclParser.parseConfig(CONFIG, "test.tf").getBlocks().get(0).getBody();
    }
}

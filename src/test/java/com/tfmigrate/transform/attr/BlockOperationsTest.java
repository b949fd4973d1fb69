package com.tfmigrate.transform.attr;

import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclFile;
import com.tfmigrate.parser.HclParser;
import com.tfmigrate.parser.HclWriter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BlockOperationsTest {

    private static final String POOL = """
        resource "cloudflare_load_balancer_pool" "pool" {
          name = "pool"
          origins {
            address = "192.0.2.1"
            weight  = 1
          }
          origins {
            address = "192.0.2.2"
          }
          load_shedding {
          }
        }
        """;

    @Test
    void testRenameResourceType() {
        HclFile file = parse("resource \"cloudflare_record\" \"example\" {\n  name = \"a\"\n}\n");
        Block resource = file.getBlocks().get(0);

        assertThat(BlockOperations.renameResourceType(resource, "cloudflare_other", "x")).isFalse();
        assertThat(BlockOperations.renameResourceType(resource, "cloudflare_record", "cloudflare_dns_record")).isTrue();

        assertThat(new HclWriter().write(file))
                .isEqualTo("resource \"cloudflare_dns_record\" \"example\" {\n  name = \"a\"\n}\n");
    }

    @Test
    void testRenameResourceTypeNeedsTwoLabels() {
        Block block = new Block("resource", List.of("cloudflare_record"));

        assertThat(BlockOperations.renameResourceType(block, "cloudflare_record", "cloudflare_dns_record")).isFalse();
        assertThat(block.getLabels()).containsExactly("cloudflare_record");
    }

    @Test
    void testResourceTypeAndName() {
        Block resource = new Block("resource", List.of("cloudflare_record", "example"));
        Block data = new Block("data", List.of("cloudflare_zone", "main"));

        assertThat(BlockOperations.getResourceType(resource)).isEqualTo("cloudflare_record");
        assertThat(BlockOperations.getResourceName(resource)).isEqualTo("example");
        assertThat(BlockOperations.getResourceType(data)).isEmpty();
        assertThat(BlockOperations.getResourceName(data)).isEmpty();
        assertThat(BlockOperations.getResourceName(new Block("resource", List.of("only_type")))).isEmpty();
    }

    @Test
    void testFindBlocks() {
        Body body = body(parse(POOL));

        assertThat(BlockOperations.findBlockByType(body, "origins")).isPresent();
        assertThat(BlockOperations.findBlockByType(body, "missing")).isEmpty();
        assertThat(BlockOperations.findBlocksByType(body, "origins")).hasSize(2);
    }

    @Test
    void testRemoveBlocksByType() {
        Body body = body(parse(POOL));

        assertThat(BlockOperations.removeBlocksByType(body, "origins")).isEqualTo(2);
        assertThat(BlockOperations.removeBlocksByType(body, "origins")).isZero();
        assertThat(body.getBlocks()).extracting(Block::getType).containsExactly("load_shedding");
    }

    @Test
    void testRemoveEmptyBlocks() {
        Body body = body(parse(POOL));

        assertThat(BlockOperations.removeEmptyBlocks(body, "load_shedding")).isEqualTo(1);
        assertThat(BlockOperations.removeEmptyBlocks(body, "origins")).isZero();
        assertThat(body.findBlocks("origins")).hasSize(2);
    }

    @Test
    void testProcessBlocksOfTypeInOrder() {
        Body body = body(parse(POOL));
        List<String> addresses = new ArrayList<>();

        BlockOperations.processBlocksOfType(body, "origins",
                block -> addresses.add(AttributeOperations.extractString(
                        block.getBody().findAttribute("address").orElseThrow())));

        assertThat(addresses).containsExactly("192.0.2.1", "192.0.2.2");
    }

    @Test
    void testProcessBlocksOfTypeStopsAtFirstFailure() {
        Body body = body(parse(POOL));
        List<Block> seen = new ArrayList<>();

        assertThatThrownBy(() -> BlockOperations.processBlocksOfType(body, "origins", block -> {
            seen.add(block);
            throw new IOException("cannot process " + block.getType());
        }))
                .isInstanceOf(IOException.class)
                .hasMessage("cannot process origins");
        assertThat(seen).hasSize(1);
    }

    @Test
    void testProcessorMayRemoveBlocks() {
        Body body = body(parse(POOL));

        BlockOperations.processBlocksOfType(body, "origins", body::removeBlock);

        assertThat(body.findBlocks("origins")).isEmpty();
    }

    @Test
    void testHoistAttributeFromBlock() {
        Body body = body(parse(POOL));

        assertThat(BlockOperations.hoistAttributeFromBlock(body, "origins", "weight")).isTrue();
        assertThat(BlockOperations.hoistAttributeFromBlock(body, "origins", "weight")).isFalse();
        assertThat(BlockOperations.hoistAttributeFromBlock(body, "origins", "missing")).isFalse();

        assertThat(body.findAttribute("weight").orElseThrow().getExpressionText()).isEqualTo("1");
        assertThat(body.findBlocks("origins").get(0).getBody().hasAttribute("weight")).isTrue();
    }

    @Test
    void testHoistKeepsExistingParentValue() {
        Body body = body(parse(POOL));

        assertThat(BlockOperations.hoistAttributeFromBlock(body, "origins", "name")).isFalse();
        assertThat(body.findAttribute("name").orElseThrow().getExpressionText()).isEqualTo("\"pool\"");
    }

    @Test
    void testHoistAttributesFromBlock() {
        Body body = body(parse(POOL));

        int hoisted = BlockOperations.hoistAttributesFromBlock(body, "origins", "address", "weight", "missing");

        assertThat(hoisted).isEqualTo(2);
        assertThat(body.findAttribute("address").orElseThrow().getExpressionText()).isEqualTo("\"192.0.2.1\"");
    }

    private HclFile parse(String source) {
        return HclParser.parseConfig(source, "test.tf");
    }

    private Body body(HclFile file) {
        return file.getBlocks().get(0).getBody();
    }
}

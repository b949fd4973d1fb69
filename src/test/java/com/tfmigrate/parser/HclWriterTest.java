package com.tfmigrate.parser;

import com.tfmigrate.model.Block;
import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclFile;
import com.tfmigrate.transform.tokens.TokenBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HclWriterTest {

    @Test
    void testAppendedAttributeUsesBodyIndent() {
        HclFile file = parse("""
            resource "a" "b" {
              name = "x" # keep
            }
            """);
        Body body = file.getBody().getBlocks().get(0).getBody();

        body.setAttributeRaw("zone_id", TokenBuilder.stringLiteral("z"));

        assertThat(write(file)).isEqualTo("""
            resource "a" "b" {
              name = "x" # keep
              zone_id = "z"
            }
            """);
    }

    @Test
    void testRewrittenValueKeepsNameAndComments() {
        HclFile file = parse("""
            resource "a" "b" {
              # the name
              name    = "x" # keep
            }
            """);
        Body body = file.getBody().getBlocks().get(0).getBody();

        body.findAttribute("name").orElseThrow().setExpression(TokenBuilder.stringLiteral("y"));

        assertThat(write(file)).isEqualTo("""
            resource "a" "b" {
              # the name
              name    = "y" # keep
            }
            """);
    }

    @Test
    void testTopLevelBlockIsSeparatedByBlankLine() {
        HclFile file = parse("a = 1\n");
        Block moved = new Block("moved", List.of());
        moved.getBody().setAttributeRaw("from", HclParser.parseExpression("x.a"));
        moved.getBody().setAttributeRaw("to", HclParser.parseExpression("y.a"));

        file.getBody().appendBlock(moved);

        assertThat(write(file)).isEqualTo("a = 1\n\nmoved {\n  from = x.a\n  to = y.a\n}\n");
    }

    @Test
    void testNestedSyntheticBlock() {
        Block resource = new Block("resource", List.of("t", "n"));
        resource.getBody().setAttributeRaw("a", TokenBuilder.simpleValue(1));
        Block lifecycle = resource.getBody().appendNewBlock("lifecycle", List.of());
        lifecycle.getBody().setAttributeRaw("ignore_changes", TokenBuilder.tuple(List.of(TokenBuilder.identifier("a"))));

        assertThat(new HclWriter().write(resource)).isEqualTo("""
            resource "t" "n" {
              a = 1
              lifecycle {
                ignore_changes = [a]
              }
            }
            """);
    }

    @Test
    void testMultiLineValueIsReindented() {
        HclFile file = parse("""
            outer {
              inner {
                x = 1
              }
            }
            """);
        Body inner = file.getBody().getBlocks().get(0).getBody().getBlocks().get(0).getBody();

        inner.setAttributeRaw("items", TokenBuilder.multilineTuple(List.of(
                TokenBuilder.object(Map.of("k", TokenBuilder.simpleValue("v"))))));

        assertThat(write(file)).isEqualTo("""
            outer {
              inner {
                x = 1
                items = [
                  {
                    k = "v"
                  }
                ]
              }
            }
            """);
    }

    @Test
    void testPartlyClosedBracketsOutdentTheirLine() {
        HclFile file = HclFile.empty();
        file.getBody().setAttributeRaw("x",
                HclParser.parseExpression("concat([\n{\na = 1\n}\n], [for v in var.l : {\nb = v\n}])"));

        assertThat(write(file)).isEqualTo("""
            x = concat([
              {
                a = 1
              }
            ], [for v in var.l : {
              b = v
            }])
            """);
    }

    @Test
    void testRenamedLabelsAreRegenerated() {
        HclFile file = parse("""
            resource  "old_type"   "name" {
              a = 1
            }
            """);

        file.getBody().getBlocks().get(0).setLabels(List.of("new_type", "name"));

        assertThat(write(file)).isEqualTo("""
            resource "new_type" "name" {
              a = 1
            }
            """);
    }

    @Test
    void testToText() {
        assertThat(HclWriter.toText(TokenBuilder.resourceReference("a", "b"))).isEqualTo("a.b");
    }

    private HclFile parse(String source) {
        return HclParser.parseConfig(source, "test.tf");
    }

    private String write(HclFile file) {
        return new HclWriter().write(file);
    }
}

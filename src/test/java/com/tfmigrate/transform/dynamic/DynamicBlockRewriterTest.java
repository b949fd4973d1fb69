package com.tfmigrate.transform.dynamic;

import com.tfmigrate.model.Body;
import com.tfmigrate.model.HclFile;
import com.tfmigrate.parser.HclParser;
import com.tfmigrate.parser.HclWriter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DynamicBlockRewriterTest {

    @Test
    void testRewriteWithExplicitIterator() {
        HclFile file = parse("""
            resource "cloudflare_load_balancer_pool" "pool" {
              name = "pool"
              dynamic "origins" {
                for_each = var.origins
                iterator = origin
                content {
                  address = origin.value.address
                  enabled = true
                }
              }
            }
            """);

        boolean changed = DynamicBlockRewriter.rewrite(body(file), "origins");

        assertThat(changed).isTrue();
        assertThat(write(file)).isEqualTo("""
            resource "cloudflare_load_balancer_pool" "pool" {
              name = "pool"
              origins = [for value in var.origins : {
                address = value.address
                enabled = true
              }]
            }
            """);
    }

    @Test
    void testDefaultIteratorAndKey() {
        HclFile file = parse("""
            resource "r" "x" {
              dynamic "header" {
                for_each = var.headers
                content {
                  name  = header.key
                  value = header.value
                }
              }
            }
            """);

        DynamicBlockRewriter.rewrite(body(file), "header", "headers");

        assertThat(body(file).findAttribute("headers").orElseThrow().getExpressionText())
                .isEqualTo("[for key, value in var.headers : {\nname = key\nvalue = value\n}]");
    }

    @Test
    void testStaticAndDynamicBlocksAreConcatenated() {
        HclFile file = parse("""
            resource "r" "x" {
              origins {
                address = "a"
              }
              dynamic "origins" {
                for_each = var.origins
                content {
                  address = origins.value
                }
              }
            }
            """);

        DynamicBlockRewriter.rewrite(body(file), "origins");

        assertThat(write(file)).isEqualTo("""
            resource "r" "x" {
              origins = concat([
                {
                  address = "a"
                }
              ], [for value in var.origins : {
                address = value
              }])
            }
            """);
    }

    @Test
    void testNestedBlocksInsideContent() {
        HclFile file = parse("""
            resource "r" "x" {
              dynamic "rule" {
                for_each = var.rules
                iterator = r
                content {
                  action = r.value.action
                  match {
                    ip = r.value.ip
                  }
                }
              }
            }
            """);

        DynamicBlockRewriter.rewrite(body(file), "rule");

        assertThat(write(file)).isEqualTo("""
            resource "r" "x" {
              rule = [for value in var.rules : {
                action = value.action
                match = {
                  ip = value.ip
                }
              }]
            }
            """);
    }

    @Test
    void testMissingContentLeavesBodyUntouched() {
        String source = """
            resource "r" "x" {
              dynamic "origins" {
                for_each = var.origins
              }
            }
            """;
        HclFile file = parse(source);

        assertThat(DynamicBlockRewriter.rewrite(body(file), "origins")).isFalse();
        assertThat(write(file)).isEqualTo(source);
    }

    @Test
    void testOtherLabelsAreIgnored() {
        String source = """
            resource "r" "x" {
              dynamic "other" {
                for_each = var.x
                content {
                  a = other.value
                }
              }
            }
            """;
        HclFile file = parse(source);

        assertThat(DynamicBlockRewriter.findDynamicBlocks(body(file), "origins")).isEmpty();
        assertThat(DynamicBlockRewriter.rewrite(body(file), "origins")).isFalse();
        assertThat(write(file)).isEqualTo(source);
    }

    @Test
    void testNestedAccessIsNotAnIteratorReference() {
        HclFile file = parse("""
            resource "r" "x" {
              dynamic "o" {
                for_each = var.o
                content {
                  a = local.o.value
                }
              }
            }
            """);

        DynamicBlockRewriter.rewrite(body(file), "o");

        assertThat(body(file).findAttribute("o").orElseThrow().getExpressionText()).contains("a = local.o.value");
    }

    @Test
    void testNestedDynamicBlock() {
        HclFile file = parse("""
            resource "r" "x" {
              dynamic "rule" {
                for_each = var.rules
                content {
                  name = rule.value.name
                  dynamic "header" {
                    for_each = rule.value.headers
                    content {
                      key = header.value.k
                    }
                  }
                }
              }
            }
            """);

        assertThat(DynamicBlockRewriter.rewrite(body(file), "rule")).isTrue();

        assertThat(body(file).findAttribute("rule").orElseThrow().getExpressionText()).isEqualTo(
                "[for value in var.rules : {\nname = value.name\nheader = [for value in value.headers : {\nkey = value.k\n}]\n}]");
    }

    @Test
    void testNestedTemplateReadingOuterIteratorIsLeftAlone() {
        String source = """
            resource "r" "x" {
              dynamic "rule" {
                for_each = var.rules
                content {
                  dynamic "header" {
                    for_each = rule.value.headers
                    content {
                      key  = header.value.k
                      rule = rule.value.name
                    }
                  }
                }
              }
            }
            """;
        HclFile file = parse(source);

        assertThat(DynamicBlockRewriter.rewrite(body(file), "rule")).isFalse();
        assertThat(write(file)).isEqualTo(source);
    }

    @Test
    void testIncompleteNestedDynamicLeavesBodyUntouched() {
        String source = """
            resource "r" "x" {
              dynamic "rule" {
                for_each = var.rules
                content {
                  action = rule.value.action
                  dynamic "header" {
                    for_each = rule.value.headers
                  }
                }
              }
            }
            """;
        HclFile file = parse(source);

        assertThat(DynamicBlockRewriter.rewrite(body(file), "rule")).isFalse();
        assertThat(write(file)).isEqualTo(source);
        assertThat(body(file).hasAttribute("rule")).isFalse();
    }

    private HclFile parse(String source) {
        return HclParser.parseConfig(source, "test.tf");
    }

    private Body body(HclFile file) {
        return file.getBlocks().get(0).getBody();
    }

    private String write(HclFile file) {
        return new HclWriter().write(file);
    }
}

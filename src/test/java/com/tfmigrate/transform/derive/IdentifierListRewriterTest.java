package com.tfmigrate.transform.derive;

import com.tfmigrate.parser.HclParser;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static com.tfmigrate.parser.HclWriter.toText;
import static org.assertj.core.api.Assertions.*;

class IdentifierListRewriterTest {

    @Test
    void testRenameThenFilter() {
        String renamed = rewrite("[A, C]", Map.of("A", "B"), null);
        assertThat(renamed).isEqualTo("[B, C]");

        String filtered = rewrite(renamed, null, Set.of("B"));
        assertThat(filtered).isEqualTo("[B]");

        assertThat(rewrite(filtered, null, Set.of("X"))).isEqualTo("[]");
    }

    @Test
    void testIndexedEntryFollowsItsRoot() {
        assertThat(rewrite("[tags[\"env\"], name]", Map.of("tags", "labels"), Set.of("labels")))
                .isEqualTo("[labels[\"env\"]]");
    }

    @Test
    void testEmptyValidSetDropsEverything() {
        assertThat(rewrite("[a, b]", Map.of(), Set.of())).isEqualTo("[]");
    }

    @Test
    void testNullValidSetKeepsEverything() {
        assertThat(rewrite("[a, b]", Map.of(), null)).isEqualTo("[a, b]");
    }

    @Test
    void testMultiLineListIsNormalized() {
        assertThat(rewrite("[\n  a,\n  b,\n]", Map.of("b", "c"), null)).isEqualTo("[a, c]");
    }

    @Test
    void testNonListIsReturnedUnchanged() {
        assertThat(rewrite("all", Map.of("all", "x"), Set.of("y"))).isEqualTo("all");
        assertThat(rewrite("[]", Map.of(), Set.of("y"))).isEqualTo("[]");
    }

    private String rewrite(String list, Map<String, String> renames, Set<String> validNames) {
        return toText(IdentifierListRewriter.rewrite(HclParser.parseExpression(list), renames, validNames));
    }
}

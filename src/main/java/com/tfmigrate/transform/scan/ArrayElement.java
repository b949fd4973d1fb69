package com.tfmigrate.transform.scan;

import com.tfmigrate.parser.HclToken;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One entry of an array-shaped attribute value.
 *
 * Scalars carry only their tokens; objects also carry a field map whose keys
 * keep the order they were declared in.
 */
@Value
@Builder
public class ArrayElement {

    @NonNull
    ElementType type;

    /**
     * The element's tokens, without surrounding whitespace.
     */
    @NonNull
    List<HclToken> tokens;

    /**
     * Field name to value tokens, populated for objects only.
     */
    @NonNull
    @Builder.Default
    Map<String, List<HclToken>> fields = Map.of();

    public boolean isObject() {
        return type == ElementType.OBJECT;
    }

    public Optional<List<HclToken>> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Map<String, List<HclToken>> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Literal content of a plain quoted string, without the quotes.
     */
    public Optional<String> stringValue() {
        if (type != ElementType.STRING) {
            return Optional.empty();
        }
        StringBuilder value = new StringBuilder();
        for (HclToken token : tokens) {
            if (token.is(HclToken.TokenType.QUOTED_LIT)) {
                value.append(token.getText());
            }
        }
        return Optional.of(value.toString());
    }
}

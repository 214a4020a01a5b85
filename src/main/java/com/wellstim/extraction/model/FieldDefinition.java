package com.wellstim.extraction.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of a field table: the entity property a value lands in, how it is
 * coerced, how long it may be, and the ordered patterns that capture it.
 *
 * Patterns are tried in list order and the first one whose group 1 captures
 * non-blank text wins. Later patterns are never consulted after a hit.
 */
@Getter
public final class FieldDefinition {

    private final String name;
    private final ValueKind kind;
    private final int maxLength;          // 0 = unbounded
    private final boolean identity;
    private final List<Pattern> patterns;

    private FieldDefinition(String name, ValueKind kind, int maxLength,
                            boolean identity, List<Pattern> patterns) {
        this.name = name;
        this.kind = kind;
        this.maxLength = maxLength;
        this.identity = identity;
        this.patterns = patterns;
    }

    public static FieldDefinition of(String name, ValueKind kind, int maxLength, String... regexes) {
        return new FieldDefinition(name, kind, maxLength, false, compile(regexes));
    }

    public static FieldDefinition identity(String name, ValueKind kind, int maxLength, String... regexes) {
        return new FieldDefinition(name, kind, maxLength, true, compile(regexes));
    }

    /**
     * The value substituted when nothing usable was parsed, or null when the
     * field must stay missing. Identity fields always stay missing.
     */
    public Object getMissingDefault() {
        return identity ? null : kind.getMissingDefault();
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    @Override
    public String toString() {
        return name + "(" + kind + ")";
    }
}

package com.wellstim.extraction.service;

import com.wellstim.extraction.model.FieldDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs field pattern cascades over report text.
 *
 * Knows nothing about wells: every field is described by a
 * {@link FieldDefinition} and evaluated by the same first-match routine.
 */
@Service
@Slf4j
public class FieldExtractionEngine {

    private static final Pattern CARRIAGE_RETURN = Pattern.compile("\r");

    /**
     * Raw captures for every field of the table, in table order. A field whose
     * cascade never matched maps to {@link Optional#empty()}.
     */
    public Map<String, Optional<String>> extractFields(String text, List<FieldDefinition> fields) {
        String normalized = normalizeText(text);
        Map<String, Optional<String>> raw = new LinkedHashMap<>();

        for (FieldDefinition field : fields) {
            Optional<String> value = extractFirstMatch(normalized, field.getPatterns());
            if (value.isEmpty()) {
                log.debug("No pattern matched field '{}'", field.getName());
            }
            raw.put(field.getName(), value);
        }
        return raw;
    }

    /**
     * Tries each pattern in order until one captures non-blank text in group 1.
     * Later patterns are never tried once one succeeds.
     */
    public Optional<String> extractFirstMatch(String text, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find() && m.groupCount() > 0) {
                String value = m.group(1);
                if (value != null && !value.isBlank()) {
                    return Optional.of(value.trim());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Groups 1 and 2 of a composite pattern spanning two labels, or empty when
     * it does not match.
     */
    public Optional<String[]> extractPair(String text, Pattern composite) {
        Matcher m = composite.matcher(normalizeText(text));
        if (m.find() && m.groupCount() >= 2 && m.group(1) != null && m.group(2) != null) {
            return Optional.of(new String[] {m.group(1).trim(), m.group(2).trim()});
        }
        return Optional.empty();
    }

    /**
     * Everything after {@code label} up to the next line that opens with a
     * capitalised label-like token and a separator, or to the end of the text.
     */
    public Optional<String> extractBlock(String text, String label) {
        Pattern block = Pattern.compile(
                Pattern.quote(label) + "[:#\\s-]+(.+?)(?=\\n(?-i:[A-Z])[^\\n]{0,40}[:#\\s-]|\\z)",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

        Matcher m = block.matcher(normalizeText(text));
        if (m.find()) {
            String value = m.group(1).trim();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    static String normalizeText(String text) {
        return text == null ? "" : CARRIAGE_RETURN.matcher(text).replaceAll("");
    }
}

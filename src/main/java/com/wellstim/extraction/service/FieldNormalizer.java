package com.wellstim.extraction.service;

import com.wellstim.extraction.model.FieldDefinition;
import com.wellstim.extraction.model.ParsedRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringEscapeUtils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Coerces captured strings into typed values.
 *
 * Every method is total: bad input yields null ("missing"), never an
 * exception and never a default. Defaults are only introduced by
 * {@link #applyDefaults}.
 */
@Slf4j
public final class FieldNormalizer {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern CONTROL_BREAKS = Pattern.compile("[\\r\\n\\t]+");
    private static final Pattern NON_PRINTABLE = Pattern.compile("[^\\x09\\x0A\\x0D\\x20-\\x7E]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern UNICODE_DASHES = Pattern.compile("[\\u2010-\\u2015\\u2212\\uFE58\\uFE63\\uFF0D]");
    private static final Pattern SPACE_AROUND_HYPHEN = Pattern.compile("\\s*-\\s*");
    private static final Pattern SPACE_BETWEEN_DIGITS = Pattern.compile("(?<=\\d)\\s+(?=\\d)");
    private static final Pattern NOT_API_CHAR = Pattern.compile("[^0-9A-Za-z-]");

    // Tried in order, first success wins: 01/02/2020, 01/02/20, 2020-01-02
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
            new DateTimeFormatterBuilder()
                    .appendPattern("M/d/")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
                    .toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT)
    );

    private FieldNormalizer() {
    }

    // ─── STRINGS ───────────────────────────────────────────────────────

    public static String cleanString(String value) {
        if (value == null) return null;

        String unescaped = StringEscapeUtils.unescapeHtml4(value);
        String withoutTags = HTML_TAG.matcher(unescaped).replaceAll(" ");
        String withoutBreaks = CONTROL_BREAKS.matcher(withoutTags).replaceAll(" ");
        String printable = NON_PRINTABLE.matcher(withoutBreaks).replaceAll(" ");
        String cleaned = WHITESPACE.matcher(printable).replaceAll(" ").trim();

        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Canonical API number: ASCII hyphens only, no whitespace, nothing but
     * letters, digits and hyphens. A whitespace gap between two digits is a
     * group separator and becomes a hyphen, so "42 123 45678" and
     * "42-123-45678" agree.
     */
    public static String canonicalizeApi(String value) {
        if (value == null) return null;

        // dashes first: cleaning would turn them into spaces
        String cleaned = cleanString(UNICODE_DASHES.matcher(value).replaceAll("-"));
        if (cleaned == null) return null;

        cleaned = SPACE_AROUND_HYPHEN.matcher(cleaned).replaceAll("-");
        cleaned = SPACE_BETWEEN_DIGITS.matcher(cleaned).replaceAll("-");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("");
        cleaned = NOT_API_CHAR.matcher(cleaned).replaceAll("");

        return cleaned.isEmpty() ? null : cleaned;
    }

    public static String limitLength(String value, int maxLength) {
        if (value == null || maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    // ─── NUMBERS ───────────────────────────────────────────────────────

    public static Double toDouble(String value) {
        if (value == null) return null;
        String stripped = value.replace(",", "").trim();
        try {
            double parsed = Double.parseDouble(stripped);
            if (!Double.isFinite(parsed)) {
                log.debug("Rejected non-finite number '{}'", value);
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.debug("Failed to parse '{}' as a number", value);
            return null;
        }
    }

    /** Parses as a decimal, then truncates toward zero: "12.9" gives 12. */
    public static Integer toInteger(String value) {
        Double parsed = toDouble(value);
        if (parsed == null) return null;
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            log.debug("Integer out of range '{}'", value);
            return null;
        }
        return parsed.intValue();
    }

    // ─── DATES ─────────────────────────────────────────────────────────

    public static LocalDate toDate(String value) {
        if (value == null) return null;
        String trimmed = value.trim();

        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", trimmed, format);
            }
        }
        log.debug("Failed to parse '{}' as a date", value);
        return null;
    }

    // ─── FIELD TABLE ───────────────────────────────────────────────────

    /**
     * Coerces one raw capture according to its field's kind and length bound.
     */
    public static Object normalize(FieldDefinition field, String raw) {
        return switch (field.getKind()) {
            case STRING     -> limitLength(cleanString(raw), field.getMaxLength());
            case API_NUMBER -> limitLength(canonicalizeApi(raw), field.getMaxLength());
            case DOUBLE     -> toDouble(raw);
            case INTEGER    -> toInteger(raw);
            case DATE       -> toDate(raw);
        };
    }

    /**
     * Returns a copy of {@code record} where every missing, defaultable field
     * of the table holds its default. Identity fields are left as they are.
     */
    public static ParsedRecord applyDefaults(ParsedRecord record, List<FieldDefinition> fields) {
        ParsedRecord updated = new ParsedRecord(record);
        for (FieldDefinition field : fields) {
            Object fallback = field.getMissingDefault();
            if (fallback != null && !updated.isPresent(field.getName())) {
                updated.put(field.getName(), fallback);
            }
        }
        return updated;
    }
}

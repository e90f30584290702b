package com.pipeline.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pipeline.model.transform.FieldCoercions;
import org.springframework.web.util.HtmlUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The typed coercions a {@code fields} entry may request. None of them throws: a value that cannot
 * be coerced is either left unchanged or rendered empty, depending on the coercion.
 */
final class ValueCoercions {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_YEAR = 9999;

    private static final Map<Character, String> STRFTIME = Map.ofEntries(
            Map.entry('Y', "yyyy"), Map.entry('y', "yy"), Map.entry('m', "MM"), Map.entry('d', "dd"),
            Map.entry('H', "HH"), Map.entry('I', "hh"), Map.entry('M', "mm"), Map.entry('S', "ss"),
            Map.entry('p', "a"), Map.entry('b', "MMM"), Map.entry('B', "MMMM"), Map.entry('a', "EEE"),
            Map.entry('A', "EEEE"), Map.entry('j', "DDD"), Map.entry('Z', "zzz"), Map.entry('z', "xx"));

    private final ZoneId zone;

    ValueCoercions(ZoneId zone) {
        this.zone = zone;
    }

    JsonNode apply(JsonNode value, FieldCoercions coercions) {
        JsonNode result = value;
        if (coercions.cleanHtml() && result.isTextual()) {
            result = TextNode.valueOf(cleanHtml(result.textValue()));
        }
        if (coercions.timestampFormat() != null) {
            result = TextNode.valueOf(formatEpochSeconds(result, coercions.timestampFormat()));
        }
        if (coercions.toInt()) {
            result = toInteger(result);
        }
        if (coercions.toStr()) {
            result = TextNode.valueOf(JsonValues.asText(result));
        }
        return result;
    }

    /**
     * Removes markup, decodes entities and collapses whitespace.
     */
    static String cleanHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = TAG.matcher(text).replaceAll("");
        String unescaped = HtmlUtils.htmlUnescape(stripped);
        return WHITESPACE.matcher(unescaped).replaceAll(" ").strip();
    }

    String formatEpochSeconds(JsonNode value, String format) {
        if (!value.isNumber() || value.decimalValue().signum() <= 0) {
            return "";
        }
        try {
            BigDecimal seconds = value.decimalValue();
            long whole = seconds.toBigInteger().longValueExact();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            ZonedDateTime time = Instant.ofEpochSecond(whole, nanos).atZone(zone);
            if (time.getYear() > MAX_YEAR) {
                return "";
            }
            return DateTimeFormatter.ofPattern(toJavaPattern(format), Locale.ENGLISH).format(time);
        } catch (ArithmeticException | DateTimeException | IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * Translates strftime directives ({@code %Y-%m-%d}) into a {@code java.time} pattern, quoting
     * the literal text in between. Formats without {@code %} are taken as {@code java.time} patterns.
     */
    static String toJavaPattern(String format) {
        if (format.indexOf('%') < 0) {
            return format;
        }
        StringBuilder pattern = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                char directive = format.charAt(++i);
                String mapped = STRFTIME.get(directive);
                if (mapped != null) {
                    flushLiteral(pattern, literal);
                    pattern.append(mapped);
                } else {
                    literal.append(directive == '%' ? "%" : "%" + directive);
                }
            } else {
                literal.append(c);
            }
        }
        flushLiteral(pattern, literal);
        return pattern.toString();
    }

    private static void flushLiteral(StringBuilder pattern, StringBuilder literal) {
        if (literal.length() > 0) {
            pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
            literal.setLength(0);
        }
    }

    /**
     * Numbers truncate toward zero, integer text parses; anything else is returned unchanged.
     */
    static JsonNode toInteger(JsonNode value) {
        BigInteger integer;
        if (value.isNumber()) {
            integer = value.isIntegralNumber() ? value.bigIntegerValue() : value.decimalValue().toBigInteger();
        } else if (value.isBoolean()) {
            integer = value.booleanValue() ? BigInteger.ONE : BigInteger.ZERO;
        } else if (value.isTextual()) {
            try {
                integer = new BigInteger(value.textValue().strip().replace("_", ""));
            } catch (NumberFormatException e) {
                return value;
            }
        } else {
            return value;
        }
        if (integer.bitLength() < Integer.SIZE) {
            return IntNode.valueOf(integer.intValue());
        }
        if (integer.bitLength() < Long.SIZE) {
            return LongNode.valueOf(integer.longValue());
        }
        return BigIntegerNode.valueOf(integer);
    }
}

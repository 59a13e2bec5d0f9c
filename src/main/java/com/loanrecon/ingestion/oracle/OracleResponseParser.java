package com.loanrecon.ingestion.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanrecon.domain.ExtractedField;
import com.loanrecon.domain.FieldValue;
import com.loanrecon.domain.FinalityIndicator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coerces the oracle's loosely typed JSON into {@link OracleJudgment}. Accepts snake_case or camelCase keys;
 * a field may be a bare scalar or {"value": ..., "page": n}.
 */
@Component
public class OracleResponseParser {

    private static final Pattern NUMERIC = Pattern.compile("^-?\\(?\\$?\\s*-?[0-9][0-9,]*(\\.[0-9]+)?\\)?\\s*%?$");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/uuuu", Locale.US).withResolverStyle(ResolverStyle.STRICT)
    );

    private final ObjectMapper objectMapper;

    public OracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OracleJudgment parse(String body) {
        if (body == null || body.isBlank()) {
            throw new OracleException("Empty oracle response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new OracleException("Failed to parse oracle response", e);
        }
        if (root == null || !root.isObject()) {
            throw new OracleException("Oracle response is not a JSON object");
        }
        String typeLabel = FieldValue.text(text(root, "type_label", "typeLabel")).asText().orElse(null);
        String hint = FieldValue.text(text(root, "grouping_hint", "groupingHint")).asText().orElse(null);
        FinalityIndicator finality = FinalityIndicator.parse(text(root, "finality", "finality"));
        Boolean signed = toValue(node(root, "has_signature", "hasSignature")).asBool().orElse(null);
        LocalDate documentDate = toValue(node(root, "document_date", "documentDate")).asDate().orElse(null);

        Map<String, ExtractedField> fields = new LinkedHashMap<>();
        JsonNode fieldsNode = root.get("fields");
        if (fieldsNode != null && fieldsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                fields.put(e.getKey(), toField(e.getValue()));
            }
        }
        return new OracleJudgment(typeLabel, hint, finality, signed, documentDate, fields);
    }

    ExtractedField toField(JsonNode node) {
        if (node != null && node.isObject()) {
            JsonNode page = node.get("page");
            Integer p = page != null && page.canConvertToInt() && page.asInt() > 0 ? page.asInt() : null;
            return new ExtractedField(toValue(node.get("value")), p);
        }
        return new ExtractedField(toValue(node), null);
    }

    /**
     * Coercion order for strings: boolean words, numbers (currency/percent/thousands), ISO and US dates, text.
     */
    public FieldValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldValue.missing();
        }
        if (node.isBoolean()) {
            return FieldValue.bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return FieldValue.number(node.decimalValue());
        }
        if (node.isTextual()) {
            return coerce(node.textValue());
        }
        return FieldValue.text(node.toString());
    }

    public FieldValue coerce(String raw) {
        if (raw == null || raw.isBlank()) {
            return FieldValue.missing();
        }
        String s = raw.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("yes")) {
            return FieldValue.bool(true);
        }
        if (lower.equals("false") || lower.equals("no")) {
            return FieldValue.bool(false);
        }
        if (lower.equals("null") || lower.equals("n/a") || lower.equals("none")) {
            return FieldValue.missing();
        }
        if (NUMERIC.matcher(s).matches()) {
            BigDecimal n = parseNumber(s);
            if (n != null) {
                return FieldValue.number(n);
            }
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return FieldValue.date(LocalDate.parse(s, f));
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return FieldValue.text(s);
    }

    private static BigDecimal parseNumber(String s) {
        boolean negative = s.startsWith("-") || (s.startsWith("(") && s.endsWith(")"));
        String digits = s.replaceAll("[$,%()\\s-]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            BigDecimal n = new BigDecimal(digits);
            return negative ? n.negate() : n;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static JsonNode node(JsonNode root, String snake, String camel) {
        JsonNode n = root.get(snake);
        return n != null ? n : root.get(camel);
    }

    private static String text(JsonNode root, String snake, String camel) {
        JsonNode n = node(root, snake, camel);
        return n == null || n.isNull() ? null : n.asText();
    }
}

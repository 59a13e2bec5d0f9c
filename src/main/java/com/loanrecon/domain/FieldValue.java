package com.loanrecon.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Strict internal value type for oracle-supplied judgments: Missing | Text | Number | Date | Bool.
 * Oracle JSON is coerced into this at the boundary; nothing untyped reaches the deterministic core.
 */
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class FieldValue {

    private static final FieldValue MISSING = new FieldValue(Kind.MISSING, null, null, null, null);

    private Kind kind;
    private String text;
    private BigDecimal number;
    private LocalDate date;
    private Boolean bool;

    private FieldValue(Kind kind, String text, BigDecimal number, LocalDate date, Boolean bool) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.date = date;
        this.bool = bool;
    }

    public static FieldValue missing() {
        return MISSING;
    }

    public static FieldValue text(String text) {
        return text == null || text.isBlank() ? MISSING : new FieldValue(Kind.TEXT, text.trim(), null, null, null);
    }

    public static FieldValue number(BigDecimal number) {
        return number == null ? MISSING : new FieldValue(Kind.NUMBER, null, number, null, null);
    }

    public static FieldValue date(LocalDate date) {
        return date == null ? MISSING : new FieldValue(Kind.DATE, null, null, date, null);
    }

    public static FieldValue bool(Boolean bool) {
        return bool == null ? MISSING : new FieldValue(Kind.BOOL, null, null, null, bool);
    }

    public boolean isMissing() {
        return kind == null || kind == Kind.MISSING;
    }

    public Optional<BigDecimal> asNumber() {
        return kind == Kind.NUMBER ? Optional.ofNullable(number) : Optional.empty();
    }

    public Optional<LocalDate> asDate() {
        return kind == Kind.DATE ? Optional.ofNullable(date) : Optional.empty();
    }

    public Optional<Boolean> asBool() {
        return kind == Kind.BOOL ? Optional.ofNullable(bool) : Optional.empty();
    }

    public Optional<String> asText() {
        return kind == Kind.TEXT ? Optional.ofNullable(text) : Optional.empty();
    }

    /** Human-readable rendering for evidence bundles and result messages. */
    public String display() {
        if (isMissing()) {
            return null;
        }
        return switch (kind) {
            case TEXT -> text;
            case NUMBER -> number.toPlainString();
            case DATE -> date.toString();
            case BOOL -> bool.toString();
            default -> null;
        };
    }

    @Override
    public String toString() {
        return isMissing() ? "MISSING" : kind + "(" + display() + ")";
    }

    public enum Kind {
        MISSING,
        TEXT,
        NUMBER,
        DATE,
        BOOL
    }
}

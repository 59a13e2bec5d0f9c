package com.loanrecon.ingestion.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanrecon.domain.FieldValue;
import com.loanrecon.domain.FinalityIndicator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OracleResponseParserTest {

    private final OracleResponseParser parser = new OracleResponseParser(new ObjectMapper());

    @Test
    @DisplayName("snake_case payload is coerced into typed values with page citations")
    void parse_snakeCasePayload() {
        String body = """
                {
                  "type_label": "closing_disclosure",
                  "grouping_hint": "cd-2024",
                  "finality": "Final",
                  "has_signature": "yes",
                  "document_date": "03/15/2024",
                  "fields": {
                    "loan_amount": {"value": "$412,500.00", "page": 1},
                    "apr": {"value": "6.875%", "page": 5},
                    "prepayment_penalty": false,
                    "closing_date": "2024-03-22",
                    "lender": "Acme Mortgage",
                    "hoa_dues": "N/A"
                  }
                }
                """;

        OracleJudgment j = parser.parse(body);

        assertThat(j.typeLabel()).isEqualTo("closing_disclosure");
        assertThat(j.groupingHint()).isEqualTo("cd-2024");
        assertThat(j.finality()).isEqualTo(FinalityIndicator.FINAL);
        assertThat(j.hasSignature()).isTrue();
        assertThat(j.documentDate()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(j.fields().get("loan_amount").getValue().asNumber()).hasValueSatisfying(
                n -> assertThat(n).isEqualByComparingTo("412500.00"));
        assertThat(j.fields().get("loan_amount").getPage()).isEqualTo(1);
        assertThat(j.fields().get("apr").getValue().asNumber()).hasValueSatisfying(
                n -> assertThat(n).isEqualByComparingTo("6.875"));
        assertThat(j.fields().get("prepayment_penalty").getValue()).isEqualTo(FieldValue.bool(false));
        assertThat(j.fields().get("closing_date").getValue()).isEqualTo(FieldValue.date(LocalDate.of(2024, 3, 22)));
        assertThat(j.fields().get("lender").getValue()).isEqualTo(FieldValue.text("Acme Mortgage"));
        assertThat(j.fields().get("hoa_dues").hasValue()).isFalse();
    }

    @Test
    void parse_camelCaseKeysAndMissingFinality() {
        OracleJudgment j = parser.parse("{\"typeLabel\":\"appraisal\",\"hasSignature\":true}");

        assertThat(j.typeLabel()).isEqualTo("appraisal");
        assertThat(j.finality()).isEqualTo(FinalityIndicator.UNKNOWN);
        assertThat(j.hasSignature()).isTrue();
        assertThat(j.fields()).isEmpty();
    }

    @Test
    void coerce_parenthesesAreNegative() {
        assertThat(parser.coerce("(1,250.50)").asNumber()).hasValueSatisfying(
                n -> assertThat(n).isEqualByComparingTo(new BigDecimal("-1250.50")));
    }

    @Test
    void coerce_impossibleUsDateStaysText() {
        assertThat(parser.coerce("02/30/2024").getKind()).isEqualTo(FieldValue.Kind.TEXT);
        assertThat(parser.coerce("02/30/2024").asText()).contains("02/30/2024");
        assertThat(parser.coerce("2/29/2024").asDate()).contains(LocalDate.of(2024, 2, 29));
    }

    @Test
    void coerce_onlyFullBooleanWordsBecomeBool() {
        assertThat(parser.coerce("Y").asText()).contains("Y");
        assertThat(parser.coerce("n").getKind()).isEqualTo(FieldValue.Kind.TEXT);
        assertThat(parser.coerce("Yes").asBool()).contains(true);
        assertThat(parser.coerce("NO").asBool()).contains(false);
    }

    @Test
    void parse_invalidJson_throwsOracleException() {
        assertThatThrownBy(() -> parser.parse("not json")).isInstanceOf(OracleException.class);
        assertThatThrownBy(() -> parser.parse("  ")).isInstanceOf(OracleException.class);
        assertThatThrownBy(() -> parser.parse("[1,2]")).isInstanceOf(OracleException.class);
    }
}

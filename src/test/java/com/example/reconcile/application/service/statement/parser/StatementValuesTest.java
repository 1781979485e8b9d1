package com.example.reconcile.application.service.statement.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the cell helpers shared by the statement parsers.
 */
class StatementValuesTest {

    /**
     * Currency symbols, separators and indicators are stripped before parsing.
     *
     * @param raw      cell text
     * @param expected parsed magnitude
     */
    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "1,234.50;1234.50",
            "Rs. 450;450",
            "INR 99.99;99.99",
            "₹ 2,000;2000",
            "(350.00);350.00",
            "-75;75",
            "120.00 Cr;120.00",
            "450.00Cr;450.00",
            "1,250.75DR;1250.75",
            "99.50-Dr;99.50",
            "+15;15"
    })
    void parseAmountStripsDecorations(String raw, String expected) {
        assertThat(StatementValues.parseAmount(raw)).isEqualByComparingTo(new BigDecimal(expected));
    }

    /**
     * Unparseable and empty cells count as zero.
     */
    @Test
    void parseAmountDefaultsToZero() {
        assertThat(StatementValues.parseAmount(null)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(StatementValues.parseAmount("n/a")).isEqualByComparingTo(BigDecimal.ZERO);
    }

    /**
     * Descriptions are whitespace-collapsed.
     */
    @Test
    void cleanDescriptionCollapsesWhitespace() {
        assertThat(StatementValues.cleanDescription("  UPI /  Zomato\n Order ")).isEqualTo("UPI / Zomato Order");
        assertThat(StatementValues.cleanDescription(null)).isEmpty();
    }
}

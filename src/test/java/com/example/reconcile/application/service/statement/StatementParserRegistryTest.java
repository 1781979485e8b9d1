package com.example.reconcile.application.service.statement;

import com.example.reconcile.application.service.statement.parser.AxisSavingsStatementParser;
import com.example.reconcile.application.service.statement.parser.GenericStatementParser;
import com.example.reconcile.application.service.statement.parser.IciciCreditCardStatementParser;
import com.example.reconcile.application.service.statement.parser.IciciSavingsStatementParser;
import com.example.reconcile.domain.model.statement.AccountType;
import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.ParserSettings;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link StatementParserRegistry}.
 */
class StatementParserRegistryTest {

    private final StatementParserRegistry registry = new StatementParserRegistry(List.of(
            new IciciSavingsStatementParser(),
            new IciciCreditCardStatementParser(),
            new AxisSavingsStatementParser(),
            new GenericStatementParser()
    ));

    /**
     * Bank and account type select the dedicated parser.
     */
    @Test
    void resolvesByBankAndAccountType() {
        BankFormatProfile profile = BankFormatProfile.of("ICICI", AccountType.CREDIT_CARD, Map.of());

        assertThat(registry.resolve(profile)).isInstanceOf(IciciCreditCardStatementParser.class);
    }

    /**
     * An explicit parser key overrides the derived one.
     */
    @Test
    void explicitParserKeyWins() {
        BankFormatProfile profile = new BankFormatProfile("kotak", "Kotak", AccountType.SAVINGS, null, Map.of(),
                ParserSettings.defaults().withParserKey("axis_savings"));

        assertThat(registry.resolve(profile)).isInstanceOf(AxisSavingsStatementParser.class);
    }

    /**
     * Unknown banks fall back to the generic parser.
     */
    @Test
    void fallsBackToGenericParser() {
        BankFormatProfile profile = BankFormatProfile.of("kotak", AccountType.CURRENT, Map.of());

        assertThat(registry.resolve(profile).key()).isEqualTo(GenericStatementParser.KEY);
    }

    /**
     * Registering two parsers with the same key is a configuration error.
     */
    @Test
    void rejectsDuplicateKeys() {
        assertThrows(IllegalStateException.class, () -> new StatementParserRegistry(List.of(
                new GenericStatementParser(), new GenericStatementParser())));
    }

    /**
     * The generic fallback is mandatory.
     */
    @Test
    void requiresGenericParser() {
        assertThrows(IllegalStateException.class,
                () -> new StatementParserRegistry(List.of(new IciciSavingsStatementParser())));
    }
}

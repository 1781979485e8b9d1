package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.AccountType;
import com.example.reconcile.domain.model.statement.BankFormatProfile;
import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementParseResult;
import com.example.reconcile.domain.model.statement.TransactionType;
import com.example.reconcile.infrastructure.tabular.TabularData;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.example.reconcile.application.service.statement.parser.IciciSavingsStatementParserTest.row;
import static com.example.reconcile.application.service.statement.parser.IciciSavingsStatementParserTest.table;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the ICICI credit card parser.
 */
class IciciCreditCardStatementParserTest {

    private final IciciCreditCardStatementParser parser = new IciciCreditCardStatementParser();
    private final BankFormatProfile profile = BankFormatProfile.of("icici", AccountType.CREDIT_CARD, Map.of());

    /**
     * The billing sign marks credits, everything else on a card is a debit, and card extras land in metadata.
     */
    @Test
    void usesBillingSignAndKeepsCardExtras() {
        TabularData table = table(
                row("Customer Name", "A. Sharma", null, null, null, null, null),
                row("Date", "Sr.No.", "Transaction Details", "Reward Point Header", "Intl.Amount", "Amount(in Rs)",
                        "BillingAmountSign"),
                row("10/01/2024", "8801", "AMAZON PAY INDIA", "12", null, "1,250.00", null),
                row("12/01/2024", "8802", "NETFLIX.COM USD", "4", "15.49", "1,290.00", null),
                row("20/01/2024", "8803", "BBPS PAYMENT", "0", null, "5,000.00", "CR")
        );

        StatementParseResult result = parser.parse(table, profile);

        List<CanonicalTransaction> transactions = result.transactions();
        assertThat(transactions).hasSize(3);
        assertThat(transactions).extracting(CanonicalTransaction::type)
                .containsExactly(TransactionType.DEBIT, TransactionType.DEBIT, TransactionType.CREDIT);
        assertThat(transactions.get(0).date()).isEqualTo(LocalDate.of(2024, 1, 10));
        assertThat(transactions.get(0).reference()).isEqualTo("8801");
        assertThat(transactions.get(0).balance()).isNull();
        assertThat(transactions.get(0).metadata()).containsEntry("reward_points", "12")
                .doesNotContainKey("international_amount");
        assertThat(transactions.get(1).metadata()).containsEntry("international_amount", "15.49");
        assertThat(transactions.get(2).amount()).isEqualByComparingTo(new BigDecimal("5000.00"));
    }

    /**
     * Without a billing sign or Cr/Dr column, refund and payment wording marks a credit.
     */
    @Test
    void fallsBackToDescriptionKeywords() {
        TabularData table = table(
                row("Date", "Transaction Details", "Amount(in Rs)"),
                row("05/02/2024", "FLIPKART REFUND", "799.00"),
                row("06/02/2024", "Payment Received - Thank you", "10,000.00"),
                row("07/02/2024", "SWIGGY", "420.00")
        );

        StatementParseResult result = parser.parse(table, profile);

        assertThat(result.transactions()).extracting(CanonicalTransaction::type)
                .containsExactly(TransactionType.CREDIT, TransactionType.CREDIT, TransactionType.DEBIT);
    }
}

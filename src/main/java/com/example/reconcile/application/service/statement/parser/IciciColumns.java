package com.example.reconcile.application.service.statement.parser;

import com.example.reconcile.domain.model.statement.StatementField;

import java.util.List;
import java.util.Map;

/**
 * Header aliases and defaults shared by the ICICI parsers. ICICI exports have changed column names
 * several times, so every field carries a long list of variants.
 */
final class IciciColumns {

    static final Map<StatementField, List<String>> ACCOUNT_ALIASES = Map.of(
            StatementField.DATE, List.of("Value Date", "Transaction Date", "Date", "Txn Date", "Posting Date", "Tran Date"),
            StatementField.NARRATION, List.of("Transaction Remarks", "Description", "Narration", "Particulars", "Details",
                    "Remarks", "Transaction Details"),
            StatementField.REFERENCE, List.of("Cheque Number", "Chq No", "Transaction ID", "Reference", "Ref No",
                    "Reference Number", "Txn ID", "Chq./Ref.No."),
            StatementField.AMOUNT, List.of("Transaction Amount(INR)", "Transaction Amount (INR)", "Transaction Amount",
                    "Amount", "Amount (INR)", "Amount(INR)"),
            StatementField.WITHDRAWAL, List.of("Withdrawal Amount(INR)", "Withdrawal Amount (INR)", "Withdrawal Amount",
                    "Withdrawal", "Debit", "Dr", "Debit Amount", "Debit(INR)"),
            StatementField.DEPOSIT, List.of("Deposit Amount(INR)", "Deposit Amount (INR)", "Deposit Amount", "Deposit",
                    "Credit", "Cr", "Credit Amount", "Credit(INR)"),
            StatementField.BALANCE, List.of("Balance(INR)", "Balance (INR)", "Available Balance(INR)", "Balance",
                    "Closing Balance", "Running Balance", "Available Balance"),
            StatementField.CR_DR, List.of("Cr/Dr", "CR/DR", "Type", "Dr/Cr", "Transaction Type")
    );

    static final List<String> ACCOUNT_HEADER_INDICATORS = List.of(
            "Transaction ID", "Value Date", "S No.", "Transaction Remarks", "Withdrawal Amount", "Transaction Amount");

    static final List<String> SKIP_PATTERNS = List.of(
            "opening balance", "closing balance", "statement summary", "total", "transactions list",
            "account number", "statement period", "search", "advanced search");

    static final List<String> DATE_FORMATS = List.of("dd-MM-yyyy", "dd/MM/yyyy");

    private IciciColumns() {
    }
}

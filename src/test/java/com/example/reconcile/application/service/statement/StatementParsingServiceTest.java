package com.example.reconcile.application.service.statement;

import com.example.reconcile.application.exception.BankProfileNotFoundException;
import com.example.reconcile.application.service.statement.parser.AxisSavingsStatementParser;
import com.example.reconcile.application.service.statement.parser.GenericStatementParser;
import com.example.reconcile.application.service.statement.parser.IciciSavingsStatementParser;
import com.example.reconcile.domain.model.SourceDocument;
import com.example.reconcile.domain.model.statement.AccountType;
import com.example.reconcile.domain.model.statement.CanonicalTransaction;
import com.example.reconcile.domain.model.statement.StatementParseResult;
import com.example.reconcile.domain.model.statement.TransactionType;
import com.example.reconcile.infrastructure.config.BankProfileProperties;
import com.example.reconcile.infrastructure.config.StatementProperties;
import com.example.reconcile.infrastructure.tabular.CsvTableReader;
import com.example.reconcile.infrastructure.tabular.SpreadsheetTableReader;
import com.example.reconcile.infrastructure.tabular.TestWorkbooks;
import com.example.reconcile.infrastructure.tabular.StatementFileReader;

import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link StatementParsingService} with the real CSV and spreadsheet readers.
 */
class StatementParsingServiceTest {

    private StatementParsingService service;

    @BeforeEach
    void setUp() {
        StatementFileReader fileReader = new StatementFileReader(new CsvTableReader(), new SpreadsheetTableReader(),
                StatementProperties.defaults());
        StatementParserRegistry registry = new StatementParserRegistry(List.of(
                new IciciSavingsStatementParser(), new AxisSavingsStatementParser(), new GenericStatementParser()));
        BankProfileProperties properties = new BankProfileProperties(List.of(
                new BankProfileProperties.ProfileEntry("axis", "Axis Bank", "savings", "csv",
                        Map.of("date", "Tran Date", "narration", "PARTICULARS", "withdrawal", "DR",
                                "deposit", "CR", "balance", "BAL"),
                        null, null, List.of("%d-%m-%Y"), null, null, null, null),
                new BankProfileProperties.ProfileEntry("icici", "ICICI Bank", "savings", "xlsx",
                        Map.of("date", "Value Date", "description", "Transaction Remarks",
                                "withdrawal", "Withdrawal Amount(INR)", "deposit", "Deposit Amount(INR)",
                                "balance", "Balance(INR)"),
                        null, null, null, null, null, null, null)
        ));
        service = new StatementParsingService(fileReader, registry, new BankFormatProfileCatalog(properties));
    }

    /**
     * A CSV export is parsed end to end through the configured Axis profile.
     */
    @Test
    void parsesCsvThroughConfiguredProfile() {
        String csv = "Tran Date,PARTICULARS,CHQNO,DR,CR,BAL\n"
                + "01-03-2024,UPI/Zomato/Order,,450.00,,4550.00\n"
                + "02-03-2024,NEFT/Salary,,,60000.00,64550.00\n";
        SourceDocument file = new SourceDocument(csv.getBytes(StandardCharsets.UTF_8), "text/csv", "axis.csv");

        StatementParseResult result = service.parse(file, "axis", AccountType.SAVINGS);

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.transactions()).extracting(CanonicalTransaction::type)
                .containsExactly(TransactionType.DEBIT, TransactionType.CREDIT);
        assertThat(result.transactions().get(0).date()).isEqualTo(LocalDate.of(2024, 3, 1));
    }

    /**
     * An XLSX workbook with typed date and numeric cells is parsed through the ICICI profile.
     */
    @Test
    void parsesXlsxWorkbook() throws IOException {
        SourceDocument file = new SourceDocument(workbook(), null, "icici-statement.xlsx");

        StatementParseResult result = service.parse(file, "icici", AccountType.SAVINGS);

        assertThat(result.errors()).isEmpty();
        assertThat(result.transactions()).hasSize(2);
        CanonicalTransaction debit = result.transactions().get(0);
        assertThat(debit.date()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(debit.type()).isEqualTo(TransactionType.DEBIT);
        assertThat(debit.amount()).isEqualByComparingTo(new BigDecimal("1499"));
        assertThat(debit.balance()).isEqualByComparingTo(new BigDecimal("8501"));
        assertThat(result.transactions().get(1).type()).isEqualTo(TransactionType.CREDIT);
    }

    /**
     * Unsupported extensions are reported as a failed result instead of an exception.
     */
    @Test
    void reportsUnsupportedExtension() {
        SourceDocument file = new SourceDocument("%PDF-1.4".getBytes(StandardCharsets.US_ASCII), "application/pdf",
                "statement.pdf");

        StatementParseResult result = service.parse(file, "axis", AccountType.SAVINGS);

        assertThat(result.transactions()).isEmpty();
        assertThat(result.errors()).singleElement()
                .satisfies(error -> assertThat(error).contains("Unsupported statement file format"));
    }

    /**
     * An empty upload is a failed result.
     */
    @Test
    void reportsEmptyFile() {
        StatementParseResult result = service.parse(new SourceDocument(new byte[0], "text/csv", "axis.csv"),
                "axis", AccountType.SAVINGS);

        assertThat(result.errors()).containsExactly("Statement file is empty.");
    }

    /**
     * A corrupt workbook is a failed result that mentions the read failure.
     */
    @Test
    void reportsUnreadableWorkbook() {
        SourceDocument file = new SourceDocument("not a workbook".getBytes(StandardCharsets.US_ASCII), null,
                "broken.xlsx");

        StatementParseResult result = service.parse(file, "icici", AccountType.SAVINGS);

        assertThat(result.transactions()).isEmpty();
        assertThat(result.errors()).singleElement()
                .satisfies(error -> assertThat(error).startsWith("Unable to read the spreadsheet statement."));
    }

    /**
     * A workbook with a malformed workbook part is a failed result, not an exception.
     */
    @Test
    void reportsDamagedWorkbookPart() throws IOException {
        byte[] damaged = TestWorkbooks.replaceEntry(workbook(), "xl/workbook.xml", "<workbook><broken");

        StatementParseResult result = service.parse(new SourceDocument(damaged, null, "icici.xlsx"),
                "icici", AccountType.SAVINGS);

        assertThat(result.transactions()).isEmpty();
        assertThat(result.errors()).singleElement()
                .satisfies(error -> assertThat(error).startsWith("Unable to read the spreadsheet statement."));
    }

    /**
     * A format mismatch between the profile and the file is a warning, not an error.
     */
    @Test
    void warnsOnFormatMismatch() {
        String csv = "Value Date,Transaction Remarks,Withdrawal Amount(INR),Deposit Amount(INR)\n"
                + "15/01/2024,POS STORE,100.00,\n";
        SourceDocument file = new SourceDocument(csv.getBytes(StandardCharsets.UTF_8), "text/csv", "icici.csv");

        StatementParseResult result = service.parse(file, "icici", AccountType.SAVINGS);

        assertThat(result.transactions()).hasSize(1);
        assertThat(result.warnings()).contains("Profile expects XLSX but the file is CSV.");
    }

    /**
     * Asking for a bank without a configured profile fails fast.
     */
    @Test
    void unknownProfileIsRejected() {
        SourceDocument file = new SourceDocument("a,b".getBytes(StandardCharsets.UTF_8), "text/csv", "x.csv");

        assertThrows(BankProfileNotFoundException.class, () -> service.parse(file, "hdfc", AccountType.CURRENT));
    }

    private static byte[] workbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Statement");
            short dateFormat = workbook.getCreationHelper().createDataFormat().getFormat("dd/mm/yyyy");
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(dateFormat);

            sheet.createRow(0).createCell(0).setCellValue("Detailed Statement");
            Row header = sheet.createRow(2);
            String[] headers = {"S No.", "Value Date", "Transaction Remarks", "Withdrawal Amount(INR)",
                    "Deposit Amount(INR)", "Balance(INR)"};
            for (int i = 0; i < headers.length; i++) {
                header.createCell(i).setCellValue(headers[i]);
            }
            addRow(sheet, 3, dateStyle, LocalDate.of(2024, 1, 15), "UPI/AMAZON", 1499, 0, 8501);
            addRow(sheet, 4, dateStyle, LocalDate.of(2024, 1, 16), "NEFT/REFUND", 0, 250, 8751);

            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static void addRow(Sheet sheet, int index, CellStyle dateStyle, LocalDate date,
                               String remarks, double withdrawal, double deposit, double balance) {
        Row row = sheet.createRow(index);
        row.createCell(0).setCellValue(index - 2);
        row.createCell(1).setCellValue(date);
        row.getCell(1).setCellStyle(dateStyle);
        row.createCell(2).setCellValue(remarks);
        row.createCell(3).setCellValue(withdrawal);
        row.createCell(4).setCellValue(deposit);
        row.createCell(5).setCellValue(balance);
    }
}

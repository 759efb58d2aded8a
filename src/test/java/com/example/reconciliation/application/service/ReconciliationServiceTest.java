package com.example.reconciliation.application.service;

import com.example.reconciliation.WorkbookFixtures;
import com.example.reconciliation.application.reconciliation.AmountParser;
import com.example.reconciliation.application.reconciliation.PartnerPinExtractor;
import com.example.reconciliation.application.reconciliation.ReconciliationMatcher;
import com.example.reconciliation.application.reconciliation.SettlementNormalizer;
import com.example.reconciliation.application.reconciliation.StatementNormalizer;
import com.example.reconciliation.config.ReconciliationProperties;
import com.example.reconciliation.domain.exception.MissingColumnException;
import com.example.reconciliation.domain.exception.ReconciliationFileRequiredException;
import com.example.reconciliation.domain.exception.TableNotFoundException;
import com.example.reconciliation.domain.exception.TablePathRequiredException;
import com.example.reconciliation.domain.exception.UnsupportedTableFormatException;
import com.example.reconciliation.domain.model.Classification;
import com.example.reconciliation.domain.model.IssueKind;
import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.domain.model.ReconcileOutcome;
import com.example.reconciliation.domain.model.ReconciliationReport;
import com.example.reconciliation.domain.model.ReconciliationResult;
import com.example.reconciliation.domain.model.RowIssue;
import com.example.reconciliation.domain.model.SourceType;
import com.example.reconciliation.infrastructure.csv.OpenCsvTableReader;
import com.example.reconciliation.infrastructure.excel.PoiWorkbookTableReader;
import com.example.reconciliation.infrastructure.exception.TableReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.example.reconciliation.LedgerFixtures.rows;
import static com.example.reconciliation.LedgerFixtures.settlement;
import static com.example.reconciliation.LedgerFixtures.settlementRow;
import static com.example.reconciliation.LedgerFixtures.statement;
import static com.example.reconciliation.LedgerFixtures.statementRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests covering a full reconciliation run from uploads to report.
 */
class ReconciliationServiceTest {

    private final ReconciliationService service = newService(new ReconciliationProperties());

    /**
     * Duplicated statement pin with a Cancel and a Dollar Received row against one settlement row.
     */
    @Test
    void cancelOfDuplicateMatchesTheSettlement() {
        ReconciliationReport report = service.reconcile(
                statement(rows(
                        statementRow("Cancel", "Payment to PIN12345678901", "50.00"),
                        statementRow("Dollar Received", "Transfer PIN12345678901", "50.00"))),
                settlement(rows(settlementRow("12345678901", "", "48.00", "1.0"))));

        assertThat(report.summary().statementRecords()).isEqualTo(2);
        assertThat(report.summary().statementEligible()).isEqualTo(1);
        assertThat(report.summary().settlementEligible()).isEqualTo(1);
        assertThat(report.results()).singleElement()
                .satisfies(result -> {
                    assertThat(result.classification()).isEqualTo(Classification.PRESENT_IN_BOTH);
                    assertThat(result.settlementAmountUsd()).isEqualByComparingTo("48.00");
                    assertThat(result.amountVariance()).isEqualTo(new BigDecimal("-2.00"));
                });
    }

    @Test
    void reconcilesUploadedCsvFiles() throws IOException {
        ReconciliationReport report = service.reconcile(upload("statement", "statement.csv"),
                upload("settlement", "settlement.csv"));

        assertThat(report.statementFileName()).isEqualTo("statement.csv");
        assertThat(report.settlementFileName()).isEqualTo("settlement.csv");
        assertThat(report.results())
                .extracting(r -> r.pin().value(), ReconciliationResult::classification,
                        ReconciliationResult::amountVariance, ReconciliationResult::outcome)
                .containsExactly(
                        tuple("12345678901", Classification.PRESENT_IN_BOTH, new BigDecimal("-2.00"), ReconcileOutcome.AMOUNT_MISMATCH),
                        tuple("22222222222", Classification.PRESENT_IN_SETTLEMENT_ONLY, null, ReconcileOutcome.MISSING_IN_STATEMENT),
                        tuple("55555555555", Classification.PRESENT_IN_STATEMENT_ONLY, null, ReconcileOutcome.MISSING_IN_SETTLEMENT),
                        tuple("66666666666", Classification.PRESENT_IN_BOTH, new BigDecimal("0.00"), ReconcileOutcome.RECONCILED),
                        tuple("98765432109", Classification.PRESENT_IN_BOTH, new BigDecimal("-2.45"), ReconcileOutcome.AMOUNT_MISMATCH));
        assertThat(report.issues())
                .extracting(RowIssue::source, RowIssue::rowNumber, RowIssue::kind)
                .containsExactly(
                        tuple(SourceType.STATEMENT, 17, IssueKind.MALFORMED_KEY),
                        tuple(SourceType.STATEMENT, 18, IssueKind.UNPARSEABLE_AMOUNT),
                        tuple(SourceType.SETTLEMENT, 8, IssueKind.DIVISION_BY_ZERO));
        assertThat(report.summary().skippedRows()).isEqualTo(3);
        assertThat(report.summary().count(Classification.PRESENT_IN_BOTH)).isEqualTo(3);
        assertThat(report.summary().count(ReconcileOutcome.RECONCILED)).isEqualTo(1);
    }

    @Test
    void reconcilesFilesOnDisk() throws URISyntaxException {
        ReconciliationReport report = service.reconcile(fixturePath("statement.csv"), fixturePath("settlement.csv"));

        assertThat(report.results()).hasSize(5);
    }

    @Test
    void bothUploadsAreRequired() throws IOException {
        MockMultipartFile statementFile = upload("statement", "statement.csv");
        MockMultipartFile empty = new MockMultipartFile("settlement", new byte[0]);

        ReconciliationFileRequiredException ex = assertThrows(ReconciliationFileRequiredException.class,
                () -> service.reconcile(statementFile, empty));
        assertThat(ex.getMessage()).contains("Settlement");
        assertThrows(ReconciliationFileRequiredException.class, () -> service.reconcile(null, statementFile));
    }

    @Test
    void rejectsUploadsThatAreNeitherCsvNorWorkbook() throws IOException {
        MockMultipartFile pdf = new MockMultipartFile("statement", "statement.pdf", "application/pdf", new byte[]{1, 2, 3});

        UnsupportedTableFormatException ex = assertThrows(UnsupportedTableFormatException.class,
                () -> service.reconcile(pdf, upload("settlement", "settlement.csv")));
        assertThat(ex.getMessage()).contains("statement.pdf");
    }

    @Test
    void corruptWorkbookFailsAsReadError() throws IOException {
        MockMultipartFile workbook = new MockMultipartFile("statement", "statement.xlsx",
                WorkbookFixtures.XLSX_CONTENT_TYPE, new byte[]{1, 2, 3});

        assertThrows(TableReadException.class,
                () -> service.reconcile(workbook, upload("settlement", "settlement.csv")));
    }

    /**
     * Both ledgers as Excel exports, with the settlement PartnerPin, payout and rate stored as numbers.
     */
    @Test
    void reconcilesUploadedWorkbooks() {
        byte[] statementWorkbook = WorkbookFixtures.xlsx(statement(rows(
                statementRow("Cancel", "Payment to PIN12345678901", "50.00"),
                statementRow("Payment", "Payment to PIN55555555555", "12.5"))), 11);
        byte[] settlementWorkbook = WorkbookFixtures.xlsx(settlement(rows(
                settlementRow("12345678901", "", "4800", "100"),
                settlementRow("77712345678", "", "30", "1"))), 3, 10, 12);

        ReconciliationReport report = service.reconcile(
                new MockMultipartFile("statement", "statement.xlsx", WorkbookFixtures.XLSX_CONTENT_TYPE, statementWorkbook),
                new MockMultipartFile("settlement", "settlement.xlsx", WorkbookFixtures.XLSX_CONTENT_TYPE, settlementWorkbook));

        assertThat(report.issues()).isEmpty();
        assertThat(report.results())
                .extracting(r -> r.pin().value(), ReconciliationResult::classification,
                        ReconciliationResult::amountVariance, ReconciliationResult::outcome)
                .containsExactly(
                        tuple("12345678901", Classification.PRESENT_IN_BOTH, new BigDecimal("-2.00"), ReconcileOutcome.AMOUNT_MISMATCH),
                        tuple("55555555555", Classification.PRESENT_IN_STATEMENT_ONLY, null, ReconcileOutcome.MISSING_IN_SETTLEMENT),
                        tuple("77712345678", Classification.PRESENT_IN_SETTLEMENT_ONLY, null, ReconcileOutcome.MISSING_IN_STATEMENT));
    }

    @Test
    void workbookAndCsvGiveTheSameReport() throws IOException, URISyntaxException {
        RawTable csvStatement = new OpenCsvTableReader().read(fixture("statement.csv"), "statement.csv");
        MockMultipartFile workbookStatement = new MockMultipartFile("statement", "statement-export",
                WorkbookFixtures.XLSX_CONTENT_TYPE, WorkbookFixtures.xlsx(csvStatement));

        ReconciliationReport fromWorkbook = service.reconcile(workbookStatement, upload("settlement", "settlement.csv"));
        ReconciliationReport fromCsv = service.reconcile(fixturePath("statement.csv"), fixturePath("settlement.csv"));

        assertThat(fromWorkbook.results()).isEqualTo(fromCsv.results());
        assertThat(fromWorkbook.issues()).isEqualTo(fromCsv.issues());
    }

    @Test
    void reconcilesWorkbooksOnDisk(@TempDir Path dir) throws IOException, URISyntaxException {
        Path statementPath = dir.resolve("statement.xlsx");
        Files.write(statementPath, WorkbookFixtures.xlsx(statement(rows(
                statementRow("Payment", "Payment to PIN22222222222", "10.00")))));

        ReconciliationReport report = service.reconcile(statementPath, fixturePath("settlement.csv"));

        assertThat(report.statementFileName()).isEqualTo("statement.xlsx");
        assertThat(report.results()).extracting(r -> r.pin().value()).contains("22222222222");
    }

    @Test
    void rejectsFilesOnDiskWithUnknownExtension(@TempDir Path dir) throws IOException, URISyntaxException {
        Path notes = Files.writeString(dir.resolve("statement.txt"), "a,b");

        assertThrows(UnsupportedTableFormatException.class,
                () -> service.reconcile(notes, fixturePath("settlement.csv")));
    }

    @Test
    void acceptsCsvContentTypeWithoutCsvExtension() throws IOException {
        MockMultipartFile statementFile = new MockMultipartFile("statement", "statement-export", "text/csv",
                fixture("statement.csv"));

        ReconciliationReport report = service.reconcile(statementFile, upload("settlement", "settlement.csv"));

        assertThat(report.statementFileName()).isEqualTo("statement-export");
    }

    @Test
    void missingColumnFailsTheWholeRun() throws IOException {
        MissingColumnException ex = assertThrows(MissingColumnException.class, () -> service.reconcile(
                upload("statement", "statement.csv"), upload("settlement", "settlement-missing-columns.csv")));

        assertThat(ex.getColumn()).isEqualTo("K");
    }

    @Test
    void pathsAreValidated() throws URISyntaxException {
        Path settlementPath = fixturePath("settlement.csv");

        assertThrows(TablePathRequiredException.class, () -> service.reconcile(null, settlementPath));
        assertThrows(TableNotFoundException.class,
                () -> service.reconcile(Path.of("does-not-exist.csv"), settlementPath));
    }

    @Test
    void sameInputGivesSameReport() throws IOException {
        ReconciliationReport first = service.reconcile(upload("statement", "statement.csv"),
                upload("settlement", "settlement.csv"));
        ReconciliationReport second = service.reconcile(upload("statement", "statement.csv"),
                upload("settlement", "settlement.csv"));

        assertThat(second.results()).isEqualTo(first.results());
        assertThat(second.issues()).isEqualTo(first.issues());
    }

    private static ReconciliationService newService(ReconciliationProperties properties) {
        PartnerPinExtractor extractor = new PartnerPinExtractor();
        AmountParser amountParser = new AmountParser();
        return new ReconciliationService(
                new OpenCsvTableReader(),
                new PoiWorkbookTableReader(),
                new StatementNormalizer(extractor, amountParser, properties),
                new SettlementNormalizer(extractor, amountParser, properties),
                new ReconciliationMatcher(properties));
    }

    private static MockMultipartFile upload(String parameter, String fixture) throws IOException {
        return new MockMultipartFile(parameter, fixture, "text/csv", fixture(fixture));
    }

    private static byte[] fixture(String name) throws IOException {
        try (InputStream input = ReconciliationServiceTest.class.getResourceAsStream("/fixtures/" + name)) {
            return Objects.requireNonNull(input, name).readAllBytes();
        }
    }

    private static Path fixturePath(String name) throws URISyntaxException {
        return Path.of(Objects.requireNonNull(ReconciliationServiceTest.class.getResource("/fixtures/" + name)).toURI());
    }
}

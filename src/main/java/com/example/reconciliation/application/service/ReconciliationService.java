package com.example.reconciliation.application.service;

import com.example.reconciliation.application.reconciliation.ReconciliationMatcher;
import com.example.reconciliation.application.reconciliation.SettlementNormalizer;
import com.example.reconciliation.application.reconciliation.StatementNormalizer;
import com.example.reconciliation.domain.exception.ReconciliationFileRequiredException;
import com.example.reconciliation.domain.exception.TableNotFoundException;
import com.example.reconciliation.domain.exception.TablePathRequiredException;
import com.example.reconciliation.domain.exception.UnsupportedTableFormatException;
import com.example.reconciliation.domain.model.MatchingResult;
import com.example.reconciliation.domain.model.NormalizationResult;
import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.domain.model.ReconcileOutcome;
import com.example.reconciliation.domain.model.ReconciliationReport;
import com.example.reconciliation.domain.model.ReconciliationSummary;
import com.example.reconciliation.domain.model.RowIssue;
import com.example.reconciliation.domain.model.SettlementRecord;
import com.example.reconciliation.domain.model.SourceType;
import com.example.reconciliation.domain.model.StatementRecord;
import com.example.reconciliation.domain.model.TableFormat;
import com.example.reconciliation.infrastructure.csv.OpenCsvTableReader;
import com.example.reconciliation.infrastructure.excel.PoiWorkbookTableReader;
import com.example.reconciliation.infrastructure.exception.TableReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that runs one reconciliation.
 * It validates the two uploads, reads them through the CSV or workbook adapter, and hands the raw tables
 * to the normalizers and the matcher. Nothing is kept between runs.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final OpenCsvTableReader csvReader;
    private final PoiWorkbookTableReader workbookReader;
    private final StatementNormalizer statementNormalizer;
    private final SettlementNormalizer settlementNormalizer;
    private final ReconciliationMatcher matcher;

    /**
     * Creates the service with the table adapters and the reconciliation engine.
     *
     * @param csvReader            reads CSV uploads into raw tables
     * @param workbookReader       reads Excel uploads into raw tables
     * @param statementNormalizer  tags the partner statement
     * @param settlementNormalizer tags the processor settlement
     * @param matcher              joins both eligible sets
     */
    public ReconciliationService(OpenCsvTableReader csvReader,
                                 PoiWorkbookTableReader workbookReader,
                                 StatementNormalizer statementNormalizer,
                                 SettlementNormalizer settlementNormalizer,
                                 ReconciliationMatcher matcher) {
        this.csvReader = csvReader;
        this.workbookReader = workbookReader;
        this.statementNormalizer = statementNormalizer;
        this.settlementNormalizer = settlementNormalizer;
        this.matcher = matcher;
    }

    /**
     * Reconciles two uploaded ledgers.
     *
     * @param statementFile  partner statement, CSV or Excel
     * @param settlementFile processor settlement, CSV or Excel
     * @return classified, variance-annotated report
     * @throws ReconciliationFileRequiredException when either upload is missing or empty
     * @throws UnsupportedTableFormatException     when an upload is neither CSV nor an Excel workbook
     * @throws TableReadException                  when an upload cannot be read
     */
    public ReconciliationReport reconcile(MultipartFile statementFile, MultipartFile settlementFile) {
        TableFormat statementFormat = validateUpload(statementFile, SourceType.STATEMENT);
        TableFormat settlementFormat = validateUpload(settlementFile, SourceType.SETTLEMENT);
        return reconcile(readUpload(statementFile, statementFormat), readUpload(settlementFile, settlementFormat));
    }

    /**
     * Reconciles two ledgers stored on disk.
     *
     * @param statementPath  partner statement, {@code .csv}, {@code .xlsx} or {@code .xls}
     * @param settlementPath processor settlement, {@code .csv}, {@code .xlsx} or {@code .xls}
     * @return classified, variance-annotated report
     * @throws TablePathRequiredException      when a path is {@code null}
     * @throws TableNotFoundException          when a path does not exist
     * @throws UnsupportedTableFormatException when a file extension is not recognized
     */
    public ReconciliationReport reconcile(Path statementPath, Path settlementPath) {
        TableFormat statementFormat = validatePath(statementPath, SourceType.STATEMENT);
        TableFormat settlementFormat = validatePath(settlementPath, SourceType.SETTLEMENT);
        return reconcile(readPath(statementPath, statementFormat), readPath(settlementPath, settlementFormat));
    }

    /**
     * Runs the engine on two raw tables. Structural failures abort the whole run; row-level
     * problems end up in {@link ReconciliationReport#issues()}.
     *
     * @param statement  raw statement table
     * @param settlement raw settlement table
     * @return classified, variance-annotated report
     */
    public ReconciliationReport reconcile(RawTable statement, RawTable settlement) {
        log.info("Reconciling statement '{}' ({} rows) against settlement '{}' ({} rows)",
                statement.name(), statement.size(), settlement.name(), settlement.size());

        NormalizationResult<StatementRecord> normalizedStatement = statementNormalizer.normalize(statement);
        NormalizationResult<SettlementRecord> normalizedSettlement = settlementNormalizer.normalize(settlement);
        MatchingResult matching = matcher.match(normalizedStatement.eligible(), normalizedSettlement.eligible());

        List<RowIssue> issues = new ArrayList<>(normalizedStatement.issues());
        issues.addAll(normalizedSettlement.issues());
        issues.addAll(matching.issues());
        ReconciliationSummary summary = ReconciliationSummary.of(normalizedStatement, normalizedSettlement, matching);

        log.info("Reconciliation finished: {} pins, {} reconciled, {} mismatched, {} statement-only, {} settlement-only, {} rows skipped",
                matching.results().size(),
                summary.count(ReconcileOutcome.RECONCILED),
                summary.count(ReconcileOutcome.AMOUNT_MISMATCH),
                summary.count(ReconcileOutcome.MISSING_IN_SETTLEMENT),
                summary.count(ReconcileOutcome.MISSING_IN_STATEMENT),
                summary.skippedRows());
        return new ReconciliationReport(statement.name(), settlement.name(), matching.results(), issues, summary);
    }

    private TableFormat validateUpload(MultipartFile file, SourceType source) {
        if (file == null || file.isEmpty()) {
            throw new ReconciliationFileRequiredException(source);
        }
        return TableFormat.detect(file.getOriginalFilename(), file.getContentType())
                .orElseThrow(() -> new UnsupportedTableFormatException(file.getOriginalFilename()));
    }

    private TableFormat validatePath(Path path, SourceType source) {
        if (path == null) {
            throw new TablePathRequiredException(source);
        }
        if (!Files.exists(path)) {
            throw new TableNotFoundException(path.toAbsolutePath().toString());
        }
        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        return TableFormat.detect(fileName, null)
                .orElseThrow(() -> new UnsupportedTableFormatException(fileName));
    }

    private RawTable readUpload(MultipartFile file, TableFormat format) {
        String fileName = resolveFileName(file, format);
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new TableReadException("Unable to read the uploaded file " + fileName + ".", e);
        }
        return format.isWorkbook() ? workbookReader.read(content, fileName) : csvReader.read(content, fileName);
    }

    private RawTable readPath(Path path, TableFormat format) {
        return format.isWorkbook() ? workbookReader.read(path) : csvReader.read(path);
    }

    private String resolveFileName(MultipartFile file, TableFormat format) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded." + format.name().toLowerCase(Locale.ROOT);
        }
        return fileName;
    }
}

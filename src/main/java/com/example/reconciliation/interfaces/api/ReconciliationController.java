package com.example.reconciliation.interfaces.api;

import com.example.reconciliation.application.exception.ApplicationException;
import com.example.reconciliation.application.service.CsvExportService;
import com.example.reconciliation.application.service.ReconciliationService;
import com.example.reconciliation.domain.exception.DomainException;
import com.example.reconciliation.domain.model.Classification;
import com.example.reconciliation.domain.model.ReconciliationReport;
import com.example.reconciliation.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;

/**
 * Interfaces-layer MVC controller for uploading the two ledgers and downloading the result table.
 */
@Controller
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);
    private static final String SESSION_REPORT_KEY = "LATEST_RECONCILIATION_REPORT";
    private static final String EXPORT_FILE_NAME = "reconciliation-result.csv";

    private final ReconciliationService reconciliationService;
    private final CsvExportService csvExportService;

    /**
     * Creates the controller with the required application services.
     *
     * @param reconciliationService service running the reconciliation
     * @param csvExportService      service producing the CSV result table
     */
    public ReconciliationController(ReconciliationService reconciliationService, CsvExportService csvExportService) {
        this.reconciliationService = reconciliationService;
        this.csvExportService = csvExportService;
    }

    /**
     * Renders the upload page with the last report of this session, if any.
     *
     * @param model   model exposed to the Thymeleaf view
     * @param session HTTP session storing the last report
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model, HttpSession session) {
        model.addAttribute("report", session.getAttribute(SESSION_REPORT_KEY));
        model.addAttribute("error", null);
        model.addAttribute("classifications", Classification.values());
        return "reconcile";
    }

    /**
     * Handles the upload form.
     *
     * @param statementFile  partner statement, CSV or Excel
     * @param settlementFile processor settlement, CSV or Excel
     * @param model          model used for view rendering
     * @param session        HTTP session for caching the report
     * @return upload view name populated with the report or an error
     */
    @PostMapping("/reconcile")
    public String handleUpload(@RequestParam(value = "statement", required = false) MultipartFile statementFile,
                               @RequestParam(value = "settlement", required = false) MultipartFile settlementFile,
                               Model model,
                               HttpSession session) {
        model.addAttribute("classifications", Classification.values());
        try {
            ReconciliationReport report = reconciliationService.reconcile(statementFile, settlementFile);
            session.setAttribute(SESSION_REPORT_KEY, report);
            model.addAttribute("report", report);
            model.addAttribute("error", null);
        } catch (DomainException | ApplicationException ex) {
            model.addAttribute("report", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            log.warn("Could not read uploaded ledgers", ex);
            model.addAttribute("report", null);
            model.addAttribute("error", "We couldn't read one of the files. Please check that both are valid CSV or Excel exports.");
        }
        return "reconcile";
    }

    /**
     * REST endpoint that mirrors the upload form but returns JSON.
     *
     * @param statementFile  partner statement, CSV or Excel
     * @param settlementFile processor settlement, CSV or Excel
     * @return the reconciliation report
     */
    @PostMapping(value = "/api/reconcile", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ReconciliationReport> handleUploadApi(
            @RequestParam(value = "statement", required = false) MultipartFile statementFile,
            @RequestParam(value = "settlement", required = false) MultipartFile settlementFile) {
        return ResponseEntity.ok(reconciliationService.reconcile(statementFile, settlementFile));
    }

    /**
     * Streams the cached result table as a CSV download.
     *
     * @param classificationParams classifications to include (optional, defaults to all)
     * @param session              HTTP session storing the cached report
     * @return CSV document as a {@link ResponseEntity}
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportCsv(@RequestParam(name = "classifications", required = false) List<String> classificationParams,
                                            HttpSession session) {
        ReconciliationReport cached = (ReconciliationReport) session.getAttribute(SESSION_REPORT_KEY);
        EnumSet<Classification> classifications = Classification.fromStrings(classificationParams);
        String csv = csvExportService.exportResults(cached, classifications);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + EXPORT_FILE_NAME + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}

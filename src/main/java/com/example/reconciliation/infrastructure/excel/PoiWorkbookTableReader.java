package com.example.reconciliation.infrastructure.excel;

import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.infrastructure.exception.TableReadException;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.formula.eval.NotImplementedException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Infrastructure adapter that reads the first sheet of an Excel workbook (.xlsx or .xls) into a {@link RawTable}.
 *
 * <p>Cells are rendered the way Excel displays them, through {@link DataFormatter}, so a PartnerPin stored
 * as a number comes out as {@code 12345678901} rather than {@code 1.23457E10}. Rows missing from the sheet
 * are kept as empty rows so the fixed row positions of the ledger layouts stay valid.
 */
@Component
public class PoiWorkbookTableReader {

    private static final Logger log = LoggerFactory.getLogger(PoiWorkbookTableReader.class);

    /**
     * Reads a workbook that is already in memory.
     *
     * @param content workbook bytes
     * @param name    logical table name, usually the upload's file name
     * @return table with one row per sheet row, from the first row to the last used one
     * @throws TableReadException when the content is not a readable workbook
     */
    public RawTable read(byte[] content, String name) {
        return read(new ByteArrayInputStream(content), name);
    }

    /**
     * Reads a workbook from disk.
     *
     * @param path file to read
     * @return table named after the file
     * @throws TableReadException when the file cannot be opened or parsed
     */
    public RawTable read(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        try (InputStream input = Files.newInputStream(path)) {
            return read(input, name);
        } catch (IOException e) {
            throw new TableReadException("Unable to open ledger file " + path, e);
        }
    }

    private RawTable read(InputStream input, String name) {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            if (workbook.getNumberOfSheets() == 0) {
                log.debug("Workbook '{}' has no sheets", name);
                return RawTable.of(name, List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.US);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<List<String>> cells = new ArrayList<>();
            for (int rowIndex = 0; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                cells.add(readRow(sheet.getRow(rowIndex), formatter, evaluator));
            }
            log.debug("Read {} rows from sheet '{}' of '{}'", cells.size(), sheet.getSheetName(), name);
            return RawTable.of(name, cells);
        } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException | NotImplementedException e) {
            throw new TableReadException("Unable to parse '" + name + "' as an Excel workbook.", e);
        }
    }

    private List<String> readRow(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (row == null || row.getLastCellNum() < 0) {
            return List.of();
        }
        List<String> values = new ArrayList<>(row.getLastCellNum());
        for (int column = 0; column < row.getLastCellNum(); column++) {
            Cell cell = row.getCell(column);
            values.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator));
        }
        return values;
    }
}

package com.example.reconciliation.infrastructure.csv;

import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.infrastructure.exception.TableReadException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Infrastructure adapter that reads a ledger CSV into a header-less {@link RawTable}.
 * Every physical record becomes a row, including boilerplate and header lines, so the
 * fixed row positions of the ledger layouts stay valid.
 */
@Component
public class OpenCsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(OpenCsvTableReader.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Reads CSV content that is already in memory.
     *
     * @param content UTF-8 encoded CSV bytes
     * @param name    logical table name, usually the upload's file name
     * @return table with one row per CSV record
     * @throws TableReadException when the content is not valid CSV
     */
    public RawTable read(byte[] content, String name) {
        return read(new ByteArrayInputStream(content), name);
    }

    /**
     * Reads a CSV file from disk.
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
        try (CSVReader reader = new CSVReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            List<String[]> records = reader.readAll();
            List<List<String>> cells = new ArrayList<>(records.size());
            for (String[] record : records) {
                cells.add(Arrays.asList(record));
            }
            stripByteOrderMark(cells);
            log.debug("Read {} CSV rows from '{}'", cells.size(), name);
            return RawTable.of(name, cells);
        } catch (IOException | CsvException e) {
            throw new TableReadException("Unable to parse '" + name + "' as CSV.", e);
        }
    }

    private void stripByteOrderMark(List<List<String>> cells) {
        if (cells.isEmpty() || cells.get(0).isEmpty()) {
            return;
        }
        String first = cells.get(0).get(0);
        if (first != null && !first.isEmpty() && first.charAt(0) == BYTE_ORDER_MARK) {
            cells.get(0).set(0, first.substring(1));
        }
    }
}

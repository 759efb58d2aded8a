package com.example.reconciliation.domain.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File formats a ledger can be uploaded in.
 */
public enum TableFormat {
    CSV(Set.of(".csv"), Set.of("text/csv", "application/csv")),
    XLSX(Set.of(".xlsx"), Set.of("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")),
    XLS(Set.of(".xls"), Set.of("application/vnd.ms-excel"));

    private final Set<String> extensions;
    private final Set<String> contentTypes;

    TableFormat(Set<String> extensions, Set<String> contentTypes) {
        this.extensions = extensions;
        this.contentTypes = contentTypes;
    }

    /**
     * Detects the format from the file name first and falls back to the content type.
     * Browsers on Windows label CSV files {@code application/vnd.ms-excel}, so the extension wins.
     *
     * @param fileName    original file name, may be {@code null}
     * @param contentType declared content type, may be {@code null}
     * @return detected format, or empty when neither hint is recognized
     */
    public static Optional<TableFormat> detect(String fileName, String contentType) {
        if (fileName != null) {
            String lowerName = fileName.toLowerCase(Locale.ROOT);
            for (TableFormat format : values()) {
                if (format.extensions.stream().anyMatch(lowerName::endsWith)) {
                    return Optional.of(format);
                }
            }
        }
        if (contentType != null) {
            String lowerType = contentType.toLowerCase(Locale.ROOT);
            for (TableFormat format : values()) {
                if (format.contentTypes.stream().anyMatch(lowerType::startsWith)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }

    public boolean isWorkbook() {
        return this != CSV;
    }
}

package com.example.reconcile.domain.model.statement;

import java.util.Locale;
import java.util.Optional;

/**
 * Tabular export formats a statement can arrive in. The format is decided by file extension.
 */
public enum StatementFileFormat {
    CSV(".csv"),
    XLS(".xls"),
    XLSX(".xlsx");

    private final String extension;

    StatementFileFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

	/**
	 * Detects the format from a file name's extension.
	 *
	 * @param fileName original file name, may be {@code null}
	 * @return detected format or empty when the extension is not supported
	 */
    public static Optional<StatementFileFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.trim().toLowerCase(Locale.ROOT);
        // .xlsx must be checked before .xls
        if (lower.endsWith(XLSX.extension)) {
            return Optional.of(XLSX);
        }
        if (lower.endsWith(XLS.extension)) {
            return Optional.of(XLS);
        }
        if (lower.endsWith(CSV.extension)) {
            return Optional.of(CSV);
        }
        return Optional.empty();
    }
}

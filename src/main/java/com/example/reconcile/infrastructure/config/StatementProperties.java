package com.example.reconcile.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Limits applied while reading statement files.
 *
 * @param maxXlsSize largest legacy {@code .xls} workbook that is loaded into memory
 */
@ConfigurationProperties(prefix = "reconcile.statement")
public record StatementProperties(DataSize maxXlsSize) {

    public StatementProperties {
        maxXlsSize = maxXlsSize == null ? DataSize.ofMegabytes(20) : maxXlsSize;
    }

    public static StatementProperties defaults() {
        return new StatementProperties(null);
    }
}

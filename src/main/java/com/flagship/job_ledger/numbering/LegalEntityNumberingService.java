package com.flagship.job_ledger.numbering;

import com.flagship.job_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Allocates invoice and certificate numbers from per-legal-entity counters.
 *
 * The counter row is incremented with a single atomic UPDATE and then read
 * back inside the caller's transaction, so allocation and the dependent
 * insert commit or roll back together. A number is never handed out twice;
 * a rolled-back invoice may leave a gap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LegalEntityNumberingService {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    enum Series {
        INVOICE("next_invoice_number", "invoice_prefix"),
        CERTIFICATE("next_certificate_number", "certificate_prefix");

        private final String counterColumn;
        private final String prefixColumn;

        Series(String counterColumn, String prefixColumn) {
            this.counterColumn = counterColumn;
            this.prefixColumn = prefixColumn;
        }
    }

    /**
     * @return the next invoice number, or null when there is no legal entity to number against
     */
    @Transactional
    public String allocateInvoiceNumber(UUID legalEntityId) {
        return allocate(Series.INVOICE, legalEntityId, properties.getNumbering().getDefaultInvoicePrefix());
    }

    @Transactional
    public String allocateCertificateNumber(UUID legalEntityId) {
        return allocate(Series.CERTIFICATE, legalEntityId, properties.getNumbering().getDefaultCertificatePrefix());
    }

    /**
     * Registers a legal entity whose counters start at 1.
     */
    @Transactional
    public UUID createLegalEntity(String name, String invoicePrefix, String certificatePrefix) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Legal entity name is required");
        }
        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO legal_entities (id, name, invoice_prefix, certificate_prefix) VALUES (?, ?, ?, ?)",
            id,
            name,
            invoicePrefix != null ? invoicePrefix : properties.getNumbering().getDefaultInvoicePrefix(),
            certificatePrefix != null ? certificatePrefix : properties.getNumbering().getDefaultCertificatePrefix()
        );
        log.info("Created legal entity: legalEntityId={}, name={}", id, name);
        return id;
    }

    private String allocate(Series series, UUID legalEntityId, String defaultPrefix) {
        if (legalEntityId == null) {
            return null;
        }

        int updated = jdbcTemplate.update(
            "UPDATE legal_entities SET " + series.counterColumn + " = " + series.counterColumn + " + 1, "
                + "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            legalEntityId
        );
        if (updated == 0) {
            log.warn("Legal entity not found, no {} number allocated: legalEntityId={}", series, legalEntityId);
            return null;
        }

        List<String> numbers = jdbcTemplate.query(
            "SELECT " + series.prefixColumn + " AS prefix, " + series.counterColumn + " - 1 AS allocated "
                + "FROM legal_entities WHERE id = ?",
            (rs, rowNum) -> format(rs.getString("prefix"), rs.getLong("allocated"), defaultPrefix),
            legalEntityId
        );

        String number = numbers.get(0);
        log.debug("Allocated {} number {} for legal entity {}", series, number, legalEntityId);
        return number;
    }

    private String format(String prefix, long value, String defaultPrefix) {
        String effectivePrefix = prefix != null && !prefix.isBlank() ? prefix : defaultPrefix;
        int padding = Math.max(1, properties.getNumbering().getPadding());
        return effectivePrefix + String.format("%0" + padding + "d", value);
    }
}

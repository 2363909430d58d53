package com.flagship.job_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Ledger settings bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Costing costing = new Costing();
    private Vat vat = new Vat();
    private Numbering numbering = new Numbering();

    @Getter
    @Setter
    public static class Costing {
        /**
         * Labour cost rate used when neither the engineer's rate card nor the
         * engineer carries one.
         */
        private BigDecimal defaultCostRatePerHour = BigDecimal.ZERO;
    }

    @Getter
    @Setter
    public static class Vat {
        private BigDecimal defaultRate = new BigDecimal("0.2");
    }

    @Getter
    @Setter
    public static class Numbering {
        private String defaultInvoicePrefix = "INV-";
        private String defaultCertificatePrefix = "CERT-";
        private int padding = 5;
    }
}

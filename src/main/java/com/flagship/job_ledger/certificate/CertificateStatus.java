package com.flagship.job_ledger.certificate;

public enum CertificateStatus {
    DRAFT,
    ISSUED
}

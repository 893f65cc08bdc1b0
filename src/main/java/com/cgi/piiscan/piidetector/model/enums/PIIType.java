package com.cgi.piiscan.piidetector.model.enums;

/**
 * Enumeration of PII types the detectors report.
 */
public enum PIIType {
    // Personal identification information
    EMAIL,
    PHONE_NUMBER,
    POSTAL_CODE,

    // Sensitive data
    NATIONAL_ID,      // Dutch citizen service number (BSN)
    BANK_ACCOUNT,     // IBAN
    CREDIT_CARD,

    // Organisations
    BUSINESS_REGISTRATION
}

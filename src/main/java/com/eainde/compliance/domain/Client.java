package com.eainde.compliance.domain;

/**
 * A bank client. Optional fields may be null.
 */
public record Client(String id, String name, String riskLevel, String kycStatus) {

    public Client(String id, String name, String riskLevel) {
        this(id, name, riskLevel, null);
    }
}

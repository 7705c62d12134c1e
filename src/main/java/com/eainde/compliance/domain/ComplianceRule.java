package com.eainde.compliance.domain;

/**
 * @param appliesToType transaction type the rule governs, e.g. {@code wire_transfer}
 * @param status        e.g. {@code active}, {@code retired}
 */
public record ComplianceRule(String id, String description, String appliesToType, String status) {
}

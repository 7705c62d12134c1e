package com.eainde.compliance.domain;

public record Account(String id, String clientId, String accountType, String status) {
}

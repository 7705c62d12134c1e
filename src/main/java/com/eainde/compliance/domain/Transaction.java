package com.eainde.compliance.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A transaction on an account.
 *
 * @param compliant       recorded compliance flag, null when not assessed
 * @param ruleIds         rules the transaction was checked against
 * @param violatedRuleIds rules the transaction violates
 */
public record Transaction(
        String id,
        String accountId,
        BigDecimal amount,
        String currency,
        LocalDate date,
        String status,
        Boolean compliant,
        String type,
        List<String> ruleIds,
        List<String> violatedRuleIds
) {

    public Transaction {
        ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
        violatedRuleIds = violatedRuleIds == null ? List.of() : List.copyOf(violatedRuleIds);
    }
}

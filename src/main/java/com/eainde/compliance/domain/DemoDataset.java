package com.eainde.compliance.domain;

import com.eainde.compliance.graph.KnowledgeGraph;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Small deterministic dataset: client A with accounts A1 and A2, transactions T001 to T003,
 * and the KYC and AML_THRESHOLD rules.
 *
 * Seeding twice is a no-op.
 */
@Slf4j
public final class DemoDataset {

    public static final String WIRE_TRANSFER = "wire_transfer";
    public static final String CARD_PAYMENT = "card_payment";

    private DemoDataset() {
    }

    public static void seed(KnowledgeGraph graph) {
        new FinancialGraphBuilder(graph)
                .addRule(new ComplianceRule("KYC",
                        "Customer identity must be verified before a transaction is executed",
                        WIRE_TRANSFER, "active"))
                .addRule(new ComplianceRule("AML_THRESHOLD",
                        "Transactions of 10000 USD or more require enhanced anti-money-laundering review",
                        WIRE_TRANSFER, "active"))
                .addClient(new Client("A", "Client A", "medium", "verified"))
                .addAccount(new Account("A1", "A", "checking", "active"))
                .addAccount(new Account("A2", "A", "savings", "active"))
                .addTransaction(new Transaction("T001", "A1", new BigDecimal("9500.00"), "USD",
                        LocalDate.of(2024, 5, 10), "completed", true, WIRE_TRANSFER,
                        List.of("KYC"), List.of()))
                .addTransaction(new Transaction("T002", "A1", new BigDecimal("15000.00"), "USD",
                        LocalDate.of(2024, 5, 12), "completed", false, WIRE_TRANSFER,
                        List.of("KYC", "AML_THRESHOLD"), List.of()))
                .addTransaction(new Transaction("T003", "A2", new BigDecimal("500.00"), "EUR",
                        LocalDate.of(2024, 5, 15), "completed", true, CARD_PAYMENT,
                        List.of("KYC"), List.of()));
        log.info("Seeded demo dataset: {} entities, {} relations", graph.entityCount(), graph.relationCount());
    }
}

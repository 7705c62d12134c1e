package com.eainde.compliance.graph;

import java.time.Instant;

/**
 * A uniquely identified node of the knowledge graph.
 *
 * <p>Identity is immutable. Attributes are not held here: they are literal-valued
 * relations with this entity as subject, so each one is queryable and auditable as a Fact.</p>
 *
 * @param id        globally unique id within one graph
 * @param kind      Client, Account, Transaction, ComplianceRule or any other kind
 * @param createdAt when the entity was first added
 */
public record Entity(String id, String kind, Instant createdAt) {

    public static final String CLIENT = "Client";
    public static final String ACCOUNT = "Account";
    public static final String TRANSACTION = "Transaction";
    public static final String COMPLIANCE_RULE = "ComplianceRule";

    public Entity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id is required");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Entity kind is required for: " + id);
        }
    }
}

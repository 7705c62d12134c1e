package com.eainde.compliance.domain;

import com.eainde.compliance.graph.Entity;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.graph.Term;
import com.eainde.compliance.graph.UnknownEntityException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes financial domain records into a {@link KnowledgeGraph}.
 *
 * Attributes become literal relations; references become entity links
 * ({@code hasAccount}, {@code hasTransaction}, {@code isCompliantWith}, {@code violatesRule}).
 * Null fields are skipped.
 */
public class FinancialGraphBuilder {

    // Links
    public static final String HAS_ACCOUNT = "hasAccount";
    public static final String HAS_TRANSACTION = "hasTransaction";
    public static final String IS_COMPLIANT_WITH = "isCompliantWith";
    public static final String VIOLATES_RULE = "violatesRule";

    // Attributes
    public static final String NAME = "name";
    public static final String RISK_LEVEL = "risk_level";
    public static final String KYC_STATUS = "kyc_status";
    public static final String ACCOUNT_TYPE = "account_type";
    public static final String STATUS = "status";
    public static final String AMOUNT = "amount";
    public static final String CURRENCY = "currency";
    public static final String DATE = "date";
    public static final String IS_COMPLIANT = "is_compliant";
    public static final String TYPE = "type";
    public static final String DESCRIPTION = "description";
    public static final String APPLIES_TO_TYPE = "applies_to_type";

    private final KnowledgeGraph graph;

    public FinancialGraphBuilder(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public FinancialGraphBuilder addClient(Client client) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, NAME, client.name());
        putIfPresent(attributes, RISK_LEVEL, client.riskLevel());
        putIfPresent(attributes, KYC_STATUS, client.kycStatus());
        graph.addEntity(Entity.CLIENT, client.id(), attributes);
        return this;
    }

    /**
     * @throws UnknownEntityException the owning client is not in the graph
     */
    public FinancialGraphBuilder addAccount(Account account) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, ACCOUNT_TYPE, account.accountType());
        putIfPresent(attributes, STATUS, account.status());
        requireEntity(account.clientId());
        graph.addEntity(Entity.ACCOUNT, account.id(), attributes);
        graph.addRelation(account.clientId(), HAS_ACCOUNT, Term.entity(account.id()));
        return this;
    }

    public FinancialGraphBuilder addRule(ComplianceRule rule) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, DESCRIPTION, rule.description());
        putIfPresent(attributes, APPLIES_TO_TYPE, rule.appliesToType());
        putIfPresent(attributes, STATUS, rule.status());
        graph.addEntity(Entity.COMPLIANCE_RULE, rule.id(), attributes);
        return this;
    }

    /**
     * Rules referenced by id but not yet in the graph are added as bare {@code ComplianceRule} entities.
     *
     * @throws UnknownEntityException the account is not in the graph
     */
    public FinancialGraphBuilder addTransaction(Transaction tx) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, AMOUNT, tx.amount());
        putIfPresent(attributes, CURRENCY, tx.currency());
        putIfPresent(attributes, DATE, tx.date());
        putIfPresent(attributes, STATUS, tx.status());
        putIfPresent(attributes, IS_COMPLIANT, tx.compliant());
        putIfPresent(attributes, TYPE, tx.type());
        requireEntity(tx.accountId());
        graph.addEntity(Entity.TRANSACTION, tx.id(), attributes);
        graph.addRelation(tx.accountId(), HAS_TRANSACTION, Term.entity(tx.id()));

        for (String ruleId : tx.ruleIds()) {
            link(tx.id(), IS_COMPLIANT_WITH, ruleId);
        }
        for (String ruleId : tx.violatedRuleIds()) {
            link(tx.id(), VIOLATES_RULE, ruleId);
        }
        return this;
    }

    public KnowledgeGraph getGraph() {
        return graph;
    }

    private void link(String txId, String predicate, String ruleId) {
        if (!graph.contains(ruleId)) {
            graph.addEntity(Entity.COMPLIANCE_RULE, ruleId);
        }
        graph.addRelation(txId, predicate, Term.entity(ruleId));
    }

    private void requireEntity(String id) {
        if (!graph.contains(id)) {
            throw new UnknownEntityException(id);
        }
    }

    private static void putIfPresent(Map<String, Object> attributes, String name, Object value) {
        if (value != null) {
            attributes.put(name, value);
        }
    }
}

package com.eainde.compliance.reasoning;

import com.eainde.compliance.graph.Term;
import com.eainde.compliance.retrieval.EvidenceItem;

import java.util.List;

/**
 * The deduplicated facts injected into a prompt, one line per fact.
 *
 * <pre>
 * - C1 kyc_status = verified [r1]
 * - T1 amount = 5000 [r4]
 * </pre>
 */
public record EvidenceBlock(List<EvidenceItem> items, List<String> lines) {

    public static final String HEADER = "Here are verified facts from the knowledge graph you MUST use:";

    public EvidenceBlock {
        items = List.copyOf(items);
        lines = List.copyOf(lines);
    }

    public static EvidenceBlock of(List<EvidenceItem> items) {
        return new EvidenceBlock(items, items.stream().map(EvidenceBlock::line).toList());
    }

    static String line(EvidenceItem item) {
        return "- " + item.subject() + " " + item.predicate() + " = " + display(item.value())
                + " " + item.relationIds();
    }

    private static String display(Term value) {
        return value.isEntity() ? value.getLexical() : value.getLexical().replace("\n", " ");
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public String render() {
        return HEADER + "\n" + String.join("\n", lines);
    }

    @Override
    public String toString() {
        return render();
    }
}

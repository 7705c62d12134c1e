package com.eainde.compliance.config;

import com.eainde.compliance.audit.AuditTrail;
import com.eainde.compliance.completion.CompletionService;
import com.eainde.compliance.graph.KnowledgeGraph;
import com.eainde.compliance.query.QueryTemplateRegistry;
import com.eainde.compliance.reasoning.Answer;
import com.eainde.compliance.reasoning.EvidenceStatus;
import com.eainde.compliance.reasoning.ReasoningController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "compliance.llm.api-key=test-key",
        "compliance.audit.path=",
        "compliance.graph.path="
})
class ComplianceAgentConfigTest {

    @MockBean
    private CompletionService completionService;

    @Autowired
    private KnowledgeGraph knowledgeGraph;

    @Autowired
    private QueryTemplateRegistry queryTemplateRegistry;

    @Autowired
    private AuditTrail auditTrail;

    @Autowired
    private ReasoningController reasoningController;

    @Test
    void wiresFrozenDemoGraphAndShippedTemplates() {
        assertThat(knowledgeGraph.isFrozen()).isTrue();
        assertThat(knowledgeGraph.entityCount()).isEqualTo(8);
        assertThat(knowledgeGraph.relationCount()).isEqualTo(40);
        assertThat(queryTemplateRegistry.size()).isEqualTo(7);
        assertThat(auditTrail).isSameAs(AuditTrail.NOOP);
    }

    @Test
    void answersFromTheGraph() {
        when(completionService.generate(anyString(), anyInt(), anyDouble())).thenReturn("Client A is verified.");

        Answer answer = reasoningController.ask("What is the KYC status of Client A?");

        assertThat(answer.status()).isEqualTo(EvidenceStatus.ANSWERABLE);
        assertThat(answer.templates()).contains("client-profile");
        assertThat(answer.text()).isEqualTo("Client A is verified.");
        verify(completionService, times(1)).generate(anyString(), anyInt(), anyDouble());
    }

    @Test
    void unsupportedQuestionNeverReachesTheModel() {
        Answer answer = reasoningController.ask("What is the balance of account A1?");

        assertThat(answer.status()).isEqualTo(EvidenceStatus.UNKNOWN);
        verify(completionService, never()).generate(anyString(), anyInt(), anyDouble());
    }
}

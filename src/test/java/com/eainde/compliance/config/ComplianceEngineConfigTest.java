package com.eainde.compliance.config;

import com.eainde.compliance.ComplianceFixtures;
import com.eainde.compliance.dispatch.TieredDispatcher;
import com.eainde.compliance.jurisdiction.JurisdictionReferenceStore;
import com.eainde.compliance.model.ComplianceMatrix;
import com.eainde.compliance.model.DispatchPath;
import com.eainde.compliance.model.VerdictSource;
import com.eainde.compliance.service.ComplianceMatrixService;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ComplianceEngineConfigTest {

    @Autowired private ApplicationContext context;
    @Autowired private JurisdictionReferenceStore referenceStore;
    @Autowired private TieredDispatcher dispatcher;
    @Autowired private ComplianceMatrixService service;

    @Test
    @DisplayName("should wire the bundled table and no completion service by default")
    void defaultWiring() {
        assertThat(referenceStore.size()).isEqualTo(50);
        assertThat(dispatcher.isLlmAvailable()).isFalse();
        assertThat(context.getBeanNamesForType(ChatModel.class)).isEmpty();
    }

    @Test
    @DisplayName("should process every jurisdiction with rules when no completion service is configured")
    void degradesToRules() {
        ComplianceMatrix matrix = service.analyze(ComplianceFixtures.features());

        assertThat(matrix.stateCentric().results()).hasSize(50);
        assertThat(matrix.stateCentric().skippedJurisdictions()).isEmpty();
        assertThat(matrix.stateCentric().results().values()).allSatisfy(result -> {
            assertThat(result.path()).isEqualTo(DispatchPath.RULES);
            assertThat(result.verdicts()).hasSize(3)
                    .allSatisfy(v -> assertThat(v.source()).isEqualTo(VerdictSource.RULE_BASED));
        });
        assertThat(matrix.stateCentric().rollup().totalVerdicts()).isEqualTo(150);
    }
}

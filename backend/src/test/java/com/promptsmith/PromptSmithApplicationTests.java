package com.promptsmith;

import com.promptsmith.application.orchestration.PromptOrchestrationService;
import com.promptsmith.domain.prompt.model.OrchestrationResult;
import com.promptsmith.domain.prompt.model.OrchestrationStatus;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.infrastructure.analysis.RuleBasedCriteriaScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PromptSmithApplicationTests {

    @Autowired
    private PromptOrchestrationService service;

    @Autowired
    private CriteriaScorer criteriaScorer;

    @Test
    void contextLoads() {
        assertThat(criteriaScorer).isInstanceOf(RuleBasedCriteriaScorer.class);
    }

    @Test
    @DisplayName("기본 구성으로 짧은 프롬프트를 개선한다")
    void orchestrate_withDefaultCollaborators() {
        OrchestrationResult result = service.orchestrate("Create a React component that lists users");

        assertThat(result.status()).isEqualTo(OrchestrationStatus.COMPLETED);
        assertThat(result.improved()).isTrue();
        assertThat(result.finalScore()).isGreaterThan(result.originalScore());
        assertThat(service.status().historySize()).isPositive();
    }
}

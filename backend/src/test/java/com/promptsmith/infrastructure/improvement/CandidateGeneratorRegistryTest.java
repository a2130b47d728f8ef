package com.promptsmith.infrastructure.improvement;

import com.promptsmith.domain.prompt.model.Complexity;
import com.promptsmith.domain.prompt.model.ImprovementCandidate;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.model.PromptContext;
import com.promptsmith.infrastructure.orchestrator.OrchestrationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateGeneratorRegistryTest {

    private static final String PROMPT = "Write a function that parses dates";
    private static final PromptContext SIMPLE = new PromptContext(
            false, false, false, false, Complexity.LOW, List.of(), "general");
    private static final PromptContext FULL_STACK = new PromptContext(
            true, true, true, true, Complexity.LOW, List.of("React", "Express"), "frontend");

    private GeneralOptimizerStrategy general;
    private FrontendSpecialistStrategy frontend;
    private ApiExpertStrategy api;
    private CandidateGeneratorRegistry registry;

    @BeforeEach
    void setUp() {
        general = new GeneralOptimizerStrategy();
        frontend = new FrontendSpecialistStrategy();
        api = new ApiExpertStrategy();
        registry = new CandidateGeneratorRegistry(
                List.of(general, frontend, api, new LlmCoordinatorStrategy(general, frontend, api)),
                new TechniqueApplier());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Nested
    @DisplayName("등록")
    class Registration {

        @Test
        @DisplayName("전략이 빠진 방법이 있으면 시작할 수 없다")
        void missingStrategy() {
            assertThatThrownBy(() -> new CandidateGeneratorRegistry(List.of(general, frontend, api), new TechniqueApplier()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("LLM_COORDINATOR");
        }

        @Test
        @DisplayName("같은 방법에 전략이 둘이면 시작할 수 없다")
        void duplicateStrategy() {
            assertThatThrownBy(() -> new CandidateGeneratorRegistry(
                    List.of(general, new GeneralOptimizerStrategy()), new TechniqueApplier()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("후보 생성")
    class Generate {

        @Test
        @DisplayName("바뀐 기법마다 10점을 추정한다")
        void tenPointsPerChangedTechnique() {
            ImprovementCandidate candidate = registry.generate(PROMPT, SIMPLE, ImprovementMethod.GENERAL_OPTIMIZER, 40);

            // three strategy techniques plus three for the target model
            assertThat(candidate.method()).isEqualTo(ImprovementMethod.GENERAL_OPTIMIZER);
            assertThat(candidate.scoreImprovement()).isEqualTo(60.0);
            assertThat(candidate.text()).contains("<task>", "<requirements>", "<success_criteria>");
        }

        @Test
        @DisplayName("개선치는 100점을 넘지 않도록 제한된다")
        void cappedAtHeadroom() {
            ImprovementCandidate candidate = registry.generate(PROMPT, SIMPLE, ImprovementMethod.GENERAL_OPTIMIZER, 85);

            assertThat(candidate.scoreImprovement()).isEqualTo(15.0);
        }

        @Test
        @DisplayName("이미 개선된 프롬프트는 개선치가 0이다")
        void alreadyImproved_zero() {
            String improved = registry.generate(PROMPT, SIMPLE, ImprovementMethod.GENERAL_OPTIMIZER, 40).text();

            ImprovementCandidate again = registry.generate(improved, SIMPLE, ImprovementMethod.GENERAL_OPTIMIZER, 70);

            assertThat(again.scoreImprovement()).isZero();
            assertThat(again.text()).isEqualTo(improved);
        }

        @Test
        @DisplayName("조정자는 관련된 모든 전문가의 기법을 합친다")
        void coordinator_combines() {
            assertThat(new LlmCoordinatorStrategy(general, frontend, api).techniques(FULL_STACK))
                    .containsExactly(
                            PromptTechnique.CLARITY,
                            PromptTechnique.XML_STRUCTURE,
                            PromptTechnique.SUCCESS_CRITERIA,
                            PromptTechnique.COMPONENT_STRUCTURE,
                            PromptTechnique.ACCESSIBILITY_FOCUS,
                            PromptTechnique.FEW_SHOT_EXAMPLES,
                            PromptTechnique.ERROR_HANDLING,
                            PromptTechnique.VALIDATION_EMPHASIS);

            ImprovementCandidate candidate = registry.generate(PROMPT, FULL_STACK, ImprovementMethod.LLM_COORDINATOR, 0);
            assertThat(candidate.scoreImprovement()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("복잡한 프롬프트에는 사고 단계와 예시를 추가한다")
        void highComplexity_addsReasoningAndExamples() {
            PromptContext complex = new PromptContext(false, false, false, false, Complexity.HIGH, List.of(), "general");

            ImprovementCandidate candidate = registry.generate(PROMPT, complex, ImprovementMethod.GENERAL_OPTIMIZER, 20);

            assertThat(candidate.text()).contains("<thinking>", "<examples>");
            assertThat(candidate.scoreImprovement()).isEqualTo(80.0);
        }

        @Test
        @DisplayName("Claude 대상 방법은 role, principles, answer_quality 섹션을 붙인다")
        void claudeTarget_addsClaudeSections() {
            ImprovementCandidate candidate = registry.generate(PROMPT, SIMPLE, ImprovementMethod.FRONTEND_SPECIALIST, 0);

            assertThat(candidate.text())
                    .startsWith("<role>")
                    .contains("<principles>", "<answer_quality>")
                    .doesNotContain("System:", "<response_format>");
            assertThat(candidate.reasoning()).endsWith("(tuned for claude)");
        }

        @Test
        @DisplayName("API 전문가는 GPT에 맞춰 시스템 메시지와 응답 형식을 붙인다")
        void apiExpert_targetsGpt() {
            ImprovementCandidate candidate = registry.generate(PROMPT, SIMPLE, ImprovementMethod.API_EXPERT, 0);

            assertThat(candidate.text())
                    .startsWith("System:")
                    .contains("User: ", "<response_format>", "<parameters>", "<error_handling>")
                    .doesNotContain("<role>", "<answer_quality>");
            assertThat(candidate.scoreImprovement()).isEqualTo(60.0);
            assertThat(candidate.reasoning()).endsWith("(tuned for gpt)");
        }

        @Test
        @DisplayName("인터럽트된 스레드에서는 생성을 중단한다")
        void interrupted_stops() {
            Thread.currentThread().interrupt();

            assertThatThrownBy(() -> registry.generate(PROMPT, SIMPLE, ImprovementMethod.API_EXPERT, 40))
                    .isInstanceOf(OrchestrationException.class);
        }
    }
}

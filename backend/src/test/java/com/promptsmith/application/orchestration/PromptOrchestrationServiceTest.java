package com.promptsmith.application.orchestration;

import com.promptsmith.application.orchestration.exception.PromptValidationException;
import com.promptsmith.domain.prompt.model.ComparisonOutcome;
import com.promptsmith.domain.prompt.model.Criterion;
import com.promptsmith.domain.prompt.model.CriterionScore;
import com.promptsmith.domain.prompt.model.DeferredEvaluation;
import com.promptsmith.domain.prompt.model.EvaluationResult;
import com.promptsmith.domain.prompt.model.PromptComparison;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.infrastructure.orchestrator.OrchestratorConfig;
import com.promptsmith.infrastructure.orchestrator.PromptOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PromptOrchestrationServiceTest {

    @Mock
    private PromptOrchestrator orchestrator;
    @Mock
    private CriteriaScorer criteriaScorer;

    @InjectMocks
    private PromptOrchestrationService service;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(service, "maxTextLength", 20);
    }

    @Test
    @DisplayName("빈 프롬프트는 거부한다")
    void blank_rejected() {
        assertThatThrownBy(() -> service.orchestrate("   "))
                .isInstanceOf(PromptValidationException.class);
        assertThatThrownBy(() -> service.evaluate(null))
                .isInstanceOf(PromptValidationException.class);
        verify(orchestrator, never()).orchestrate(anyString());
    }

    @Test
    @DisplayName("최대 길이를 넘으면 거부한다")
    void tooLong_rejected() {
        assertThatThrownBy(() -> service.orchestrate("x".repeat(21)))
                .isInstanceOf(PromptValidationException.class)
                .hasMessageContaining("20");
    }

    @Test
    @DisplayName("평가는 채점기에 직접 위임한다")
    void evaluate_delegatesToScorer() {
        EvaluationResult result = EvaluationResult.ofScore(64);
        when(criteriaScorer.evaluate("short prompt")).thenReturn(result);

        assertThat(service.evaluate("short prompt")).isSameAs(result);
        verify(orchestrator, never()).orchestrate(anyString());
    }

    @Test
    @DisplayName("임계값 변경은 나머지 설정을 유지한다")
    @SuppressWarnings("unchecked")
    void updateThresholds_keepsOtherSettings() {
        ArgumentCaptor<UnaryOperator<OrchestratorConfig>> update = ArgumentCaptor.forClass(UnaryOperator.class);
        when(orchestrator.updateConfig(any())).thenReturn(OrchestratorConfig.defaults());

        service.updateThresholds(60, 90);

        verify(orchestrator).updateConfig(update.capture());
        OrchestratorConfig applied = update.getValue().apply(OrchestratorConfig.defaults());
        assertThat(applied.improvementTrigger()).isEqualTo(60.0);
        assertThat(applied.highQuality()).isEqualTo(90.0);
        assertThat(applied.timeoutMs()).isEqualTo(5000);
    }

    @Test
    @DisplayName("이력 초기화는 오케스트레이터에 위임한다")
    void clearHistory() {
        service.clearHistory();

        verify(orchestrator).clearHistory();
    }

    @Nested
    @DisplayName("두 프롬프트 비교")
    class Compare {

        @Test
        @DisplayName("점수 차가 3점 미만이면 무승부다")
        void smallDifference_isTie() {
            when(criteriaScorer.evaluate("prompt one")).thenReturn(EvaluationResult.ofScore(70));
            when(criteriaScorer.evaluate("prompt two")).thenReturn(EvaluationResult.ofScore(71.5));

            PromptComparison comparison = (PromptComparison) service.compare("prompt one", "prompt two");

            assertThat(comparison.winner()).isEqualTo(PromptComparison.Winner.TIE);
            assertThat(comparison.scoreDifference()).isEqualTo(1.5);
            assertThat(comparison.keyDifferences()).isEmpty();
            assertThat(comparison.recommendation()).startsWith("Both prompts are roughly equivalent");
        }

        @Test
        @DisplayName("큰 차이는 기준별 차이와 함께 두 번째 프롬프트를 추천한다")
        void largeDifference_reportsCriteria() {
            when(criteriaScorer.evaluate("prompt one")).thenReturn(withStructure(50, 0.2));
            when(criteriaScorer.evaluate("prompt two")).thenReturn(withStructure(80, 0.9));

            PromptComparison comparison = (PromptComparison) service.compare("prompt one", "prompt two");

            assertThat(comparison.winner()).isEqualTo(PromptComparison.Winner.SECOND);
            assertThat(comparison.scoreDifference()).isEqualTo(30.0);
            assertThat(comparison.keyDifferences()).containsExactly(
                    "Prompt 2 is 70.0 points better in structure",
                    "Prompt 2 has better structural organization");
            assertThat(comparison.recommendation()).startsWith("Prompt 2 is significantly better");
        }

        @Test
        @DisplayName("첫 번째가 조금 나으면 주요 차이를 근거로 든다")
        void slightDifference_citesMainAdvantage() {
            when(criteriaScorer.evaluate("prompt one")).thenReturn(withStructure(60, 0.75));
            when(criteriaScorer.evaluate("prompt two")).thenReturn(withStructure(55, 0.5));

            PromptComparison comparison = (PromptComparison) service.compare("prompt one", "prompt two");

            assertThat(comparison.winner()).isEqualTo(PromptComparison.Winner.FIRST);
            assertThat(comparison.recommendation())
                    .isEqualTo("Prompt 1 is slightly better. Main advantage: Prompt 2 is 25.0 points worse in structure");
        }

        @Test
        @DisplayName("한쪽이라도 외부 판정이 필요하면 비교 전체를 위임한다")
        void deferredEvaluation_defersComparison() {
            when(criteriaScorer.evaluate("prompt one")).thenReturn(EvaluationResult.ofScore(70));
            when(criteriaScorer.evaluate("prompt two"))
                    .thenReturn(new DeferredEvaluation("prompt-evaluation-judge", "judge it", Map.of()));

            ComparisonOutcome outcome = service.compare("prompt one", "prompt two");

            assertThat(outcome).isInstanceOf(DeferredEvaluation.class);
            DeferredEvaluation deferred = (DeferredEvaluation) outcome;
            assertThat(deferred.delegate()).isEqualTo(PromptOrchestrationService.COMPARISON_DELEGATE);
            assertThat(deferred.payload()).containsEntry("prompt1", "prompt one").containsEntry("prompt2", "prompt two");
        }

        @Test
        @DisplayName("비교할 프롬프트도 검증한다")
        void blankSecond_rejected() {
            assertThatThrownBy(() -> service.compare("prompt one", " "))
                    .isInstanceOf(PromptValidationException.class);
        }

        private EvaluationResult withStructure(double overall, double structure) {
            return new EvaluationResult(overall,
                    Map.of(Criterion.STRUCTURE, new CriterionScore(structure, Criterion.STRUCTURE.weight(), "structure")),
                    List.of());
        }
    }
}

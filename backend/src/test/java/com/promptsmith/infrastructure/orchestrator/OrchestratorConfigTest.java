package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.ContextFlag;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorConfigTest {

    @Test
    @DisplayName("기본값")
    void defaults() {
        OrchestratorConfig config = OrchestratorConfig.defaults();

        assertThat(config.improvementTrigger()).isEqualTo(70.0);
        assertThat(config.highQuality()).isEqualTo(85.0);
        assertThat(config.patternExtractionMin()).isEqualTo(10);
        assertThat(config.maxConcurrentAgents()).isEqualTo(5);
        assertThat(config.timeoutMs()).isEqualTo(5000);
        assertThat(config.retryOnFailure()).isTrue();
        assertThat(config.agentSelection().get(ContextFlag.HIGH_COMPLEXITY))
                .containsExactly(ImprovementMethod.GENERAL_OPTIMIZER);
        assertThat(config.coordinatorMethod()).isEqualTo(ImprovementMethod.LLM_COORDINATOR);
        assertThat(config.fallbackMethods()).containsExactly(ImprovementMethod.GENERAL_OPTIMIZER);
    }

    @Test
    @DisplayName("toBuilder는 원본을 변경하지 않는다")
    void toBuilder_leavesOriginal() {
        OrchestratorConfig original = OrchestratorConfig.defaults();

        OrchestratorConfig updated = original.toBuilder().improvementTrigger(60).build();

        assertThat(updated.improvementTrigger()).isEqualTo(60.0);
        assertThat(original.improvementTrigger()).isEqualTo(70.0);
    }

    @Test
    @DisplayName("범위를 벗어난 값은 거부한다")
    void validation() {
        assertThatThrownBy(() -> OrchestratorConfig.defaults().toBuilder().improvementTrigger(101).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OrchestratorConfig.defaults().toBuilder().maxConcurrentAgents(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OrchestratorConfig.defaults().toBuilder().fallbackMethods(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("방법 목록 파싱은 이름과 id를 모두 받는다")
    void parseMethods() {
        assertThat(OrchestratorConfig.parseMethods("GENERAL_OPTIMIZER, api-expert ,Frontend-Specialist"))
                .containsExactly(ImprovementMethod.GENERAL_OPTIMIZER, ImprovementMethod.API_EXPERT,
                        ImprovementMethod.FRONTEND_SPECIALIST);
        assertThat(OrchestratorConfig.parseMethods("  ")).isEmpty();
        assertThatThrownBy(() -> OrchestratorConfig.parseMethods("unknown"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.promptsmith.infrastructure.orchestrator;

import com.promptsmith.domain.prompt.model.ContextFlag;
import com.promptsmith.domain.prompt.model.ImprovementMethod;
import com.promptsmith.domain.prompt.service.CandidateGenerator;
import com.promptsmith.domain.prompt.service.ContextClassifier;
import com.promptsmith.domain.prompt.service.CriteriaScorer;
import com.promptsmith.domain.prompt.service.PatternExtractor;
import com.promptsmith.domain.prompt.service.Recorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class OrchestratorConfiguration {

    @Value("${orchestrator.thresholds.improvement-trigger:70}")
    private double improvementTrigger;

    @Value("${orchestrator.thresholds.high-quality:85}")
    private double highQuality;

    @Value("${orchestrator.thresholds.pattern-extraction-min:10}")
    private int patternExtractionMin;

    @Value("${orchestrator.parallelization.max-concurrent-agents:5}")
    private int maxConcurrentAgents;

    @Value("${orchestrator.parallelization.timeout-ms:5000}")
    private long timeoutMs;

    @Value("${orchestrator.parallelization.retry-on-failure:true}")
    private boolean retryOnFailure;

    @Value("${orchestrator.record-initial:true}")
    private boolean recordInitial;

    @Value("${orchestrator.history.capacity:100}")
    private int historyCapacity;

    @Value("${orchestrator.agent-selection.high-complexity:GENERAL_OPTIMIZER}")
    private String highComplexityMethods;

    @Value("${orchestrator.agent-selection.frontend:FRONTEND_SPECIALIST}")
    private String frontendMethods;

    @Value("${orchestrator.agent-selection.backend:API_EXPERT}")
    private String backendMethods;

    @Value("${orchestrator.agent-selection.fallback:GENERAL_OPTIMIZER}")
    private String fallbackMethods;

    // Blank disables the coordinator
    @Value("${orchestrator.agent-selection.coordinator:LLM_COORDINATOR}")
    private String coordinatorMethod;

    @Bean
    public OrchestratorConfig orchestratorConfig() {
        Map<ContextFlag, List<ImprovementMethod>> selection = new EnumMap<>(ContextFlag.class);
        selection.put(ContextFlag.HIGH_COMPLEXITY, OrchestratorConfig.parseMethods(highComplexityMethods));
        selection.put(ContextFlag.FRONTEND, OrchestratorConfig.parseMethods(frontendMethods));
        selection.put(ContextFlag.BACKEND, OrchestratorConfig.parseMethods(backendMethods));

        OrchestratorConfig config = OrchestratorConfig.builder()
                .improvementTrigger(improvementTrigger)
                .highQuality(highQuality)
                .patternExtractionMin(patternExtractionMin)
                .maxConcurrentAgents(maxConcurrentAgents)
                .timeoutMs(timeoutMs)
                .retryOnFailure(retryOnFailure)
                .recordInitial(recordInitial)
                .agentSelection(selection)
                .fallbackMethods(OrchestratorConfig.parseMethods(fallbackMethods))
                .coordinatorMethod(coordinatorMethod.isBlank() ? null : ImprovementMethod.parse(coordinatorMethod))
                .build();
        log.info("[Orchestrator] Configuration: {}", config);
        return config;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestratorExecutor() {
        return Executors.newCachedThreadPool(new NamedThreadFactory("orchestrator"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentCallExecutor() {
        return Executors.newCachedThreadPool(new NamedThreadFactory("agent-call"));
    }

    @Bean
    public HistoryStore historyStore() {
        return new HistoryStore(historyCapacity);
    }

    @Bean
    public PromptOrchestrator promptOrchestrator(ContextClassifier contextClassifier,
                                                 CriteriaScorer criteriaScorer,
                                                 CandidateGenerator candidateGenerator,
                                                 Recorder recorder,
                                                 PatternExtractor patternExtractor,
                                                 OrchestratorConfig orchestratorConfig,
                                                 HistoryStore historyStore,
                                                 @Qualifier("orchestratorExecutor") ExecutorService orchestratorExecutor,
                                                 @Qualifier("agentCallExecutor") ExecutorService agentCallExecutor) {
        return PromptOrchestrator.builder()
                .contextClassifier(contextClassifier)
                .criteriaScorer(criteriaScorer)
                .candidateGenerator(candidateGenerator)
                .recorder(recorder)
                .patternExtractor(patternExtractor)
                .config(orchestratorConfig)
                .historyStore(historyStore)
                .phaseExecutor(orchestratorExecutor)
                .agentCallExecutor(agentCallExecutor)
                .build();
    }
}

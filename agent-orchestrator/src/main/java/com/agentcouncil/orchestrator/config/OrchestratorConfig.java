package com.agentcouncil.orchestrator.config;

import com.agentcouncil.analysis.stage.FundamentalAnalystStage;
import com.agentcouncil.analysis.stage.NewsAnalystStage;
import com.agentcouncil.analysis.stage.SentimentAnalystStage;
import com.agentcouncil.analysis.stage.TechnicalAnalystStage;
import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.exception.PipelineConfigurationException;
import com.agentcouncil.common.model.DebateSide;
import com.agentcouncil.common.stage.Stage;
import com.agentcouncil.orchestrator.debate.DebateJudgeStage;
import com.agentcouncil.orchestrator.debate.ResearchSynthesizerStage;
import com.agentcouncil.orchestrator.debate.ResearcherStage;
import com.agentcouncil.orchestrator.gate.ReflectionGate;
import com.agentcouncil.orchestrator.logger.StageFlowLogger;
import com.agentcouncil.orchestrator.pipeline.PipelineDriver;
import com.agentcouncil.orchestrator.pipeline.PipelineSettings;
import com.agentcouncil.orchestrator.pipeline.PipelineTopology;
import com.agentcouncil.orchestrator.risk.RiskDebatorStage;
import com.agentcouncil.orchestrator.risk.RiskStance;
import com.agentcouncil.orchestrator.risk.RiskSynthesizerStage;
import com.agentcouncil.orchestrator.trader.TraderStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Configuration
public class OrchestratorConfig {

    @Value("${pipeline.max-attempts:3}")
    private int maxAttempts;

    @Value("${pipeline.stage-timeout:30s}")
    private Duration stageTimeout;

    @Value("${pipeline.cancel-on-failure:true}")
    private boolean cancelOnFailure;

    @Value("${pipeline.debate.rounds:2}")
    private int debateRounds;

    @Bean
    public PipelineSettings pipelineSettings() {
        return new PipelineSettings(maxAttempts, stageTimeout, cancelOnFailure);
    }

    @Bean
    public PipelineTopology pipelineTopology(PipelineSettings settings) {
        return councilTopology(settings, debateRounds);
    }

    @Bean
    public PipelineDriver pipelineDriver(PipelineTopology topology, StageFlowLogger stageFlowLogger) {
        return new PipelineDriver(topology, stageFlowLogger);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * The trading council: four analysts in parallel, {@code rounds} bull/bear exchanges, judge,
     * synthesis, three-voice risk debate, risk synthesis, then trader and reflection gate.
     */
    public static PipelineTopology councilTopology(PipelineSettings settings, int rounds) {
        if (rounds <= 0) {
            throw new PipelineConfigurationException("topology", "debate rounds must be > 0, was " + rounds);
        }
        List<Stage> analysts = List.of(
            new TechnicalAnalystStage(),
            new SentimentAnalystStage(),
            new NewsAnalystStage(),
            new FundamentalAnalystStage());

        List<Stage> chain = new ArrayList<>();
        for (int round = 1; round <= rounds; round++) {
            chain.add(new ResearcherStage(DebateSide.BULL, round, round == 1));
            chain.add(new ResearcherStage(DebateSide.BEAR, round, false));
        }
        chain.add(new DebateJudgeStage());
        chain.add(new ResearchSynthesizerStage());
        for (RiskStance stance : RiskStance.values()) {
            chain.add(new RiskDebatorStage(stance, stance == RiskStance.AGGRESSIVE));
        }
        chain.add(new RiskSynthesizerStage());

        Set<String> seedKeys = Set.of(ContextKeys.PRICES, ContextKeys.HEADLINES,
            ContextKeys.SOCIAL_POSTS, ContextKeys.FUNDAMENTALS);

        return new PipelineTopology(analysts, chain, List.of(new TraderStage()), new ReflectionGate(),
            seedKeys, settings);
    }
}

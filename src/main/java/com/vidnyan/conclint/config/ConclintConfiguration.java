package com.vidnyan.conclint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.conclint.domain.classify.AnalysisConfig;
import com.vidnyan.conclint.domain.rule.RuleEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for conclint components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class ConclintConfiguration {

    /**
     * ObjectMapper for the rule catalog and the tree exchange format.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Immutable snapshot of the analysis properties shared by every rule context.
     */
    @Bean
    public AnalysisConfig analysisConfig(AnalysisProperties properties) {
        AnalysisConfig config = AnalysisConfig.builder()
                .frameworkScopes(properties.getFrameworkScopes())
                .frameworkScopeFactories(properties.getFrameworkScopeFactories())
                .cooperationPoints(properties.getCooperationPoints())
                .blockingCalls(properties.getBlockingCalls())
                .allowedScopes(properties.getAllowedScopes())
                .disabledRules(properties.getDisabledRules())
                .docBaseUrl(properties.getDocBaseUrl())
                .build();
        log.info("Analysis config: {} framework scopes, {} blocking calls, {} disabled rule(s)",
                config.frameworkScopes().size(), config.blockingCalls().size(),
                properties.getDisabledRules().size());
        return config;
    }

    /**
     * Log available evaluators on startup.
     */
    @Bean
    public String logEvaluators(List<RuleEvaluator> evaluators) {
        log.info("Registered {} rule evaluators:", evaluators.size());
        evaluators.forEach(e -> log.debug("  - {}", e.getName()));
        return "evaluators-logged";
    }
}

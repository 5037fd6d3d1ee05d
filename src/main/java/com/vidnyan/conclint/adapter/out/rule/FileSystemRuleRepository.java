package com.vidnyan.conclint.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.conclint.application.port.out.RuleRepository;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File system based rule repository.
 * Loads the rule catalog from JSON files in the classpath.
 */
@Slf4j
@Component
public class FileSystemRuleRepository implements RuleRepository {

    private final ObjectMapper objectMapper;
    private final String rulesPath;
    private final Map<String, RuleDefinition> rules = new ConcurrentHashMap<>();

    public FileSystemRuleRepository(ObjectMapper objectMapper,
                                    @Value("${conclint.rules.path:classpath*:rules/*.json}") String rulesPath) {
        this.objectMapper = objectMapper;
        this.rulesPath = rulesPath;
    }

    @PostConstruct
    public void loadRules() {
        rules.clear();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(rulesPath);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    RuleDto dto = objectMapper.readValue(in, RuleDto.class);
                    RuleDefinition rule = mapToRule(dto);
                    if (rules.putIfAbsent(rule.id(), rule) != null) {
                        log.warn("Duplicate rule id {} in {}, keeping the first one", rule.id(), resource.getFilename());
                        continue;
                    }
                    log.debug("Loaded rule: {} - {}", rule.id(), rule.name());
                } catch (Exception e) {
                    log.warn("Failed to load rule from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} rules from {}", rules.size(), rulesPath);
        } catch (IOException e) {
            log.error("Failed to load rules", e);
        }
    }

    @Override
    public List<RuleDefinition> findAll() {
        return sorted(rules.values().stream().toList());
    }

    @Override
    public Optional<RuleDefinition> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<RuleDefinition> findEnabled() {
        return sorted(rules.values().stream()
                .filter(RuleDefinition::isEnabled)
                .toList());
    }

    private static List<RuleDefinition> sorted(List<RuleDefinition> list) {
        return list.stream().sorted(Comparator.comparing(RuleDefinition::id)).toList();
    }

    private RuleDefinition mapToRule(RuleDto dto) {
        if (dto.id == null || dto.id.isBlank()) {
            throw new IllegalArgumentException("rule has no id");
        }
        return RuleDefinition.builder()
                .id(dto.id)
                .name(dto.name != null ? dto.name : dto.id)
                .description(dto.description)
                .severity(mapSeverity(dto.severity))
                .category(mapCategory(dto.category))
                .messageTemplate(dto.message)
                .docAnchor(dto.docAnchor)
                .isEnabled(dto.enabled != null ? dto.enabled : true)
                .build();
    }

    private RuleDefinition.Severity mapSeverity(String severity) {
        if (severity == null) return RuleDefinition.Severity.WARNING;
        return switch (severity.toUpperCase()) {
            case "ERROR" -> RuleDefinition.Severity.ERROR;
            case "WARN", "WARNING" -> RuleDefinition.Severity.WARNING;
            case "INFO" -> RuleDefinition.Severity.INFO;
            default -> RuleDefinition.Severity.WARNING;
        };
    }

    private RuleDefinition.Category mapCategory(String category) {
        if (category == null) return RuleDefinition.Category.SCOPE;
        return switch (category.toUpperCase().replace("-", "_").replace(" ", "_")) {
            case "SCOPE" -> RuleDefinition.Category.SCOPE;
            case "RUN_BLOCKING", "RUNBLOCKING" -> RuleDefinition.Category.RUN_BLOCKING;
            case "DISPATCHER", "DISPATCH" -> RuleDefinition.Category.DISPATCHER;
            case "CANCELLATION", "CANCEL" -> RuleDefinition.Category.CANCELLATION;
            case "EXCEPTION" -> RuleDefinition.Category.EXCEPTION;
            case "CHANNEL" -> RuleDefinition.Category.CHANNEL;
            case "FLOW" -> RuleDefinition.Category.FLOW;
            case "TEST" -> RuleDefinition.Category.TEST;
            case "ARCHITECTURE", "ARCH" -> RuleDefinition.Category.ARCHITECTURE;
            case "ENGINE" -> RuleDefinition.Category.ENGINE;
            default -> throw new IllegalArgumentException("unknown category '" + category + "'");
        };
    }

    // DTO class for JSON deserialization
    static class RuleDto {
        public String id;
        public String name;
        public String description;
        public String severity;
        public String category;
        public String message;
        public String docAnchor;
        public Boolean enabled;
    }
}

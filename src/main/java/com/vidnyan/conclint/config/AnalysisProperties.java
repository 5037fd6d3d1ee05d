package com.vidnyan.conclint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.properties or application.yml
 * <p>
 * Every name list extends the built-in registry of the same kind; nothing here
 * can remove a built-in entry.
 */
@Data
@Component
@ConfigurationProperties(prefix = "conclint.analysis")
public class AnalysisProperties {

    /**
     * Rule ids (e.g. SCOPE_003) or names (e.g. UnstructuredLaunch) to switch off.
     */
    private List<String> disabledRules = new ArrayList<>();

    /**
     * Additional scope properties owned by a framework, e.g. presenterScope.
     */
    private List<String> frameworkScopes = new ArrayList<>();

    /**
     * Additional calls that return a framework-owned scope, e.g. rememberCoroutineScope.
     */
    private List<String> frameworkScopeFactories = new ArrayList<>();

    /**
     * Additional calls that count as cancellation cooperation inside loops.
     */
    private List<String> cooperationPoints = new ArrayList<>();

    /**
     * Additional blocking calls, as Type.method or fully.qualified.Type.method.
     */
    private List<String> blockingCalls = new ArrayList<>();

    /**
     * Receiver names the host vouches for; unstructured launches on them are not reported.
     */
    private List<String> allowedScopes = new ArrayList<>();

    /**
     * Number of files analyzed concurrently. 1 = sequential.
     */
    private int parallelism = 1;

    /**
     * Base URL of the best-practices document that rule anchors point into.
     */
    private String docBaseUrl;
}

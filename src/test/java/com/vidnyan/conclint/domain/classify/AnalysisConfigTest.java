package com.vidnyan.conclint.domain.classify;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    @Test
    void builder_ShouldExtendBuiltInRegistries() {
        AnalysisConfig config = AnalysisConfig.builder()
                .frameworkScopes(List.of("presenterScope"))
                .cooperationPoints(List.of("checkCancelled"))
                .blockingCalls(List.of("LegacyClient.fetchBlocking"))
                .build();

        assertTrue(config.frameworkScopes().contains("presenterScope"));
        assertTrue(config.frameworkScopes().contains("viewModelScope"));
        assertTrue(config.cooperationPoints().contains("checkCancelled"));
        assertTrue(config.cooperationPoints().contains("yield"));
        assertEquals(CoroutineNames.BlockingCategory.CUSTOM, config.blockingCalls().get("LegacyClient.fetchBlocking"));
        assertEquals(CoroutineNames.BlockingCategory.THREAD, config.blockingCalls().get("Thread.sleep"));
    }

    @Test
    void blockingCalls_ShouldKeepBuiltInsBeforeHostEntries() {
        AnalysisConfig config = AnalysisConfig.builder()
                .blockingCalls(List.of("sleep", "LegacyClient.fetchBlocking", "Thread.sleep"))
                .build();

        List<String> names = List.copyOf(config.blockingCalls().keySet());
        assertEquals("Thread.sleep", names.get(0));
        assertEquals(List.of("sleep", "LegacyClient.fetchBlocking"), names.subList(names.size() - 2, names.size()));
        assertEquals(CoroutineNames.BlockingCategory.THREAD, config.blockingCalls().get("Thread.sleep"));
    }

    @Test
    void build_ShouldRejectAmbiguousScopeNames() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.builder()
                .frameworkScopes(List.of("GlobalScope"))
                .build());
        assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.builder()
                .frameworkScopes(List.of("rememberCoroutineScope"))
                .build());
    }

    @Test
    void isRuleEnabled_ShouldMatchIdOrName() {
        AnalysisConfig config = AnalysisConfig.builder()
                .disabledRules(List.of("SCOPE_003", "ChannelNotClosed"))
                .build();

        assertFalse(config.isRuleEnabled("SCOPE_003", "UnstructuredLaunch"));
        assertFalse(config.isRuleEnabled("CHANNEL_001", "ChannelNotClosed"));
        assertTrue(config.isRuleEnabled("SCOPE_001", "UnscopedLaunch"));
    }

    @Test
    void documentationUrl_ShouldAppendAnchor() {
        AnalysisConfig config = AnalysisConfig.builder().docBaseUrl("https://docs.example.com/guide/").build();

        assertEquals("https://docs.example.com/guide#a1", config.documentationUrl("a1"));
        assertEquals("https://docs.example.com/guide", config.documentationUrl(null));
    }
}

package com.company.sentinel.service;

import com.company.sentinel.config.SentinelProperties;
import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.domain.enums.ProbeMethod;
import com.company.sentinel.exception.InvalidTargetException;
import com.company.sentinel.scheduler.ProbeScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TargetLoaderTest {

    @Mock
    private ProbeScheduler scheduler;

    private InMemoryMonitoringStore store;
    private SentinelProperties properties;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitoringStore();
        properties = new SentinelProperties();
    }

    private static SentinelProperties.TargetDefinition definition(String url, Integer interval, String pattern) {
        SentinelProperties.TargetDefinition definition = new SentinelProperties.TargetDefinition();
        definition.setUrl(url);
        definition.setCheckIntervalSeconds(interval);
        definition.setRegexPattern(pattern);
        return definition;
    }

    @Test
    void registersTargetsAndHandsThemToSchedulerInOrder() throws Exception {
        properties.setTargets(List.of(
                definition("https://b.example.com/health", 30, "OK"),
                definition("https://a.example.com", 10, ""),
                definition("https://c.example.com", 60, null)));

        new TargetLoader(properties, store, scheduler).run(null);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TargetConfig>> captor = ArgumentCaptor.forClass(List.class);
        verify(scheduler).replaceTargets(captor.capture());

        List<TargetConfig> targets = captor.getValue();
        assertThat(targets).extracting(TargetConfig::getUrl).containsExactly(
                "https://b.example.com/health", "https://a.example.com", "https://c.example.com");
        assertThat(targets).extracting(TargetConfig::getId).doesNotHaveDuplicates()
                .allMatch(id -> id > 0);
        assertThat(targets.get(0).getRegexPattern()).isEqualTo("OK");
        assertThat(targets.get(1).getRegexPattern()).isNull();
        assertThat(targets.get(1).hasPattern()).isFalse();
    }

    @Test
    void anyInvalidTargetFailsTheWholeLoad() {
        SentinelProperties.TargetDefinition head = definition("https://d.example.com", 30, "Welcome");
        head.setMethod(ProbeMethod.HEAD);
        properties.setTargets(List.of(
                definition("https://ok.example.com", 30, null),
                definition("not a url", 30, null),
                definition("https://e.example.com", 2, "([unclosed"),
                head));

        TargetLoader loader = new TargetLoader(properties, store, scheduler);

        assertThatThrownBy(() -> loader.run(null))
                .isInstanceOf(InvalidTargetException.class)
                .satisfies(e -> assertThat(((InvalidTargetException) e).getErrors()).containsExactly(
                        "targets[1]: Invalid URL: not a url",
                        "targets[2]: Check interval must be between 5 and 300 seconds, got 2",
                        "targets[2]: Invalid regex pattern: ([unclosed",
                        "targets[3]: Regex pattern cannot be checked with HEAD requests: https://d.example.com"));

        assertThat(store.targetIds).isEmpty();
        verify(scheduler, never()).replaceTargets(any());
    }

    @Test
    void repeatedUrlKeepsFirstPositionAndLastDefinition() {
        properties.setTargets(List.of(
                definition("https://a.example.com", 30, null),
                definition("https://b.example.com", 30, null),
                definition("https://a.example.com", 90, null)));

        List<TargetConfig> targets = new TargetLoader(properties, store, scheduler).load();

        assertThat(targets).hasSize(2);
        assertThat(targets.get(0).getUrl()).isEqualTo("https://a.example.com");
        assertThat(targets.get(0).getIntervalSeconds()).isEqualTo(90);
    }

    @Test
    void storedTargetsNoLongerConfiguredAreDeactivated() {
        properties.setTargets(List.of(
                definition("https://a.example.com", 30, null),
                definition("https://b.example.com", 30, null)));
        new TargetLoader(properties, store, scheduler).load();
        long bId = store.targetIds.get("https://b.example.com");

        properties.setTargets(List.of(definition("https://a.example.com", 30, null)));
        new TargetLoader(properties, store, scheduler).load();

        assertThat(store.activeTargets).containsExactly(store.targetIds.get("https://a.example.com"));
        assertThat(store.activeTargets).doesNotContain(bId);
    }

    @Test
    void inactiveDefinitionIsLoadedButNotActive() {
        SentinelProperties.TargetDefinition paused = definition("https://paused.example.com", 30, null);
        paused.setActive(false);
        properties.setTargets(List.of(paused));

        List<TargetConfig> targets = new TargetLoader(properties, store, scheduler).load();

        assertThat(targets).singleElement().satisfies(t -> assertThat(t.isActive()).isFalse());
        assertThat(store.activeTargets).isEmpty();
    }
}

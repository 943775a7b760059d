package com.company.sentinel.service;

import com.company.sentinel.config.SentinelProperties;
import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.exception.InvalidTargetException;
import com.company.sentinel.repository.MonitoringStore;
import com.company.sentinel.scheduler.ProbeScheduler;
import com.company.sentinel.util.TargetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates the configured targets, registers them in storage and hands the
 * set to the scheduler. Any invalid target fails startup.
 */
@Slf4j
public class TargetLoader implements ApplicationRunner {

    private final SentinelProperties properties;
    private final TargetValidator validator;
    private final MonitoringStore store;
    private final ProbeScheduler scheduler;

    public TargetLoader(SentinelProperties properties, MonitoringStore store, ProbeScheduler scheduler) {
        this.properties = properties;
        this.validator = new TargetValidator(
                properties.getInterval().getMinSeconds(), properties.getInterval().getMaxSeconds());
        this.store = store;
        this.scheduler = scheduler;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<TargetConfig> targets = load();
        scheduler.replaceTargets(targets);
    }

    public List<TargetConfig> load() {
        List<SentinelProperties.TargetDefinition> definitions = properties.getTargets();

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            for (String error : validator.validate(definitions.get(i))) {
                errors.add("targets[" + i + "]: " + error);
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidTargetException(errors);
        }

        // A repeated url maps to one stored row and keeps the position of its first definition
        Map<Long, TargetConfig> targets = new LinkedHashMap<>();
        for (SentinelProperties.TargetDefinition definition : definitions) {
            TargetConfig target = toTarget(definition);
            long id = store.registerTarget(target);
            if (targets.containsKey(id)) {
                log.warn("Target {} is configured more than once, using the last definition", target.getUrl());
            }
            targets.put(id, target.toBuilder().id(id).build());
        }

        int deactivated = store.deactivateTargetsExcept(targets.keySet());
        log.info("Loaded {} target(s) ({} active), deactivated {} stored target(s) no longer configured",
                targets.size(), targets.values().stream().filter(TargetConfig::isActive).count(), deactivated);
        return List.copyOf(targets.values());
    }

    private TargetConfig toTarget(SentinelProperties.TargetDefinition definition) {
        String pattern = definition.getRegexPattern();
        return TargetConfig.builder()
                .url(definition.getUrl())
                .intervalSeconds(definition.getCheckIntervalSeconds())
                .regexPattern(pattern != null && !pattern.isEmpty() ? pattern : null)
                .method(definition.getMethod())
                .active(definition.isActive())
                .build();
    }
}

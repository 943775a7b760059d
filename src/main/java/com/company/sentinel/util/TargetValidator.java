package com.company.sentinel.util;

import com.company.sentinel.config.SentinelProperties;
import com.company.sentinel.domain.enums.ProbeMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a configured target definition before it reaches the scheduler
 */
public class TargetValidator {

    private static final Pattern URL_PATTERN = Pattern.compile(
            "^(https?://)"
                    + "([a-zA-Z0-9][-a-zA-Z0-9]*(\\.[a-zA-Z0-9][-a-zA-Z0-9]*)+)"
                    + "(:\\d+)?"
                    + "(/[-a-zA-Z0-9_%/.~]*)?"
                    + "(\\?[-a-zA-Z0-9_%&=]*)?"
                    + "(#[-a-zA-Z0-9_]*)?$");

    private final int minIntervalSeconds;
    private final int maxIntervalSeconds;

    public TargetValidator(int minIntervalSeconds, int maxIntervalSeconds) {
        this.minIntervalSeconds = minIntervalSeconds;
        this.maxIntervalSeconds = maxIntervalSeconds;
    }

    public static boolean isValidUrl(String url) {
        return url != null && URL_PATTERN.matcher(url).matches();
    }

    public boolean isValidInterval(int seconds) {
        return seconds >= minIntervalSeconds && seconds <= maxIntervalSeconds;
    }

    public static boolean isValidPattern(String pattern) {
        if (pattern == null) {
            return true;
        }
        try {
            Pattern.compile(pattern);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    /**
     * @return validation errors, empty if the definition is usable
     */
    public List<String> validate(SentinelProperties.TargetDefinition definition) {
        List<String> errors = new ArrayList<>();

        String url = definition.getUrl();
        if (url == null || url.isBlank()) {
            errors.add("URL is required");
        } else if (!isValidUrl(url)) {
            errors.add("Invalid URL: " + url);
        }

        Integer interval = definition.getCheckIntervalSeconds();
        if (interval == null) {
            errors.add("Check interval is required");
        } else if (!isValidInterval(interval)) {
            errors.add(String.format("Check interval must be between %d and %d seconds, got %d",
                    minIntervalSeconds, maxIntervalSeconds, interval));
        }

        String pattern = definition.getRegexPattern();
        if (!isValidPattern(pattern)) {
            errors.add("Invalid regex pattern: " + pattern);
        } else if (pattern != null && !pattern.isEmpty() && definition.getMethod() == ProbeMethod.HEAD) {
            errors.add("Regex pattern cannot be checked with HEAD requests: " + url);
        }

        return errors;
    }
}

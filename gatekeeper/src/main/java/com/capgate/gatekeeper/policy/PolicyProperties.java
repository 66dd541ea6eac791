package com.capgate.gatekeeper.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Startup policy configuration ({@code capgate.policy.*}).
 *
 * Values are kept as strings and parsed by {@link PolicyEngine} so a typo
 * fails the context with a {@link PolicyException} naming the bad entry.
 *
 * <pre>
 * capgate:
 *   policy:
 *     mode: prod
 *     defaults:
 *       prod:
 *         write: forbid
 *     overrides:
 *       deploy: forbid
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "capgate.policy")
public class PolicyProperties {

    private String mode = "dev";
    private Map<String, Map<String, String>> defaults = new LinkedHashMap<>();
    private Map<String, String> overrides = new LinkedHashMap<>();

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Map<String, Map<String, String>> getDefaults() {
        return defaults;
    }

    public void setDefaults(Map<String, Map<String, String>> defaults) {
        this.defaults = defaults;
    }

    public Map<String, String> getOverrides() {
        return overrides;
    }

    public void setOverrides(Map<String, String> overrides) {
        this.overrides = overrides;
    }
}

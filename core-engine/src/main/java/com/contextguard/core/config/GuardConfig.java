package com.contextguard.core.config;

import com.contextguard.core.model.DetectionRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the Context Guard YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * remote:
 *   enabled: true
 *   baseUrl: http://localhost:8080
 * cache:
 *   maxEntries: 2000
 * monitor:
 *   slowOperationMillis: 3000
 * history:
 *   path: /var/lib/context-guard/recent-scans.json
 * rules:
 *   - name: password_assignment
 *     category: potential_secret
 *     pattern: '(?i)password\s*[:=]'
 *     severity: high
 * </pre>
 *
 * <p>
 * Every section is optional and falls back to its defaults. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class GuardConfig {

    private RemoteSettings remote = new RemoteSettings();
    private CacheSettings cache = new CacheSettings();
    private MonitorSettings monitor = new MonitorSettings();
    private HistorySettings history = new HistorySettings();
    private List<DetectionRule> rules = new ArrayList<>();

    /**
     * Validate every section and every rule.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        remote.validate(errors);
        cache.validate(errors);
        monitor.validate(errors);
        history.validate(errors);

        for (int i = 0; i < rules.size(); i++) {
            DetectionRule rule = rules.get(i);
            if (rule == null) {
                errors.add("rules[" + i + "] is empty");
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Context Guard configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public RemoteSettings getRemote() {
        return remote;
    }

    public void setRemote(RemoteSettings remote) {
        this.remote = remote != null ? remote : new RemoteSettings();
    }

    public CacheSettings getCache() {
        return cache;
    }

    public void setCache(CacheSettings cache) {
        this.cache = cache != null ? cache : new CacheSettings();
    }

    public MonitorSettings getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorSettings monitor) {
        this.monitor = monitor != null ? monitor : new MonitorSettings();
    }

    public HistorySettings getHistory() {
        return history;
    }

    public void setHistory(HistorySettings history) {
        this.history = history != null ? history : new HistorySettings();
    }

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detection rules
     */
    public List<DetectionRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by {@link GuardConfigLoader} when binding the {@code rules} section).
     *
     * @param rules the detection rules
     */
    public void setRules(List<DetectionRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "GuardConfig{" +
                "remote=" + remote +
                ", cache=" + cache +
                ", monitor=" + monitor +
                ", history=" + history +
                ", rules=" + rules.size() +
                '}';
    }
}

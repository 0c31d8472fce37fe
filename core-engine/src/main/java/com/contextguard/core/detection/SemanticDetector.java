package com.contextguard.core.detection;

import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.DetectionReport;
import com.contextguard.core.model.DetectionRule;
import com.contextguard.core.model.PatternMatch;
import com.contextguard.core.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Primary, rule-driven detector.
 *
 * <p>
 * Evaluates every configured {@link DetectionRule} that applies to the
 * request language against each line of the content and reports every
 * occurrence. Rules are compiled once at construction.
 * </p>
 *
 * <h3>Empty result</h3>
 * <p>
 * When no rule applies to the request language the detector returns an
 * empty {@link Optional}, so the orchestrator falls through to the next
 * tier. Text with applicable rules but no findings yields a clean,
 * low-risk report.
 * </p>
 *
 * <p>
 * This detector is <strong>stateless</strong> after construction and
 * therefore thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SemanticDetector implements CodeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticDetector.class);

    /** Upper bound of matches reported per rule and line. */
    static final int MAX_MATCHES_PER_LINE = 20;

    private final List<CompiledRule> rules;

    /**
     * @param rules the rules to evaluate; each is validated
     * @throws NullPointerException  if {@code rules} is {@code null}
     * @throws IllegalStateException if a rule is invalid
     */
    public SemanticDetector(List<DetectionRule> rules) {
        Objects.requireNonNull(rules, "Detection rules list must not be null");
        List<CompiledRule> compiled = new ArrayList<>(rules.size());
        for (DetectionRule rule : rules) {
            rule.validate();
            compiled.add(new CompiledRule(rule));
        }
        this.rules = List.copyOf(compiled);
        LOG.info("SemanticDetector initialised with {} rule(s)", this.rules.size());
    }

    @Override
    public Optional<DetectionReport> detect(AnalysisRequest request) {
        Objects.requireNonNull(request, "AnalysisRequest must not be null");

        List<CompiledRule> applicable = rules.stream()
                .filter(r -> r.rule.appliesTo(request.getLanguage()))
                .toList();
        if (applicable.isEmpty()) {
            LOG.debug("No rules apply to language '{}', deferring to next tier", request.getLanguage());
            return Optional.empty();
        }

        List<PatternMatch> matches = new ArrayList<>();
        Set<String> categories = new LinkedHashSet<>();
        Set<String> suggestions = new LinkedHashSet<>();

        String[] lines = request.getContent().split("\r?\n", -1);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            String line = lines[lineIndex];
            for (CompiledRule compiled : applicable) {
                Matcher matcher = compiled.pattern.matcher(line);
                int found = 0;
                while (found < MAX_MATCHES_PER_LINE && matcher.find()) {
                    if (matcher.end() == matcher.start()) {
                        // zero-width match, nothing to report
                        continue;
                    }
                    matches.add(new PatternMatch(compiled.rule.getCategory(),
                            lineIndex + 1, matcher.start() + 1, matcher.group(), compiled.severity));
                    categories.add(compiled.rule.getCategory());
                    if (compiled.rule.getSuggestion() != null && !compiled.rule.getSuggestion().isBlank()) {
                        suggestions.add(compiled.rule.getSuggestion());
                    }
                    found++;
                }
            }
        }

        matches.sort(Comparator.comparingInt(PatternMatch::getLine)
                .thenComparingInt(PatternMatch::getColumn));

        DetectionReport report = new DetectionReport(null, categories,
                new ArrayList<>(suggestions), matches);
        LOG.debug("SemanticDetector found {} match(es) in {} line(s), risk={}",
                matches.size(), lines.length, report.getRiskLevel());
        return Optional.of(report);
    }

    @Override
    public String getName() {
        return "semantic";
    }

    /**
     * @return number of configured rules
     */
    public int getRuleCount() {
        return rules.size();
    }

    private static final class CompiledRule {
        final DetectionRule rule;
        final Pattern pattern;
        final RiskLevel severity;

        CompiledRule(DetectionRule rule) {
            this.rule = rule;
            this.pattern = Pattern.compile(rule.getPattern());
            this.severity = RiskLevel.fromLabel(rule.getSeverity());
        }
    }
}

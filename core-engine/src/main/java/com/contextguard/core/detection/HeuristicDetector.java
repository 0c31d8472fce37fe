package com.contextguard.core.detection;

import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.DetectionReport;
import com.contextguard.core.model.PatternMatch;
import com.contextguard.core.model.PatternTags;
import com.contextguard.core.model.RiskLevel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort detector with a fixed, built-in pattern set.
 *
 * <p>
 * Pure function of its input: no configuration, no I/O, no shared state.
 * {@link #analyze(AnalysisRequest)} never throws for a non-null request, so
 * the fallback chain always ends with a result.
 * </p>
 *
 * <p>
 * Classification happens in two passes. Tags are detected on the whole
 * text; then every line is scanned once per detected tag and the first
 * occurrence of that tag's marker on the line is reported as a match.
 * </p>
 *
 * @since 1.0.0
 */
public class HeuristicDetector implements CodeDetector {

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("(?i)api[_-]?key[_-]?\\s*[:=]\\s*[\"']?[a-zA-Z0-9_-]{20,}"),
            Pattern.compile("(?i)password[_-]?\\s*[:=]\\s*[\"']?[^\"'\\s]{6,}"),
            Pattern.compile("(?i)secret[_-]?\\s*[:=]\\s*[\"']?[^\"'\\s]{8,}"),
            Pattern.compile("(?i)token[_-]?\\s*[:=]\\s*[\"']?[a-zA-Z0-9_-]{20,}"),
            Pattern.compile("(?i)private[_-]?key"),
            Pattern.compile("sk-[a-zA-Z0-9]{20,}"),
            Pattern.compile("ghp_[a-zA-Z0-9]{36}"));

    private static final List<String> BUSINESS_KEYWORDS = List.of(
            "calculateprice", "algorithm", "proprietary", "secret sauce",
            "business logic", "competitive advantage", "trade secret");

    private static final List<Pattern> INFRASTRUCTURE_PATTERNS = List.of(
            Pattern.compile("(?i)localhost"),
            Pattern.compile("127\\.0\\.0\\.1"),
            Pattern.compile("192\\.168\\."),
            Pattern.compile("10\\.\\d+\\.\\d+\\.\\d+"),
            Pattern.compile("(?i)internal[._-]"),
            Pattern.compile("(?i)://[^/]*internal"));

    // Line markers used to locate findings once a tag is known to be present.
    private static final Pattern SECRET_MARKER =
            Pattern.compile("(?i)(?:(?:api[_-]?key|password|secret|token|private[_-]?key)\\s*[:=]"
                    + "|sk-[a-z0-9]{20,}|ghp_[a-z0-9]{36})");
    private static final Pattern BUSINESS_MARKER =
            Pattern.compile("(?i)(?:calculatePrice|algorithm|proprietary)");
    private static final Pattern INFRASTRUCTURE_MARKER =
            Pattern.compile("(?i)(?:localhost|127\\.0\\.0\\.1|internal)");

    /**
     * Analyse the request with the built-in patterns.
     *
     * @param request the snippet to analyse
     * @return the report, never {@code null}
     */
    public DetectionReport analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "AnalysisRequest must not be null");
        String content = request.getContent();

        Set<String> tags = detectTags(content);
        List<PatternMatch> matches = findMatches(content, tags);

        return new DetectionReport(riskFor(tags), tags, suggestionsFor(tags), matches);
    }

    @Override
    public Optional<DetectionReport> detect(AnalysisRequest request) {
        return Optional.of(analyze(request));
    }

    @Override
    public String getName() {
        return "heuristic";
    }

    private static Set<String> detectTags(String content) {
        Set<String> tags = new LinkedHashSet<>();
        if (SECRET_PATTERNS.stream().anyMatch(p -> p.matcher(content).find())) {
            tags.add(PatternTags.SECRET);
        }
        String lower = content.toLowerCase(Locale.ROOT);
        if (BUSINESS_KEYWORDS.stream().anyMatch(lower::contains)) {
            tags.add(PatternTags.BUSINESS_LOGIC);
        }
        if (INFRASTRUCTURE_PATTERNS.stream().anyMatch(p -> p.matcher(content).find())) {
            tags.add(PatternTags.INFRASTRUCTURE);
        }
        return tags;
    }

    private static List<PatternMatch> findMatches(String content, Set<String> tags) {
        List<PatternMatch> matches = new ArrayList<>();
        String[] lines = content.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            for (String tag : tags) {
                Pattern marker;
                RiskLevel severity;
                switch (tag) {
                    case PatternTags.SECRET:
                        marker = SECRET_MARKER;
                        severity = RiskLevel.HIGH;
                        break;
                    case PatternTags.BUSINESS_LOGIC:
                        marker = BUSINESS_MARKER;
                        severity = RiskLevel.MEDIUM;
                        break;
                    case PatternTags.INFRASTRUCTURE:
                        marker = INFRASTRUCTURE_MARKER;
                        severity = RiskLevel.MEDIUM;
                        break;
                    default:
                        continue;
                }
                Matcher m = marker.matcher(lines[i]);
                if (m.find()) {
                    matches.add(new PatternMatch(tag, i + 1, m.start() + 1, m.group(), severity));
                }
            }
        }
        return matches;
    }

    private static RiskLevel riskFor(Set<String> tags) {
        if (tags.contains(PatternTags.SECRET)) {
            return RiskLevel.HIGH;
        }
        if (tags.contains(PatternTags.BUSINESS_LOGIC) || tags.contains(PatternTags.INFRASTRUCTURE)) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static List<String> suggestionsFor(Set<String> tags) {
        List<String> suggestions = new ArrayList<>();
        if (tags.contains(PatternTags.SECRET)) {
            suggestions.add("Consider using environment variables for sensitive data");
            suggestions.add("Use a secrets management system like Azure Key Vault or AWS Secrets Manager");
            suggestions.add("Review your .gitignore to ensure secrets are not committed");
        }
        if (tags.contains(PatternTags.BUSINESS_LOGIC)) {
            suggestions.add("Review if this business logic should be shared with AI assistants");
            suggestions.add("Consider abstracting proprietary algorithms");
        }
        if (tags.contains(PatternTags.INFRASTRUCTURE)) {
            suggestions.add("Avoid exposing internal infrastructure details");
            suggestions.add("Use configuration files for environment-specific settings");
        }
        return suggestions;
    }
}

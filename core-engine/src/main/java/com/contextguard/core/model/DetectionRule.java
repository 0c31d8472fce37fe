package com.contextguard.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Describes a single pattern rule loaded from configuration.
 *
 * <p>
 * A rule tags every line fragment matching {@code pattern} with
 * {@code category} at the given {@code severity}, and contributes its
 * {@code suggestion} to the result. An empty {@code languages} list applies
 * the rule to every language.
 * </p>
 *
 * <pre>
 * rules:
 *   - name: password_assignment
 *     category: potential_secret
 *     pattern: '(?i)password[_-]?\s*[:=]\s*["']?[^"'\s]{6,}'
 *     severity: high
 *     suggestion: Consider using environment variables for sensitive data
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule {

    /** Unique rule name used in logs. */
    private String name;

    /** Pattern tag reported for matches, e.g. {@code potential_secret}. */
    private String category;

    /** Java regular expression evaluated per line. */
    private String pattern;

    /** Severity label: "low", "medium" or "high". */
    private String severity = "medium";

    /** Remediation hint added to the result when the rule fires. */
    private String suggestion;

    /** Language tags the rule applies to; empty means all. */
    private List<String> languages = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields are present and legal.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (category == null || category.isBlank()) {
            errors.add("Rule '" + name + "' requires 'category'");
        }
        if (pattern == null || pattern.isBlank()) {
            errors.add("Rule '" + name + "' requires 'pattern'");
        } else {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                errors.add("Rule '" + name + "' has an invalid pattern: " + e.getDescription());
            }
        }
        if (severity == null) {
            errors.add("Rule '" + name + "' requires 'severity'");
        } else {
            try {
                RiskLevel.fromLabel(severity);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + name + "' has unknown severity '" + severity
                        + "'. Supported: low, medium, high");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    /**
     * @param language language tag of a request
     * @return {@code true} if this rule applies to the language
     */
    public boolean appliesTo(String language) {
        if (languages.isEmpty()) {
            return true;
        }
        String normalized = language == null ? "" : language.toLowerCase(Locale.ROOT);
        return languages.stream().anyMatch(l -> l.equalsIgnoreCase(normalized));
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public String getSeverity() {
        return severity;
    }

    /**
     * Set the severity, normalised to lowercase.
     *
     * @param severity severity label
     */
    public void setSeverity(String severity) {
        this.severity = severity != null ? severity.toLowerCase(Locale.ROOT) : null;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public void setSuggestion(String suggestion) {
        this.suggestion = suggestion;
    }

    public List<String> getLanguages() {
        return Collections.unmodifiableList(languages);
    }

    public void setLanguages(List<String> languages) {
        this.languages = languages != null ? new ArrayList<>(languages) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "name='" + name + '\'' +
                ", category='" + category + '\'' +
                ", severity='" + severity + '\'' +
                ", languages=" + languages +
                '}';
    }
}

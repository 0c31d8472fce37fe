package com.contextguard.core.cache;

import com.contextguard.core.model.AnalysisRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CacheKeyGenerator}.
 */
class CacheKeyGeneratorTest {

    @Test
    @DisplayName("Should produce analysis_<sha256>_<language> keys")
    void shouldUseKeyFormat() {
        String key = CacheKeyGenerator.generate("int x = 1;", "java", null);

        assertThat(key).matches("analysis_[0-9a-f]{64}_java");
    }

    @Test
    @DisplayName("Should be deterministic and sensitive to content and language")
    void shouldBeDeterministic() {
        String a = CacheKeyGenerator.generate("code", "java", Map.of());
        String b = CacheKeyGenerator.generate("code", "java", null);

        assertThat(a).isEqualTo(b);
        assertThat(CacheKeyGenerator.generate("code2", "java", null)).isNotEqualTo(a);
        assertThat(CacheKeyGenerator.generate("code", "python", null)).isNotEqualTo(a);
    }

    @Test
    @DisplayName("Option order should not change the key")
    void shouldIgnoreOptionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("mode", "strict");
        first.put("depth", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("depth", 2);
        second.put("mode", "strict");

        assertThat(CacheKeyGenerator.generate("x", "go", first))
                .isEqualTo(CacheKeyGenerator.generate("x", "go", second));
        assertThat(CacheKeyGenerator.generate("x", "go", Map.of("mode", "lenient")))
                .isNotEqualTo(CacheKeyGenerator.generate("x", "go", first));
    }

    @Test
    @DisplayName("Source name should not take part in the fingerprint")
    void shouldIgnoreName() {
        AnalysisRequest one = AnalysisRequest.of("x", "go", "a.go");
        AnalysisRequest two = AnalysisRequest.of("x", "go", "b.go");

        assertThat(CacheKeyGenerator.generate(one)).isEqualTo(CacheKeyGenerator.generate(two));
    }

    @Test
    @DisplayName("Should reject an option with a null name")
    void shouldRejectNullOptionName() {
        Map<String, Object> options = new HashMap<>();
        options.put(null, "strict");

        assertThatThrownBy(() -> CacheKeyGenerator.generate("x", "go", options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Option names must not be null");
    }
}

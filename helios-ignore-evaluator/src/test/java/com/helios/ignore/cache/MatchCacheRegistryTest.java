package com.helios.ignore.cache;

import com.helios.ignore.api.model.Polarity;
import com.helios.ignore.api.model.RuleSetFingerprint;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchCacheRegistryTest {

    private static final Path SOURCE = Path.of("/data/folder/.stignore");

    private static RuleSetFingerprint fingerprint(String... sources) {
        return new RuleSetFingerprint(Arrays.stream(sources)
                .map(s -> new RuleSetFingerprint.Entry(s, Polarity.SELECT))
                .toList());
    }

    private final MatchCacheRegistry registry = new MatchCacheRegistry();

    @Test
    void shouldReuseCacheWhenFingerprintIsEqual() {
        MatchResultCache first = registry.bind(SOURCE, fingerprint("^a$", "^b$"));
        first.put("a", true);

        MatchResultCache second = registry.bind(SOURCE, fingerprint("^a$", "^b$"));

        assertThat(second).isSameAs(first);
        assertThat(second.get("a")).contains(true);
    }

    @Test
    void shouldReplaceCacheWhenFingerprintDiffers() {
        MatchResultCache first = registry.bind(SOURCE, fingerprint("^a$"));
        first.put("a", true);

        MatchResultCache second = registry.bind(SOURCE, fingerprint("^a$", "^c$"));

        assertThat(second).isNotSameAs(first);
        assertThat(second.size()).isZero();
        assertThat(registry.get(SOURCE)).containsSame(second);
    }

    @Test
    void shouldTreatPolarityAsPartOfFingerprint() {
        RuleSetFingerprint selecting = fingerprint("^a$");
        RuleSetFingerprint deselecting = new RuleSetFingerprint(List.of(
                new RuleSetFingerprint.Entry("^a$", Polarity.DESELECT)));

        MatchResultCache first = registry.bind(SOURCE, selecting);
        MatchResultCache second = registry.bind(SOURCE, deselecting);

        assertThat(second).isNotSameAs(first);
    }

    @Test
    void shouldTreatOrderAsPartOfFingerprint() {
        MatchResultCache first = registry.bind(SOURCE, fingerprint("^a$", "^b$"));
        MatchResultCache second = registry.bind(SOURCE, fingerprint("^b$", "^a$"));

        assertThat(second).isNotSameAs(first);
    }

    @Test
    void shouldKeepSourcesIndependent() {
        MatchResultCache first = registry.bind(SOURCE, fingerprint("^a$"));
        MatchResultCache other = registry.bind(Path.of("/other/.stignore"), fingerprint("^a$"));

        assertThat(other).isNotSameAs(first);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldForgetEvictedSource() {
        MatchResultCache first = registry.bind(SOURCE, fingerprint("^a$"));

        registry.evict(SOURCE);

        assertThat(registry.get(SOURCE)).isEmpty();
        assertThat(registry.bind(SOURCE, fingerprint("^a$"))).isNotSameAs(first);
    }

    @Test
    void shouldBuildCachesThroughFactory() {
        MatchCacheRegistry bounded = new MatchCacheRegistry(fp -> MatchResultCache.builder(fp)
                .maxSize(10)
                .recordStats(true)
                .build());

        MatchResultCache cache = bounded.bind(SOURCE, fingerprint("^a$"));
        cache.get("x");

        assertThat(cache.getMetrics().misses()).isEqualTo(1);
    }
}

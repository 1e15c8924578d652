package com.helios.ignore.api.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleSetTest {

    private static PathPattern literal(String text) {
        return new PathPattern() {
            @Override
            public boolean matches(String path) {
                return text.equals(path);
            }

            @Override
            public String source() {
                return text;
            }
        };
    }

    @Test
    void shouldFingerprintBySourceAndPolarityNotIdentity() {
        RuleSet first = new RuleSet(List.of(
                new PathPredicate(literal("a"), Polarity.SELECT),
                new PathPredicate(literal("b"), Polarity.DESELECT)), List.of(Path.of("x")));
        RuleSet second = new RuleSet(List.of(
                new PathPredicate(literal("a"), Polarity.SELECT),
                new PathPredicate(literal("b"), Polarity.DESELECT)), List.of(Path.of("y")));

        assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        assertThat(first.fingerprint().size()).isEqualTo(2);
    }

    @Test
    void shouldDistinguishOrderAndPolarity() {
        PathPredicate a = new PathPredicate(literal("a"), Polarity.SELECT);
        PathPredicate b = new PathPredicate(literal("b"), Polarity.SELECT);

        assertThat(RuleSetFingerprint.of(List.of(a, b))).isNotEqualTo(RuleSetFingerprint.of(List.of(b, a)));
        assertThat(RuleSetFingerprint.of(List.of(a)))
                .isNotEqualTo(RuleSetFingerprint.of(List.of(new PathPredicate(literal("a"), Polarity.DESELECT))));
    }

    @Test
    void shouldCopyInputLists() {
        List<PathPredicate> predicates = new ArrayList<>();
        predicates.add(new PathPredicate(literal("a"), Polarity.SELECT));
        RuleSet ruleSet = new RuleSet(predicates, List.of());

        predicates.clear();

        assertThat(ruleSet.size()).isEqualTo(1);
        PathPredicate extra = new PathPredicate(literal("b"), Polarity.SELECT);
        assertThatThrownBy(() -> ruleSet.predicates().add(extra))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldDescribeWithExcludeMarker() {
        assertThat(new PathPredicate(literal("^a$"), Polarity.SELECT).describe()).isEqualTo("^a$");
        assertThat(new PathPredicate(literal("^a$"), Polarity.DESELECT).describe()).isEqualTo("(?exclude)^a$");
    }

    @Test
    void shouldExposeEmptyRuleSet() {
        assertThat(RuleSet.empty().isEmpty()).isTrue();
        assertThat(RuleSet.empty().fingerprint().entries()).isEmpty();
        assertThat(MatchExplanation.noMatch("p").matched()).isFalse();
    }
}

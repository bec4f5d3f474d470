package org.pragmatica.querylang.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermPairTest {

    @Test
    void of_ordersMembers() {
        assertThat(TermPair.of("b", "a")).isEqualTo(new TermPair("a", "b"));
        assertThat(TermPair.of("a", "b")).isEqualTo(TermPair.of("b", "a"));
    }

    @Test
    void constructor_rejectsUnorderedOrEqualMembers() {
        assertThatThrownBy(() -> new TermPair("b", "a")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TermPair.of("a", "a")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void order_isLexicographicByStringValue() {
        assertThat(TermPair.of("Zed", "apple").first()).isEqualTo("Zed");
        assertThat(TermPair.of("a", "b")).isLessThan(TermPair.of("a", "c"));
        assertThat(TermPair.of("a", "z")).isLessThan(TermPair.of("b", "c"));
    }
}

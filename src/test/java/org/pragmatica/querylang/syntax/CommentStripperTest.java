package org.pragmatica.querylang.syntax;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommentStripperTest {
    private final CommentStripper stripper = CommentStripper.create();

    @Test
    void strip_removesBlockWithoutLeavingWhitespace() {
        assertThat(stripper.strip("a<<<note>>>b")).isEqualTo("ab");
    }

    @Test
    void strip_removesEveryBlockNonGreedily() {
        assertThat(stripper.strip("a <<<one>>> AND <<<two>>> b")).isEqualTo("a  AND  b");
    }

    @Test
    void strip_blockSpansNewlines() {
        assertThat(stripper.strip("a <<<first\nsecond>>>OR b")).isEqualTo("a OR b");
    }

    @Test
    void strip_blocksDoNotNest() {
        assertThat(stripper.strip("a<<< x <<< y >>> z>>>")).isEqualTo("a z>>>");
    }

    @Test
    void strip_unterminatedBlock_removesToEndOfInput() {
        assertThat(stripper.strip("a AND b <<<dangling AND c")).isEqualTo("a AND b ");
    }

    @Test
    void strip_withoutMarkers_returnsInputUnchanged() {
        assertThat(stripper.strip("a >>> b")).isEqualTo("a >>> b");
        assertThat(stripper.strip("")).isEmpty();
    }

    @Test
    void strip_customMarkers_areTakenLiterally() {
        var custom = CommentStripper.create("/*", "*/");

        assertThat(custom.strip("a /* .* */ b")).isEqualTo("a  b");
    }

    @Test
    void create_emptyMarker_isRejected() {
        assertThatThrownBy(() -> CommentStripper.create("", ">>>"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

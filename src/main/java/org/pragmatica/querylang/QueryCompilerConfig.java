package org.pragmatica.querylang;

import org.pragmatica.querylang.rewrite.QueryRewriter;
import org.pragmatica.querylang.syntax.CommentStripper;
import org.pragmatica.querylang.syntax.QueryParser;

import java.util.Optional;

/**
 * Configuration of a {@link QueryCompiler}.
 *
 * @param passLimit    maximum number of normalization passes
 * @param nodeLimit    maximum size of the normalized tree, unlimited when empty
 * @param caseFold     lowercase bare words and quoted phrases; literals always keep their case
 * @param literalOpen  opening delimiter of exact-match literals
 * @param literalClose closing delimiter of exact-match literals
 * @param commentOpen  opening marker of annotation blocks
 * @param commentClose closing marker of annotation blocks
 * @param maxDepth     deepest accepted nesting of parentheses and negations
 */
public record QueryCompilerConfig(int passLimit,
                                  Optional<Integer> nodeLimit,
                                  boolean caseFold,
                                  String literalOpen,
                                  String literalClose,
                                  String commentOpen,
                                  String commentClose,
                                  int maxDepth) {
    public static final QueryCompilerConfig DEFAULT = builder().build();

    public QueryCompilerConfig {
        if (passLimit < 1) {
            throw new IllegalArgumentException("passLimit must be positive: " + passLimit);
        }
        if (nodeLimit.isPresent() && nodeLimit.get() < 1) {
            throw new IllegalArgumentException("nodeLimit must be positive: " + nodeLimit.get());
        }
        requireMarker("literalOpen", literalOpen);
        requireMarker("literalClose", literalClose);
        requireMarker("commentOpen", commentOpen);
        requireMarker("commentClose", commentClose);
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireMarker(String name, String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }

    public static final class Builder {
        private int passLimit = QueryRewriter.DEFAULT_PASS_LIMIT;
        private Optional<Integer> nodeLimit = Optional.empty();
        private boolean caseFold = true;
        private String literalOpen = QueryParser.DEFAULT_LITERAL_OPEN;
        private String literalClose = QueryParser.DEFAULT_LITERAL_CLOSE;
        private String commentOpen = CommentStripper.DEFAULT_OPEN;
        private String commentClose = CommentStripper.DEFAULT_CLOSE;
        private int maxDepth = QueryParser.DEFAULT_MAX_DEPTH;

        private Builder() {}

        public Builder passLimit(int passLimit) {
            this.passLimit = passLimit;
            return this;
        }

        public Builder nodeLimit(int nodeLimit) {
            this.nodeLimit = Optional.of(nodeLimit);
            return this;
        }

        public Builder unlimitedNodes() {
            this.nodeLimit = Optional.empty();
            return this;
        }

        public Builder caseFold(boolean caseFold) {
            this.caseFold = caseFold;
            return this;
        }

        public Builder literalDelimiters(String open, String close) {
            this.literalOpen = open;
            this.literalClose = close;
            return this;
        }

        public Builder commentDelimiters(String open, String close) {
            this.commentOpen = open;
            this.commentClose = close;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public QueryCompilerConfig build() {
            return new QueryCompilerConfig(passLimit,
                                           nodeLimit,
                                           caseFold,
                                           literalOpen,
                                           literalClose,
                                           commentOpen,
                                           commentClose,
                                           maxDepth);
        }
    }
}

package org.pragmatica.querylang.syntax;

import java.util.regex.Pattern;

/**
 * Removes annotation blocks such as {@code <<<note>>>} from raw query text.
 *
 * <p>Blocks do not nest; each one ends at the first following close marker, or at end of input when unterminated.
 * Removed spans are deleted, not replaced with whitespace.
 */
public final class CommentStripper {
    public static final String DEFAULT_OPEN = "<<<";
    public static final String DEFAULT_CLOSE = ">>>";

    private final Pattern block;

    private CommentStripper(String open, String close) {
        this.block = Pattern.compile(Pattern.quote(open) + ".*?(?:" + Pattern.quote(close) + "|\\z)", Pattern.DOTALL);
    }

    public static CommentStripper create() {
        return create(DEFAULT_OPEN, DEFAULT_CLOSE);
    }

    public static CommentStripper create(String open, String close) {
        if (open.isEmpty() || close.isEmpty()) {
            throw new IllegalArgumentException("Comment markers must not be empty");
        }
        return new CommentStripper(open, close);
    }

    public String strip(String text) {
        return block.matcher(text)
                    .replaceAll("");
    }
}

package org.pragmatica.rewrite.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Trivia represents non-semantic content attached to a token: whitespace, line breaks and comments.
 * Order within a trivia list is significant.
 */
public sealed interface Trivia {
    /**
     * Source text of this piece, exactly as it appears in the file.
     */
    String text();

    record Spaces(int count) implements Trivia {
        public Spaces {
            checkArgument(count > 0, "Spaces count must be positive: %s", count);
        }

        @Override
        public String text() {
            return " ".repeat(count);
        }
    }

    record Tabs(int count) implements Trivia {
        public Tabs {
            checkArgument(count > 0, "Tabs count must be positive: %s", count);
        }

        @Override
        public String text() {
            return "\t".repeat(count);
        }
    }

    record Newlines(int count) implements Trivia {
        public Newlines {
            checkArgument(count > 0, "Newlines count must be positive: %s", count);
        }

        @Override
        public String text() {
            return "\n".repeat(count);
        }
    }

    /**
     * A {@code //} comment. The text excludes the line break that terminates it.
     */
    record LineComment(String text) implements Trivia {
        public LineComment {
            checkNotNull(text);
        }
    }

    record BlockComment(String text) implements Trivia {
        public BlockComment {
            checkNotNull(text);
        }
    }

    static Trivia spaces(int count) {
        return new Spaces(count);
    }

    static Trivia tabs(int count) {
        return new Tabs(count);
    }

    static Trivia newlines(int count) {
        return new Newlines(count);
    }

    static Trivia lineComment(String text) {
        return new LineComment(text);
    }

    static Trivia blockComment(String text) {
        return new BlockComment(text);
    }

    default boolean isNewline() {
        return this instanceof Newlines;
    }

    default boolean isComment() {
        return this instanceof LineComment || this instanceof BlockComment;
    }
}

package org.pragmatica.rewrite.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriviaTest {

    @Test
    void whitespace_rendersRepeatedCharacters() {
        assertThat(Trivia.spaces(3).text()).isEqualTo("   ");
        assertThat(Trivia.tabs(2).text()).isEqualTo("\t\t");
        assertThat(Trivia.newlines(2).text()).isEqualTo("\n\n");
    }

    @Test
    void comments_renderTheirText() {
        assertThat(Trivia.lineComment("// note").text()).isEqualTo("// note");
        assertThat(Trivia.blockComment("/* a\n b */").text()).isEqualTo("/* a\n b */");
    }

    @Test
    void classification() {
        assertThat(Trivia.newlines(1).isNewline()).isTrue();
        assertThat(Trivia.spaces(1).isNewline()).isFalse();
        assertThat(Trivia.lineComment("//").isComment()).isTrue();
        assertThat(Trivia.blockComment("/**/").isComment()).isTrue();
        assertThat(Trivia.tabs(1).isComment()).isFalse();
    }

    @Test
    void equalPieces_areEqual() {
        assertThat(Trivia.spaces(2)).isEqualTo(new Trivia.Spaces(2));
        assertThat(Trivia.spaces(2)).isNotEqualTo(Trivia.tabs(2));
    }

    @Test
    void nonPositiveCount_isRejected() {
        assertThatThrownBy(() -> Trivia.spaces(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Trivia.newlines(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}

package io.flakeedit.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChangeIdTest {

    @Test
    void plainIdHasNoNestedPart() {
        ChangeId id = ChangeId.of("nixpkgs");

        assertThat(id.input()).isEqualTo("nixpkgs");
        assertThat(id.follows()).isEmpty();
        assertThat(id.isNested()).isFalse();
    }

    @Test
    void onlyTheFirstDotSplits() {
        ChangeId id = ChangeId.of("crane.rust-overlay.nixpkgs");

        assertThat(id.input()).isEqualTo("crane");
        assertThat(id.follows()).contains("rust-overlay.nixpkgs");
        assertThat(id.isNested()).isTrue();
    }

    @Nested
    @DisplayName("matchesWithFollows")
    class WithFollows {

        @Test
        void plainIdMatchesAnyNestedName() {
            ChangeId id = ChangeId.of("crane");

            assertThat(id.matchesWithFollows("crane", "nixpkgs")).isTrue();
            assertThat(id.matchesWithFollows("crane", null)).isTrue();
            assertThat(id.matchesWithFollows("nixpkgs", null)).isFalse();
        }

        @Test
        void nestedIdRequiresEqualNestedName() {
            ChangeId id = ChangeId.of("crane.nixpkgs");

            assertThat(id.matchesWithFollows("crane", "nixpkgs")).isTrue();
            assertThat(id.matchesWithFollows("crane", "flake-utils")).isFalse();
            assertThat(id.matchesWithFollows("crane", null)).isFalse();
        }
    }

    @Test
    void contextPushKeepsTheOwner() {
        Context context = Context.of("crane").push("inputs").push("nixpkgs");

        assertThat(context.first()).contains("crane");
        assertThat(context.segments()).containsExactly("crane", "inputs", "nixpkgs");
        assertThat(context).isEqualTo(Context.of("crane", "inputs", "nixpkgs"));
        assertThat(context.toString()).isEqualTo("crane.inputs.nixpkgs");
    }
}

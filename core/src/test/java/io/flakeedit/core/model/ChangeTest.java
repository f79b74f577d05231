package io.flakeedit.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ChangeTest {

    @Test
    void addAndChangeUrlCarryThePlainId() {
        Change.Add add = new Change.Add("flake-utils", "github:numtide/flake-utils", true);
        Change.ChangeUrl change = new Change.ChangeUrl("nixpkgs", "github:nixos/nixpkgs/nixos-24.05");

        assertThat(add.id()).isEqualTo("flake-utils");
        assertThat(add.uri()).isEqualTo("github:numtide/flake-utils");
        assertThat(change.id()).isEqualTo("nixpkgs");
        assertThat(change.refOrRev()).isNull();
    }

    @Test
    void removeCopiesItsIds() {
        Change.Remove remove = Change.Remove.of("nixpkgs", "crane.rust-overlay");

        assertThat(remove.ids()).containsExactly(ChangeId.of("nixpkgs"), ChangeId.of("crane.rust-overlay"));
        assertThatThrownBy(() -> remove.ids().add(ChangeId.of("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void followsRequiresBothSides() {
        Change.Follows follows = Change.Follows.of("crane.nixpkgs", "nixpkgs");

        assertThat(follows.input().input()).isEqualTo("crane");
        assertThat(follows.target()).isEqualTo("nixpkgs");
        assertThatThrownBy(() -> new Change.Follows(ChangeId.of("crane"), null))
                .isInstanceOf(NullPointerException.class);
    }
}

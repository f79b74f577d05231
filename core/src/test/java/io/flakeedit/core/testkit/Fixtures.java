package io.flakeedit.core.testkit;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Loads manifests and lock files from {@code src/test/resources/fixtures}. */
public final class Fixtures {

    /** Every manifest fixture, for tests that must hold on any surface syntax. */
    public static final List<String> MANIFESTS = List.of(
            "nested.flake.nix", "flat.flake.nix", "mixed.flake.nix", "no_inputs.flake.nix", "open_outputs.flake.nix");

    private Fixtures() {}

    public static String read(String name) {
        String resource = "/fixtures/" + name;
        try (InputStream in = Fixtures.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

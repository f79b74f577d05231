package io.flakeedit.core.model;

/** Edit of the {@code outputs} parameter list that keeps it in sync with the inputs. */
public sealed interface OutputChange permits OutputChange.Add, OutputChange.Remove {

    String id();

    record Add(String id) implements OutputChange {}

    record Remove(String id) implements OutputChange {}
}

package io.flakeedit.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module carries no command-line dependencies. Inspects the runtime
 * classpath for the packages of the CLI stack and fails if any are found.
 */
class CoreDependencyTest {

    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "info.picocli", // command-line parsing
            "io.flakeedit.cli" // the CLI module itself
            );

    @Test
    void coreClasspathContainsNoCommandLineDependencies() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }
}

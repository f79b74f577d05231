package io.flakeedit.cli;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.List;

/** Unified patch between two versions of a manifest, as printed by {@code --diff}. */
final class ManifestDiff {

    static final int CONTEXT_LINES = 3;

    private ManifestDiff() {
        // utility class
    }

    /**
     * Renders the changes from {@code original} to {@code revised} as a unified diff with
     * {@code original}/{@code modified} file headers. Identical texts give an empty string.
     */
    static String unified(String original, String revised) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();
        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> lines =
                UnifiedDiffUtils.generateUnifiedDiff("original", "modified", originalLines, patch, CONTEXT_LINES);
        return String.join("\n", lines) + "\n";
    }
}

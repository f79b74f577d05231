package io.flakeedit.core.walk;

import io.flakeedit.core.syntax.SyntaxElement;
import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Reads the key and value of {@code key = value;} bindings. */
final class AttrPaths {

    private AttrPaths() {}

    /**
     * Names of an {@code a.b."c"} path with quotes removed. Empty when a segment is computed
     * ({@code ${…}} or an interpolated string), since such a key has no static name.
     */
    static Optional<List<String>> segments(SyntaxNode attrpath) {
        List<String> names = new ArrayList<>();
        for (SyntaxNode part : attrpath.children()) {
            if (part.kind() == SyntaxKind.NODE_IDENT) {
                names.add(part.text());
            } else if (part.kind() == SyntaxKind.NODE_STRING && isPlainString(part)) {
                names.add(stringContent(part));
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(names);
    }

    /** Segments of the key of a {@link SyntaxKind#NODE_ATTRPATH_VALUE}. */
    static Optional<List<String>> keyOf(SyntaxNode statement) {
        return statement.firstChild(SyntaxKind.NODE_ATTRPATH).flatMap(AttrPaths::segments);
    }

    /** The value expression of a binding, if the parser produced one. */
    static Optional<SyntaxNode> valueOf(SyntaxNode statement) {
        List<SyntaxNode> children = statement.children();
        if (children.size() < 2 || children.get(0).kind() != SyntaxKind.NODE_ATTRPATH) {
            return Optional.empty();
        }
        return Optional.of(children.get(1));
    }

    private static boolean isPlainString(SyntaxNode string) {
        for (SyntaxElement child : string.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.NODE_INTERPOL) {
                return false;
            }
        }
        return true;
    }

    private static String stringContent(SyntaxNode string) {
        StringBuilder content = new StringBuilder();
        for (SyntaxElement child : string.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.TOKEN_STRING_CONTENT) {
                content.append(child.text());
            }
        }
        return content.toString();
    }
}

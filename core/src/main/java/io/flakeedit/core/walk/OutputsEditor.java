package io.flakeedit.core.walk;

import io.flakeedit.core.model.OutputChange;
import io.flakeedit.core.model.Outputs;
import io.flakeedit.core.syntax.GreenElement;
import io.flakeedit.core.syntax.GreenNode;
import io.flakeedit.core.syntax.SyntaxElement;
import io.flakeedit.core.syntax.SyntaxFactory;
import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Reads and edits the parameter pattern of {@code outputs = { self, ... }: …;}. */
final class OutputsEditor {

    private OutputsEditor() {}

    static Outputs list(InputLayout layout) {
        Optional<SyntaxNode> pattern = pattern(layout);
        if (pattern.isEmpty()) {
            return new Outputs.None();
        }
        List<String> names = new ArrayList<>();
        boolean any = false;
        for (SyntaxElement child : pattern.get().childrenWithTokens()) {
            if (child.kind() == SyntaxKind.NODE_PAT_ENTRY) {
                names.add(entryName((SyntaxNode) child));
            } else if (child.kind() == SyntaxKind.TOKEN_ELLIPSIS) {
                any = true;
            }
        }
        if (names.isEmpty()) {
            return new Outputs.None();
        }
        return any ? new Outputs.Any(names) : new Outputs.Multiple(names);
    }

    static Optional<GreenNode> change(InputLayout layout, OutputChange change) {
        Optional<SyntaxNode> pattern = pattern(layout);
        if (pattern.isEmpty()) {
            return Optional.empty();
        }
        List<SyntaxNode> entries = entries(pattern.get());
        Optional<SyntaxNode> existing =
                entries.stream().filter(e -> entryName(e).equals(change.id())).findFirst();
        if (change instanceof OutputChange.Add) {
            if (existing.isPresent() || entries.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(add(pattern.get(), entries.get(entries.size() - 1), change.id()));
        }
        return existing.map(entry -> remove(pattern.get(), entry));
    }

    /**
     * Appends after {@code last}. With a trailing comma the new entry goes after that comma on its
     * own separator and gets a comma of its own; otherwise a comma and separator precede it.
     */
    private static GreenNode add(SyntaxNode pattern, SyntaxNode last, String id) {
        String separator = Statements.whitespace(last.prevSiblingOrToken())
                .map(SyntaxElement::text)
                .orElse(Statements.FALLBACK_SEPARATOR);
        GreenNode entry = SyntaxFactory.patternEntry(id);
        Optional<SyntaxElement> comma = nextSignificant(pattern, last.index())
                .filter(e -> e.kind() == SyntaxKind.TOKEN_COMMA);

        List<GreenElement> elements = new ArrayList<>();
        int at;
        if (comma.isPresent()) {
            elements.add(SyntaxFactory.whitespace(separator));
            elements.add(entry);
            elements.add(SyntaxFactory.comma());
            at = comma.get().index() + 1;
        } else {
            elements.add(SyntaxFactory.comma());
            elements.add(SyntaxFactory.whitespace(separator));
            elements.add(entry);
            at = last.index() + 1;
        }
        return Statements.insertAt(pattern, at, elements);
    }

    /**
     * Removes {@code entry} with its separating comma: the comma after it and the whitespace that
     * follows, or for a last entry without a trailing comma the comma before it.
     */
    private static GreenNode remove(SyntaxNode pattern, SyntaxNode entry) {
        List<SyntaxElement> children = pattern.childrenWithTokens();
        int from = entry.index();
        int to = entry.index();
        Optional<SyntaxElement> next = nextSignificant(pattern, entry.index());
        if (next.isPresent() && next.get().kind() == SyntaxKind.TOKEN_COMMA) {
            to = next.get().index();
            if (to + 1 < children.size() && children.get(to + 1).kind() == SyntaxKind.TOKEN_WHITESPACE) {
                to++;
            }
        } else {
            Optional<SyntaxElement> previous = previousSignificant(pattern, entry.index());
            if (previous.isPresent() && previous.get().kind() == SyntaxKind.TOKEN_COMMA) {
                from = previous.get().index();
            } else if (from > 0 && children.get(from - 1).kind() == SyntaxKind.TOKEN_WHITESPACE) {
                from--;
            }
        }
        GreenNode green = pattern.green();
        for (int i = to; i >= from; i--) {
            green = green.removeChild(i);
        }
        return pattern.replaceWith(green);
    }

    private static Optional<SyntaxNode> pattern(InputLayout layout) {
        return layout.outputsStatement()
                .flatMap(AttrPaths::valueOf)
                .filter(value -> value.kind() == SyntaxKind.NODE_LAMBDA)
                .flatMap(lambda -> lambda.firstChild(SyntaxKind.NODE_PATTERN));
    }

    private static List<SyntaxNode> entries(SyntaxNode pattern) {
        List<SyntaxNode> entries = new ArrayList<>();
        for (SyntaxNode child : pattern.children()) {
            if (child.kind() == SyntaxKind.NODE_PAT_ENTRY) {
                entries.add(child);
            }
        }
        return entries;
    }

    private static String entryName(SyntaxNode entry) {
        return entry.firstChild(SyntaxKind.NODE_IDENT).map(SyntaxNode::text).orElse(entry.text());
    }

    private static Optional<SyntaxElement> nextSignificant(SyntaxNode parent, int index) {
        List<SyntaxElement> children = parent.childrenWithTokens();
        for (int i = index + 1; i < children.size(); i++) {
            if (!children.get(i).kind().isTrivia()) {
                return Optional.of(children.get(i));
            }
        }
        return Optional.empty();
    }

    private static Optional<SyntaxElement> previousSignificant(SyntaxNode parent, int index) {
        List<SyntaxElement> children = parent.childrenWithTokens();
        for (int i = index - 1; i >= 0; i--) {
            if (!children.get(i).kind().isTrivia()) {
                return Optional.of(children.get(i));
            }
        }
        return Optional.empty();
    }
}

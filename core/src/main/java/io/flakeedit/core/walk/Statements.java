package io.flakeedit.core.walk;

import io.flakeedit.core.syntax.GreenElement;
import io.flakeedit.core.syntax.GreenNode;
import io.flakeedit.core.syntax.GreenToken;
import io.flakeedit.core.syntax.SyntaxElement;
import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Whitespace-aware insertion and removal of statements.
 *
 * <p>
 * A removed statement takes one adjacent whitespace token with it (the one before it if there
 * is one, else the one after), so no blank line is left behind. A line comment after it on the
 * same line goes with it. Inserted statements are
 * separated by a copy of a neighbouring whitespace token so they line up with their siblings.
 * Every method returns the green node of the new root.
 */
final class Statements {

    static final String FALLBACK_SEPARATOR = " ";

    private Statements() {}

    static GreenNode remove(SyntaxNode statement) {
        SyntaxNode parent = statement.parent();
        List<Integer> removed = new ArrayList<>(List.of(statement.index()));
        SyntaxElement last = statement;
        Optional<SyntaxElement> comment = trailingComment(statement);
        if (comment.isPresent()) {
            removed.add(comment.get().index() - 1);
            removed.add(comment.get().index());
            last = comment.get();
        }
        Optional<SyntaxElement> before = whitespace(statement.prevSiblingOrToken());
        if (before.isPresent()) {
            removed.add(before.get().index());
        } else {
            whitespace(last.nextSiblingOrToken()).ifPresent(after -> removed.add(after.index()));
        }
        removed.sort(Comparator.reverseOrder());
        GreenNode green = parent.green();
        for (int index : removed) {
            green = green.removeChild(index);
        }
        return parent.replaceWith(green);
    }

    /** A comment on the same line as {@code statement}, after it. */
    static Optional<SyntaxElement> trailingComment(SyntaxNode statement) {
        return whitespace(statement.nextSiblingOrToken())
                .filter(gap -> gap.text().indexOf('\n') < 0)
                .flatMap(SyntaxElement::nextSiblingOrToken)
                .filter(e -> e.kind() == SyntaxKind.TOKEN_COMMENT && e.text().startsWith("#"));
    }

    /** Inserts {@code elements} in order so that the first one lands at {@code index} of {@code parent}. */
    static GreenNode insertAt(SyntaxNode parent, int index, List<? extends GreenElement> elements) {
        GreenNode green = parent.green();
        int at = index;
        for (GreenElement element : elements) {
            green = green.insertChild(at++, element);
        }
        return parent.replaceWith(green);
    }

    /**
     * Appends statements after the last binding of {@code set}, each preceded by the whitespace
     * found before that binding. With {@code normalize} only the last line break and the
     * indentation after it are copied.
     */
    static GreenNode append(SyntaxNode set, List<GreenNode> statements, boolean normalize) {
        Optional<SyntaxNode> last = lastBinding(set);
        if (last.isEmpty()) {
            int afterBrace = set.firstToken(SyntaxKind.TOKEN_L_BRACE)
                    .map(brace -> brace.index() + 1)
                    .orElse(set.childrenWithTokens().size());
            return insertAt(set, afterBrace, interleave(FALLBACK_SEPARATOR, statements, true));
        }
        return insertAfter(last.get(), statements, normalize);
    }

    /** Inserts statements right after {@code anchor}, each preceded by the whitespace before it. */
    static GreenNode insertAfter(SyntaxNode anchor, List<GreenNode> statements, boolean normalize) {
        String separator = separatorOf(anchor);
        if (normalize) {
            separator = normalizeIndent(separator);
        }
        return insertAt(anchor.parent(), anchor.index() + 1, interleave(separator, statements, true));
    }

    /** Inserts statements right before {@code anchor}, each followed by the whitespace before it. */
    static GreenNode insertBefore(SyntaxNode anchor, List<GreenNode> statements) {
        return insertAt(anchor.parent(), anchor.index(), interleave(separatorOf(anchor), statements, false));
    }

    /** Whitespace next to {@code node}: the token before it, else the token after it, else a space. */
    static String separatorOf(SyntaxElement node) {
        return whitespace(node.prevSiblingOrToken())
                .or(() -> whitespace(node.nextSiblingOrToken()))
                .map(SyntaxElement::text)
                .orElse(FALLBACK_SEPARATOR);
    }

    static Optional<SyntaxElement> whitespace(Optional<SyntaxElement> element) {
        return element.filter(e -> e.kind() == SyntaxKind.TOKEN_WHITESPACE);
    }

    /** Keeps the last line break and what follows it, collapsing blank lines. */
    static String normalizeIndent(String whitespace) {
        int newline = whitespace.lastIndexOf('\n');
        return newline < 0 ? whitespace : whitespace.substring(newline);
    }

    static Optional<SyntaxNode> lastBinding(SyntaxNode set) {
        SyntaxNode last = null;
        for (SyntaxNode child : set.children()) {
            if (child.kind() == SyntaxKind.NODE_ATTRPATH_VALUE || child.kind() == SyntaxKind.NODE_INHERIT) {
                last = child;
            }
        }
        return Optional.ofNullable(last);
    }

    private static List<GreenElement> interleave(String separator, List<GreenNode> statements, boolean leading) {
        List<GreenElement> elements = new ArrayList<>();
        for (GreenNode statement : statements) {
            if (leading) {
                elements.add(GreenToken.whitespace(separator));
                elements.add(statement);
            } else {
                elements.add(statement);
                elements.add(GreenToken.whitespace(separator));
            }
        }
        return elements;
    }
}

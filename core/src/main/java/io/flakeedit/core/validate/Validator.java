package io.flakeedit.core.validate;

import io.flakeedit.core.syntax.Parse;
import io.flakeedit.core.syntax.ParseError;
import io.flakeedit.core.syntax.Parser;
import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only checks on a manifest: parser errors and attribute paths bound twice within one
 * attribute set. Works on the text alone, independent of any edit session.
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final String source;
    private final List<Integer> lineStarts;

    private Validator(String source) {
        this.source = source;
        this.lineStarts = lineStarts(source);
    }

    public static ValidationResult validate(String source) {
        return new Validator(source).run();
    }

    private ValidationResult run() {
        Parse parse = Parser.parse(source);
        List<ValidationError> errors = new ArrayList<>();
        for (ParseError error : parse.errors()) {
            errors.add(new ValidationError.ParseError(error.message(), locationOf(error)));
        }
        check(parse.syntax(), errors);
        if (!errors.isEmpty()) {
            LOG.debug("Validation found {} problem(s)", errors.size());
        }
        return new ValidationResult(errors);
    }

    private void check(SyntaxNode node, List<ValidationError> errors) {
        if (node.kind() == SyntaxKind.NODE_ATTR_SET) {
            checkAttrSet(node, errors);
        }
        for (SyntaxNode child : node.children()) {
            check(child, errors);
        }
    }

    private void checkAttrSet(SyntaxNode set, List<ValidationError> errors) {
        Map<String, Location> seen = new HashMap<>();
        for (SyntaxNode statement : set.children()) {
            if (statement.kind() != SyntaxKind.NODE_ATTRPATH_VALUE) {
                continue;
            }
            statement.firstChild(SyntaxKind.NODE_ATTRPATH).ifPresent(attrpath -> {
                String path = pathOf(attrpath);
                Location location = locationOf(attrpath.textRange().start());
                Location first = seen.putIfAbsent(path, location);
                if (first != null) {
                    errors.add(new ValidationError.DuplicateAttribute(path, first, location));
                }
            });
        }
    }

    private static String pathOf(SyntaxNode attrpath) {
        return attrpath.children().stream()
                .map(segment -> segment.kind() == SyntaxKind.NODE_STRING
                        ? trimQuotes(segment.text())
                        : segment.text())
                .collect(Collectors.joining("."));
    }

    private static String trimQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '"') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '"') {
            end--;
        }
        return text.substring(start, end);
    }

    private Location locationOf(ParseError error) {
        if (error.range() == null) {
            return new Location(lineStarts.size(), 1);
        }
        return locationOf(error.range().start());
    }

    private Location locationOf(int offset) {
        int line = 0;
        for (int i = lineStarts.size() - 1; i >= 0; i--) {
            if (lineStarts.get(i) <= offset) {
                line = i;
                break;
            }
        }
        return new Location(line + 1, offset - lineStarts.get(line) + 1);
    }

    private static List<Integer> lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}

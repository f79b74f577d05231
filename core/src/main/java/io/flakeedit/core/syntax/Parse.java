package io.flakeedit.core.syntax;

import java.util.List;

/** Result of {@link Parser#parse(String)}: a green root plus any syntax errors. */
public final class Parse {

    private final GreenNode green;
    private final List<ParseError> errors;

    Parse(GreenNode green, List<ParseError> errors) {
        this.green = green;
        this.errors = List.copyOf(errors);
    }

    public GreenNode green() {
        return green;
    }

    /** A fresh red root over the parsed tree. */
    public SyntaxNode syntax() {
        return SyntaxNode.newRoot(green);
    }

    public List<ParseError> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

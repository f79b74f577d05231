package io.flakeedit.core.syntax;

/** Positioned view over a {@link GreenToken}. */
public final class SyntaxToken implements SyntaxElement {

    private final GreenToken green;
    private final SyntaxNode parent;
    private final int index;
    private final int offset;

    SyntaxToken(GreenToken green, SyntaxNode parent, int index, int offset) {
        this.green = green;
        this.parent = parent;
        this.index = index;
        this.offset = offset;
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenToken green() {
        return green;
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public TextRange textRange() {
        return new TextRange(offset, offset + green.textLength());
    }

    @Override
    public String text() {
        return green.text();
    }

    @Override
    public String toString() {
        return green.text();
    }
}

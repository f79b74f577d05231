package io.flakeedit.core.walk;

import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classification of a manifest's top-level attribute set.
 *
 * <p>
 * Flattens every statement below {@code inputs}, in either surface syntax, into an
 * {@link InputBinding} with a normalized path. {@code inputs.foo.url = "u";} at the root,
 * {@code foo.url = "u";} inside {@code inputs = { … }} and {@code url = "u";} inside
 * {@code inputs.foo = { … }} all classify as {@link BindingKind#URL} of entry {@code foo}.
 * Bindings are listed in document order, an enclosing block before its content, so the first
 * binding matching a predicate is also the outermost one.
 */
public final class InputLayout {

    private static final Logger LOG = LoggerFactory.getLogger(InputLayout.class);

    private static final String INPUTS = "inputs";
    private static final String OUTPUTS = "outputs";

    private final SyntaxNode rootSet;
    private final List<InputBinding> bindings;
    private final SyntaxNode inputsBlock;
    private final SyntaxNode outputsStatement;

    private InputLayout(
            SyntaxNode rootSet, List<InputBinding> bindings, SyntaxNode inputsBlock, SyntaxNode outputsStatement) {
        this.rootSet = rootSet;
        this.bindings = Collections.unmodifiableList(bindings);
        this.inputsBlock = inputsBlock;
        this.outputsStatement = outputsStatement;
    }

    /**
     * Classifies the statements of {@code rootSet}, the attribute set at the top of a manifest.
     */
    public static InputLayout classify(SyntaxNode rootSet) {
        List<InputBinding> bindings = new ArrayList<>();
        SyntaxNode inputsBlock = null;
        SyntaxNode outputsStatement = null;
        for (SyntaxNode statement : rootSet.children()) {
            Optional<List<String>> key = AttrPaths.keyOf(statement);
            if (key.isEmpty() || key.get().isEmpty()) {
                continue;
            }
            List<String> path = key.get();
            if (path.equals(List.of(OUTPUTS)) && outputsStatement == null) {
                outputsStatement = statement;
            }
            if (!path.get(0).equals(INPUTS)) {
                continue;
            }
            if (path.size() == 1 && inputsBlock == null) {
                inputsBlock = AttrPaths.valueOf(statement)
                        .filter(v -> v.kind() == SyntaxKind.NODE_ATTR_SET)
                        .orElse(null);
            }
            collect(statement, path, List.of(), bindings);
        }
        return new InputLayout(rootSet, bindings, inputsBlock, outputsStatement);
    }

    private static void collect(SyntaxNode statement, List<String> path, List<String> prefix, List<InputBinding> out) {
        Optional<SyntaxNode> value = AttrPaths.valueOf(statement);
        if (value.isEmpty()) {
            LOG.warn("Skipping binding without a value: {}", String.join(".", path));
            return;
        }
        BindingKind kind = BindingKind.of(path);
        out.add(new InputBinding(path, prefix, kind, statement, value.get()));
        if (!kind.isContainer() || value.get().kind() != SyntaxKind.NODE_ATTR_SET) {
            return;
        }
        for (SyntaxNode child : value.get().children()) {
            if (child.kind() != SyntaxKind.NODE_ATTRPATH_VALUE) {
                continue;
            }
            Optional<List<String>> key = AttrPaths.keyOf(child);
            if (key.isEmpty()) {
                LOG.warn("Skipping computed attribute name below {}: {}", String.join(".", path), child.text());
                continue;
            }
            List<String> childPath = new ArrayList<>(path);
            childPath.addAll(key.get());
            collect(child, childPath, path, out);
        }
    }

    public SyntaxNode rootSet() {
        return rootSet;
    }

    /** All bindings below {@code inputs}, in document order. */
    public List<InputBinding> bindings() {
        return bindings;
    }

    /** The attribute set of a top-level {@code inputs = { … };}, if the manifest has one. */
    public Optional<SyntaxNode> inputsBlock() {
        return Optional.ofNullable(inputsBlock);
    }

    /** The top-level {@code outputs = …;} statement, if any. */
    public Optional<SyntaxNode> outputsStatement() {
        return Optional.ofNullable(outputsStatement);
    }

    public Optional<InputBinding> first(Predicate<InputBinding> predicate) {
        for (InputBinding binding : bindings) {
            if (predicate.test(binding)) {
                return Optional.of(binding);
            }
        }
        return Optional.empty();
    }

    public Optional<InputBinding> last(Predicate<InputBinding> predicate) {
        InputBinding found = null;
        for (InputBinding binding : bindings) {
            if (predicate.test(binding)) {
                found = binding;
            }
        }
        return Optional.ofNullable(found);
    }

    /** The block of {@code inputs.<id> = { … }}, in whichever syntax it is written. */
    public Optional<InputBinding> entryBlock(String id) {
        return first(b -> b.kind() == BindingKind.ENTRY
                && b.isOwnedBy(id)
                && b.value().kind() == SyntaxKind.NODE_ATTR_SET);
    }
}

package io.flakeedit.core.walk;

import io.flakeedit.core.error.NotARootException;
import io.flakeedit.core.error.NotImplementedException;
import io.flakeedit.core.error.UnexpectedNodeKindException;
import io.flakeedit.core.model.Change;
import io.flakeedit.core.model.ChangeId;
import io.flakeedit.core.model.Entry;
import io.flakeedit.core.model.EntryRegistry;
import io.flakeedit.core.model.OutputChange;
import io.flakeedit.core.model.Outputs;
import io.flakeedit.core.model.Range;
import io.flakeedit.core.syntax.GreenElement;
import io.flakeedit.core.syntax.GreenNode;
import io.flakeedit.core.syntax.Parser;
import io.flakeedit.core.syntax.SyntaxElement;
import io.flakeedit.core.syntax.SyntaxFactory;
import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import io.flakeedit.core.syntax.TextRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates entries of a manifest and applies one change per pass.
 *
 * <p>
 * Each call to {@link #walk(Change)} classifies the held tree into an {@link InputLayout},
 * records every entry it sees in the {@link EntryRegistry}, then performs at most one
 * replacement. The result is the root of a new tree sharing every untouched subtree with the
 * held one; the held tree itself is only replaced through {@link #setRoot(SyntaxNode)}.
 * Callers that need every occurrence handled (removal of an entry spread over several flat
 * statements) repeat the walk until it returns empty.
 */
public final class Walker {

    private static final Logger LOG = LoggerFactory.getLogger(Walker.class);

    private SyntaxNode root;
    private final EntryRegistry registry = new EntryRegistry();

    public Walker(SyntaxNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /** Parses {@code text} and walks the resulting tree. */
    public static Walker parse(String text) {
        return new Walker(Parser.parse(text).syntax());
    }

    public SyntaxNode root() {
        return root;
    }

    public void setRoot(SyntaxNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public EntryRegistry registry() {
        return registry;
    }

    /**
     * Runs one pass.
     *
     * @return the root of the edited tree, or empty when this pass found nothing to change
     * @throws NotARootException            if the held node is not a file root
     * @throws UnexpectedNodeKindException if the file is not an attribute set of bindings
     * @throws NotImplementedException      for a follows below a nested input, {@code a.b.c}
     */
    public Optional<SyntaxNode> walk(Change change) {
        Optional<InputLayout> layout = layout();
        if (layout.isEmpty()) {
            return Optional.empty();
        }
        record(layout.get());
        Optional<GreenNode> edited = apply(layout.get(), change);
        edited.ifPresent(green -> LOG.debug("Pass for {} produced an edit", change));
        return edited.map(SyntaxNode::newRoot);
    }

    /** Parameter list of the {@code outputs} function. */
    public Outputs listOutputs() {
        return layout().map(OutputsEditor::list).orElseGet(Outputs.None::new);
    }

    /** Edits the {@code outputs} parameter list; empty when nothing had to change. */
    public Optional<SyntaxNode> changeOutputs(OutputChange change) {
        return layout().flatMap(l -> OutputsEditor.change(l, change)).map(SyntaxNode::newRoot);
    }

    private Optional<InputLayout> layout() {
        if (root.kind() != SyntaxKind.NODE_ROOT) {
            throw new NotARootException(root.kind());
        }
        Optional<SyntaxNode> expression = root.firstChild();
        if (expression.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode set = expression.get();
        if (set.kind() != SyntaxKind.NODE_ATTR_SET) {
            throw new UnexpectedNodeKindException(SyntaxKind.NODE_ATTR_SET, set.kind());
        }
        for (SyntaxNode statement : set.children()) {
            if (statement.kind() != SyntaxKind.NODE_ATTRPATH_VALUE) {
                throw new UnexpectedNodeKindException(SyntaxKind.NODE_ATTRPATH_VALUE, statement.kind());
            }
        }
        return Optional.of(InputLayout.classify(set));
    }

    // --- Registry ---

    private void record(InputLayout layout) {
        for (InputBinding binding : layout.bindings()) {
            Optional<String> owner = binding.id();
            if (owner.isEmpty()) {
                continue;
            }
            String id = owner.get();
            String valueText = binding.value().text();
            Range range = rangeOf(binding.value().textRange());
            switch (binding.kind()) {
                case URL, FOLLOWS -> registry.insert(id, Entry.withUrl(id, valueText, range), null);
                case FLAKE -> {
                    if (valueText.trim().equals("false")) {
                        registry.markNonFlake(id);
                    } else {
                        registry.insert(id, Entry.stub(id), null);
                    }
                }
                case NESTED_FOLLOWS -> {
                    String child = binding.nested().orElseThrow();
                    registry.insert(child, Entry.withUrl(child, valueText, range), binding.context());
                }
                case NESTED_URL -> {
                    String child = binding.nested().orElseThrow();
                    registry.insertDirect(id, Entry.withUrl(child, valueText, range));
                }
                default -> registry.insert(id, Entry.stub(id), null);
            }
        }
    }

    private static Range rangeOf(TextRange range) {
        return new Range(range.start(), range.end());
    }

    // --- Dispatch ---

    private Optional<GreenNode> apply(InputLayout layout, Change change) {
        if (change instanceof Change.Remove remove) {
            return remove(layout, remove.ids());
        }
        if (change instanceof Change.ChangeUrl changeUrl) {
            if (changeUrl.id() == null || changeUrl.uri() == null) {
                return Optional.empty();
            }
            return changeUrl(layout, changeUrl.id(), changeUrl.uri());
        }
        if (change instanceof Change.Follows follows) {
            return follows(layout, follows.input(), follows.target());
        }
        if (change instanceof Change.Add add) {
            if (add.id() == null || add.uri() == null) {
                return Optional.empty();
            }
            return add(layout, add.id(), add.uri(), add.flake());
        }
        return Optional.empty();
    }

    /** Removes the outermost statement owned by any of {@code ids}. */
    private Optional<GreenNode> remove(InputLayout layout, List<ChangeId> ids) {
        return layout.first(binding -> ids.stream().anyMatch(binding::isOwnedBy))
                .map(binding -> {
                    LOG.debug("Removing statement {}", String.join(".", binding.path()));
                    return Statements.remove(binding.statement());
                });
    }

    private Optional<GreenNode> changeUrl(InputLayout layout, String id, String uri) {
        return layout.first(b -> b.kind() == BindingKind.URL && b.isOwnedBy(id))
                .map(binding -> binding.value().replaceWith(SyntaxFactory.quotedString(uri)));
    }

    // --- Follows ---

    private Optional<GreenNode> follows(InputLayout layout, ChangeId input, String target) {
        String parent = input.input();
        Optional<String> child = input.follows();
        if (child.isPresent() && child.get().contains(".")) {
            throw new NotImplementedException("follows below a nested input (" + input + ")", parent);
        }
        BindingKind leafKind = child.isPresent() ? BindingKind.NESTED_FOLLOWS : BindingKind.FOLLOWS;

        Optional<InputBinding> existing = layout.first(b -> b.kind() == leafKind && b.isOwnedBy(input));
        if (existing.isPresent()) {
            SyntaxNode value = existing.get().value();
            if (unquote(value.text()).equals(target)) {
                LOG.debug("{} already follows {}", input, target);
                return Optional.empty();
            }
            return Optional.of(value.replaceWith(SyntaxFactory.quotedString(target)));
        }

        List<String> suffix = new ArrayList<>();
        child.ifPresent(c -> {
            suffix.add("inputs");
            suffix.add(c);
        });
        suffix.add("follows");

        Optional<InputBinding> block = layout.entryBlock(parent);
        if (block.isPresent()) {
            GreenNode statement = statement(suffix, target);
            return Optional.of(Statements.append(block.get().value(), List.of(statement), false));
        }

        Optional<InputBinding> anchor = layout.last(b -> b.isOwnedBy(parent) && b.isFlat());
        if (anchor.isEmpty()) {
            LOG.debug("No declaration of {} to attach a follows to", parent);
            return Optional.empty();
        }
        List<String> key = new ArrayList<>(anchor.get().path().subList(anchor.get().prefix().size(), 2));
        key.addAll(suffix);
        GreenNode statement = statement(key, target);
        return Optional.of(Statements.insertAfter(anchor.get().statement(), List.of(statement), true));
    }

    private static GreenNode statement(List<String> key, String target) {
        return SyntaxFactory.statement(String.join(".", key) + " = " + SyntaxFactory.quote(target) + ";");
    }

    // --- Add ---

    private Optional<GreenNode> add(InputLayout layout, String id, String uri, boolean flake) {
        Optional<SyntaxNode> inputsBlock = layout.inputsBlock();
        if (inputsBlock.isPresent()) {
            List<GreenNode> statements = entryStatements(id, uri, flake, "");
            Optional<SyntaxNode> anchor = firstPlainEntry(inputsBlock.get());
            if (anchor.isPresent()) {
                return Optional.of(Statements.insertBefore(anchor.get(), statements));
            }
            return Optional.of(Statements.append(inputsBlock.get(), statements, false));
        }

        List<GreenNode> statements = entryStatements(id, uri, flake, "inputs.");
        Optional<SyntaxNode> outputs = layout.outputsStatement();
        if (outputs.isEmpty()) {
            return Optional.of(Statements.append(layout.rootSet(), statements, false));
        }
        return Optional.of(insertBeforeOutputs(outputs.get(), statements));
    }

    private static List<GreenNode> entryStatements(String id, String uri, boolean flake, String prefix) {
        List<GreenNode> statements = new ArrayList<>();
        statements.add(SyntaxFactory.statement(prefix + id + ".url = " + SyntaxFactory.quote(uri) + ";"));
        if (!flake) {
            statements.add(SyntaxFactory.statement(prefix + id + ".flake = false;"));
        }
        return statements;
    }

    /** First statement of the inputs block that declares an entry rather than a nested alias. */
    private static Optional<SyntaxNode> firstPlainEntry(SyntaxNode inputsBlock) {
        for (SyntaxNode statement : inputsBlock.children()) {
            if (statement.kind() != SyntaxKind.NODE_ATTRPATH_VALUE) {
                continue;
            }
            Optional<List<String>> key = AttrPaths.keyOf(statement);
            if (key.isPresent() && !key.get().contains("inputs")) {
                return Optional.of(statement);
            }
        }
        return Optional.empty();
    }

    /**
     * Places new top-level statements right before {@code outputs}, separated the way the
     * statement before {@code outputs} is separated from its own predecessor.
     */
    private static GreenNode insertBeforeOutputs(SyntaxNode outputs, List<GreenNode> statements) {
        Optional<String> leading = Statements.whitespace(outputs.prevSiblingOrToken()).map(SyntaxElement::text);
        String separator = outputs.prevSibling()
                .flatMap(previous -> Statements.whitespace(previous.prevSiblingOrToken()))
                .map(SyntaxElement::text)
                .or(() -> leading)
                .orElse(Statements.FALLBACK_SEPARATOR);

        List<GreenElement> elements = new ArrayList<>();
        if (leading.isPresent()) {
            for (GreenNode statement : statements) {
                elements.add(SyntaxFactory.whitespace(separator));
                elements.add(statement);
            }
            return Statements.insertAt(outputs.parent(), outputs.index() - 1, elements);
        }
        for (GreenNode statement : statements) {
            elements.add(statement);
            elements.add(SyntaxFactory.whitespace(separator));
        }
        return Statements.insertAt(outputs.parent(), outputs.index(), elements);
    }

    private static String unquote(String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}

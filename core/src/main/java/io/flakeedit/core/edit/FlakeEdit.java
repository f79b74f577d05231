package io.flakeedit.core.edit;

import io.flakeedit.core.error.DuplicateInputException;
import io.flakeedit.core.error.InputNotFoundException;
import io.flakeedit.core.model.Alias;
import io.flakeedit.core.model.Change;
import io.flakeedit.core.model.ChangeId;
import io.flakeedit.core.model.Entry;
import io.flakeedit.core.model.OutputChange;
import io.flakeedit.core.model.Outputs;
import io.flakeedit.core.syntax.SyntaxKind;
import io.flakeedit.core.syntax.SyntaxNode;
import io.flakeedit.core.walk.Walker;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edit session over one manifest.
 *
 * <p>
 * Holds the current tree and the registry discovered from it, and turns a {@link Change} into
 * new source text. Preconditions (duplicate or unknown ids) are checked before any pass runs, so a
 * failing call leaves the session exactly as it was. The result is not validated here: callers
 * run {@link io.flakeedit.core.validate.Validator} on it before persisting.
 *
 * <p>
 * Not thread-safe. A session is owned by a single caller.
 */
public final class FlakeEdit {

    private static final Logger LOG = LoggerFactory.getLogger(FlakeEdit.class);

    private final Walker walker;

    private FlakeEdit(Walker walker) {
        this.walker = walker;
    }

    /** Opens a session over {@code text}. */
    public static FlakeEdit fromText(String text) {
        Objects.requireNonNull(text, "text");
        return new FlakeEdit(Walker.parse(text));
    }

    /** The current source text. */
    public String source() {
        return walker.root().text();
    }

    /** The walker backing this session, for callers that need direct passes. */
    public Walker walker() {
        return walker;
    }

    /** Rebuilds the registry from the current tree with one query pass. */
    public Map<String, Entry> list() {
        walker.registry().clear();
        walker.walk(Change.NONE);
        return walker.registry().snapshot();
    }

    /** The last known registry, without walking. */
    public Map<String, Entry> currList() {
        return walker.registry().snapshot();
    }

    /** Parameter list of the current {@code outputs} function. */
    public Outputs outputs() {
        return walker.listOutputs();
    }

    /**
     * Applies {@code change} to the held tree.
     *
     * @return the full new source text, or empty when the change was a no-op or matched nothing
     * @throws DuplicateInputException if an {@link Change.Add} names an entry that already exists
     * @throws InputNotFoundException  if a {@link Change.ChangeUrl} names an unknown entry
     */
    public Optional<String> applyChange(Change change) {
        Objects.requireNonNull(change, "change");
        if (change instanceof Change.Add add) {
            return add(add);
        }
        if (change instanceof Change.Remove remove) {
            return remove(remove);
        }
        if (change instanceof Change.ChangeUrl changeUrl) {
            return changeUrl(changeUrl);
        }
        if (change instanceof Change.Follows follows) {
            return single(follows);
        }
        walker.walk(Change.NONE);
        return Optional.empty();
    }

    // --- Add ---

    private Optional<String> add(Change.Add add) {
        list();
        if (add.id() == null || add.uri() == null) {
            return Optional.empty();
        }
        if (walker.registry().contains(add.id())) {
            throw new DuplicateInputException(add.id());
        }
        Optional<SyntaxNode> edited = walker.walk(add);
        if (edited.isEmpty()) {
            return Optional.empty();
        }
        walker.setRoot(edited.get());
        if (walker.listOutputs() instanceof Outputs.Multiple outputs && !outputs.contains(add.id())) {
            walker.changeOutputs(new OutputChange.Add(add.id())).ifPresent(walker::setRoot);
        }
        LOG.debug("Added {} ({})", add.id(), add.uri());
        return Optional.of(source());
    }

    // --- Remove ---

    private Optional<String> remove(Change.Remove remove) {
        Map<String, Entry> before = list();
        String original = source();

        int passes = removeToFixpoint(remove);
        LOG.debug("Removal of {} settled after {} pass(es)", remove.ids(), passes);

        for (ChangeId id : remove.ids()) {
            if (id.isNested()) {
                continue;
            }
            removeFromOutputs(id.input());
            for (ChangeId orphan : orphansOf(id.input(), before)) {
                LOG.debug("Removing orphaned alias {}", orphan);
                removeToFixpoint(new Change.Remove(List.of(orphan)));
            }
        }

        String result = source();
        if (result.equals(original)) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    /** Repeats removal passes until one changes nothing; returns the number of edits made. */
    private int removeToFixpoint(Change.Remove remove) {
        int limit = statementCount(walker.root()) + 1;
        int edits = 0;
        while (edits < limit) {
            Optional<SyntaxNode> edited = walker.walk(remove);
            if (edited.isEmpty() || edited.get().text().equals(source())) {
                break;
            }
            walker.setRoot(edited.get());
            edits++;
        }
        return edits;
    }

    private void removeFromOutputs(String id) {
        Outputs outputs = walker.listOutputs();
        if ((outputs instanceof Outputs.Multiple || outputs instanceof Outputs.Any) && outputs.contains(id)) {
            walker.changeOutputs(new OutputChange.Remove(id)).ifPresent(walker::setRoot);
        }
    }

    /** Nested aliases, recorded before the removal, that point at {@code id}. */
    private static List<ChangeId> orphansOf(String id, Map<String, Entry> entries) {
        List<ChangeId> orphans = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.id().equals(id)) {
                continue;
            }
            for (Alias alias : entry.follows()) {
                if (alias instanceof Alias.Indirect indirect && indirect.unquotedTarget().equals(id)) {
                    orphans.add(new ChangeId(entry.id() + "." + indirect.from()));
                }
            }
        }
        return orphans;
    }

    private static int statementCount(SyntaxNode node) {
        int count = node.kind() == SyntaxKind.NODE_ATTRPATH_VALUE ? 1 : 0;
        for (SyntaxNode child : node.children()) {
            count += statementCount(child);
        }
        return count;
    }

    // --- Change / Follows ---

    private Optional<String> changeUrl(Change.ChangeUrl change) {
        list();
        if (change.id() == null || change.uri() == null) {
            return Optional.empty();
        }
        if (!walker.registry().contains(change.id())) {
            throw new InputNotFoundException(change.id());
        }
        return single(change);
    }

    private Optional<String> single(Change change) {
        Optional<SyntaxNode> edited = walker.walk(change);
        edited.ifPresent(walker::setRoot);
        return edited.map(SyntaxNode::text);
    }
}

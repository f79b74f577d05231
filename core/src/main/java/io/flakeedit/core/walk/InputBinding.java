package io.flakeedit.core.walk;

import io.flakeedit.core.model.ChangeId;
import io.flakeedit.core.model.Context;
import io.flakeedit.core.syntax.SyntaxNode;
import java.util.List;
import java.util.Optional;

/**
 * One {@code key = value;} statement below {@code inputs}, in normalized form.
 *
 * @param path      full key path from the manifest root, starting with {@code inputs}
 * @param prefix    path of the block the statement is written in ({@code []} for the root set)
 * @param kind      role derived from {@code path}
 * @param statement the {@code NODE_ATTRPATH_VALUE}
 * @param value     its value expression
 */
public record InputBinding(List<String> path, List<String> prefix, BindingKind kind, SyntaxNode statement, SyntaxNode value) {

    public InputBinding {
        path = List.copyOf(path);
        prefix = List.copyOf(prefix);
    }

    /** The top-level entry this statement belongs to, if it belongs to one. */
    public Optional<String> id() {
        return path.size() >= 2 ? Optional.of(path.get(1)) : Optional.empty();
    }

    /** The nested input of the entry this statement belongs to, if any. */
    public Optional<String> nested() {
        return isNestedPath() ? Optional.of(path.get(3)) : Optional.empty();
    }

    /** True when every key of the statement lies below {@code inputs.<id>}. */
    public boolean isOwnedBy(String id) {
        return path.size() >= 2 && path.get(1).equals(id);
    }

    /** True when every key of the statement lies below {@code inputs.<id>.inputs.<child>}. */
    public boolean isOwnedBy(String id, String child) {
        return isOwnedBy(id) && isNestedPath() && path.get(3).equals(child);
    }

    /** Ownership by a {@code parent} or {@code parent.child} address. */
    public boolean isOwnedBy(ChangeId changeId) {
        return path.size() >= 2 && changeId.matchesWithFollows(path.get(1), nested().orElse(null));
    }

    /** The entry enclosing a nested input statement; empty for top-level statements. */
    public Context context() {
        Context context = Context.of();
        return isNestedPath() ? context.push(path.get(1)) : context;
    }

    /** True when the statement is written directly in the root set or in the {@code inputs} block. */
    public boolean isFlat() {
        return prefix.size() <= 1;
    }

    /** The statement's key relative to the block it is written in. */
    public List<String> relativeKey() {
        return path.subList(prefix.size(), path.size());
    }

    private boolean isNestedPath() {
        return path.size() >= 4 && path.get(2).equals("inputs");
    }
}

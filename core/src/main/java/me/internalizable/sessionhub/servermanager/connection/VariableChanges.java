package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Variables created, updated and removed by one command or server push.
 */
public record VariableChanges(
        @Nonnull List<VariableDefinition> created,
        @Nonnull List<VariableDefinition> updated,
        @Nonnull List<VariableDefinition> removed
) {

    private static final VariableChanges EMPTY = new VariableChanges(List.of(), List.of(), List.of());

    public VariableChanges {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        removed = List.copyOf(removed);
    }

    @Nonnull
    public static VariableChanges empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return created.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }

    /**
     * Get created and updated variables, in that order.
     *
     * @return changed variables
     */
    @Nonnull
    public List<VariableDefinition> changed() {
        List<VariableDefinition> changed = new ArrayList<>(created.size() + updated.size());
        changed.addAll(created);
        changed.addAll(updated);
        return changed;
    }
}

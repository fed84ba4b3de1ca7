package me.internalizable.sessionhub.servermanager.connection;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A variable in a server session.
 *
 * @param id server-assigned variable id
 * @param title variable name
 * @param type variable type, e.g. {@code Table} or {@code Figure}
 */
public record VariableDefinition(@Nonnull String id, @Nonnull String title, @Nonnull String type) {

    public VariableDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Variables whose name starts with an underscore are private to the script.
     *
     * @return true if hidden
     */
    public boolean isHidden() {
        return title.startsWith("_");
    }
}

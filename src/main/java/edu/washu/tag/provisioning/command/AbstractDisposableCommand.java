package edu.washu.tag.provisioning.command;

import java.util.Objects;

/**
 * Holds the scope and access level, both fixed at construction.
 */
public abstract class AbstractDisposableCommand implements DisposableCommand {

    private final CommandScope scope;
    private final CommandAccessLevel accessLevel;

    protected AbstractDisposableCommand(CommandScope scope, CommandAccessLevel accessLevel) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.accessLevel = Objects.requireNonNull(accessLevel, "accessLevel must not be null");
    }

    @Override
    public CommandScope scope() {
        return scope;
    }

    @Override
    public CommandAccessLevel accessLevel() {
        return accessLevel;
    }

}

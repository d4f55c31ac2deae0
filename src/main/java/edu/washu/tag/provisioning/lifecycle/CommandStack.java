package edu.washu.tag.provisioning.lifecycle;

import edu.washu.tag.provisioning.command.CommandScope;
import edu.washu.tag.provisioning.command.DisposableCommand;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executed disposable commands of one scope instance, disposed last-in first-out.
 */
public class CommandStack {

    private static final Logger logger = LoggerFactory.getLogger(CommandStack.class);

    private final CommandScope scope;
    private final Deque<DisposableCommand> commands = new ArrayDeque<>();

    public CommandStack(CommandScope scope) {
        this.scope = scope;
    }

    public CommandScope getScope() {
        return scope;
    }

    public void push(DisposableCommand command) {
        if (command.scope() != scope) {
            throw new IllegalArgumentException(
                "Command scoped to " + command.scope() + " pushed onto " + scope + " stack");
        }
        commands.push(command);
        logger.debug("Tracking {} in {} scope ({} pending)", command, scope, commands.size());
    }

    /**
     * Pop and dispose every entry, most recent first.
     *
     * <p>Stops at the first failing dispose and rethrows. The failing entry is already popped;
     * the ones below it stay on the stack undisposed.
     */
    public void drain(ClientRouter router) throws Exception {
        while (!commands.isEmpty()) {
            DisposableCommand command = commands.pop();
            logger.debug("Disposing {} from {} scope", command, scope);
            command.dispose(router.clientFor(command));
        }
    }

    public int size() {
        return commands.size();
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    /**
     * @return the pending commands, most recent first
     */
    public List<DisposableCommand> snapshot() {
        return List.copyOf(commands);
    }

}

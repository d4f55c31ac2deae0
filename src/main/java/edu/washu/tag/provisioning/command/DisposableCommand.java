package edu.washu.tag.provisioning.command;

import edu.washu.tag.provisioning.client.ContentClient;

/**
 * A command whose side effect can be undone. Once executed it is owned by the stack of its
 * {@link #scope()} and disposed when that scope ends.
 */
public interface DisposableCommand extends Command {

    CommandScope scope();

    /**
     * Undo what {@link #execute(ContentClient)} did. Only called after a successful execute.
     */
    void dispose(ContentClient client) throws Exception;

}

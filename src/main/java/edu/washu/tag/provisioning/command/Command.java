package edu.washu.tag.provisioning.command;

import edu.washu.tag.provisioning.client.ContentClient;

/**
 * A unit of provisioning work against the content service.
 */
public interface Command {

    CommandAccessLevel accessLevel();

    /**
     * Perform the remote side effect.
     *
     * @param client the client matching {@link #accessLevel()}
     * @return the identifier of the affected resource
     */
    String execute(ContentClient client) throws Exception;

}

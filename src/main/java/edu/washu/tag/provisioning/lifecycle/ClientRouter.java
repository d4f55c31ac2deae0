package edu.washu.tag.provisioning.lifecycle;

import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.command.Command;
import edu.washu.tag.provisioning.command.CommandAccessLevel;

/**
 * Picks the client a command runs with from its access level.
 */
public class ClientRouter {

    private final SessionState session;

    public ClientRouter(SessionState session) {
        this.session = session;
    }

    public ContentClient clientFor(Command command) {
        return clientFor(command.accessLevel());
    }

    /**
     * @return the admin client for {@link CommandAccessLevel#ADMIN}, the user client otherwise
     */
    public ContentClient clientFor(CommandAccessLevel accessLevel) {
        if (accessLevel == CommandAccessLevel.ADMIN) {
            return session.adminClient();
        }
        return session.userClient();
    }

}

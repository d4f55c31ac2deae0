package edu.washu.tag.provisioning.lifecycle;

import static java.util.Objects.requireNonNull;

import edu.washu.tag.provisioning.client.ContentClient;

/**
 * Process-wide state established once at run start and read-only afterwards.
 *
 * @param adminClient client acting as the enterprise service account
 * @param userClient  client acting as the shared test user
 * @param userId      id of the shared test user
 * @param userCreated whether this run created the shared user and so must delete it
 */
public record SessionState(ContentClient adminClient, ContentClient userClient, String userId, boolean userCreated) {

    public SessionState {
        requireNonNull(adminClient, "adminClient must not be null");
        requireNonNull(userClient, "userClient must not be null");
        requireNonNull(userId, "userId must not be null");
    }
}

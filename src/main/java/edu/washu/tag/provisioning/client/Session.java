package edu.washu.tag.provisioning.client;

/**
 * Produces the two credentialed handles a test run works with.
 */
public interface Session {

    /**
     * @return a client acting as the enterprise service account
     */
    ContentClient adminClient() throws Exception;

    /**
     * @return a client acting as the given user
     */
    ContentClient userClient(String userId) throws Exception;

}

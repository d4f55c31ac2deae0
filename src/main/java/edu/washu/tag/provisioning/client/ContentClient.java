package edu.washu.tag.provisioning.client;

import edu.washu.tag.provisioning.client.model.FileItem;
import edu.washu.tag.provisioning.client.model.Folder;
import edu.washu.tag.provisioning.client.model.RetentionPolicy;
import edu.washu.tag.provisioning.client.model.RetentionPolicyAssignment;
import edu.washu.tag.provisioning.client.model.RetentionPolicyRequest;
import edu.washu.tag.provisioning.client.model.User;
import java.io.IOException;

/**
 * A credentialed handle on the content service. Every call acts with the identity the
 * handle was authenticated as.
 */
public interface ContentClient {

    Folder createFolder(String name, String parentId) throws IOException, InterruptedException;

    /**
     * Delete a folder. Deleting a folder that no longer exists is not an error.
     */
    void deleteFolder(String folderId, boolean recursive) throws IOException, InterruptedException;

    FileItem uploadFile(String name, String parentId, byte[] content) throws IOException, InterruptedException;

    /**
     * Delete a file. Deleting a file that no longer exists is not an error.
     */
    void deleteFile(String fileId) throws IOException, InterruptedException;

    RetentionPolicy createRetentionPolicy(RetentionPolicyRequest request) throws IOException, InterruptedException;

    /**
     * Assign a policy to a folder, or to the whole enterprise when {@code folderId} is the root folder.
     */
    RetentionPolicyAssignment assignRetentionPolicy(String policyId, String folderId)
        throws IOException, InterruptedException;

    /**
     * Retention policies cannot be deleted, only retired.
     */
    void retireRetentionPolicy(String policyId) throws IOException, InterruptedException;

    User createEnterpriseUser(String name, boolean platformAccessOnly) throws IOException, InterruptedException;

    void deleteEnterpriseUser(String userId, boolean notify, boolean force) throws IOException, InterruptedException;

}

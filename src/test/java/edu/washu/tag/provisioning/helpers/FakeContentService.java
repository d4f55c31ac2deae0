package edu.washu.tag.provisioning.helpers;

import edu.washu.tag.provisioning.client.ApiException;
import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.client.model.FileItem;
import edu.washu.tag.provisioning.client.model.Folder;
import edu.washu.tag.provisioning.client.model.RetentionPolicy;
import edu.washu.tag.provisioning.client.model.RetentionPolicyAssignment;
import edu.washu.tag.provisioning.client.model.RetentionPolicyRequest;
import edu.washu.tag.provisioning.client.model.User;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory content service. Hands out clients labelled "admin" and "user" so tests can see
 * which identity made each call; every call is appended to a shared journal as
 * {@code "<label> <operation> <id or name>"}.
 */
public class FakeContentService {

    private final List<String> journal = new ArrayList<>();
    private final Set<String> live = new LinkedHashSet<>();
    private final Set<String> failing = new HashSet<>();
    private final Map<String, String> names = new HashMap<>();
    private int nextId = 1;

    public ContentClient client(String label) {
        return new FakeClient(label);
    }

    /**
     * Make every later call of {@code operation} throw an {@link ApiException}.
     */
    public FakeContentService failOn(String operation) {
        failing.add(operation);
        return this;
    }

    public FakeContentService recover(String operation) {
        failing.remove(operation);
        return this;
    }

    public List<String> journal() {
        return journal;
    }

    /**
     * @return ids of resources created and not yet deleted or retired
     */
    public Set<String> live() {
        return live;
    }

    public String nameOf(String id) {
        return names.get(id);
    }

    private class FakeClient implements ContentClient {

        private final String label;

        private FakeClient(String label) {
            this.label = label;
        }

        @Override
        public Folder createFolder(String name, String parentId) {
            String id = create("createFolder", "F", name);
            return new Folder(id, name);
        }

        @Override
        public void deleteFolder(String folderId, boolean recursive) {
            remove("deleteFolder", folderId);
        }

        @Override
        public FileItem uploadFile(String name, String parentId, byte[] content) {
            String id = create("uploadFile", "X", name);
            return new FileItem(id, name, (long) content.length);
        }

        @Override
        public void deleteFile(String fileId) {
            remove("deleteFile", fileId);
        }

        @Override
        public RetentionPolicy createRetentionPolicy(RetentionPolicyRequest request) {
            String id = create("createRetentionPolicy", "P", request.policyName());
            return new RetentionPolicy(id, request.policyName(), "active");
        }

        @Override
        public RetentionPolicyAssignment assignRetentionPolicy(String policyId, String folderId) {
            record("assignRetentionPolicy", policyId + "->" + folderId);
            return new RetentionPolicyAssignment("A" + policyId);
        }

        @Override
        public void retireRetentionPolicy(String policyId) {
            remove("retireRetentionPolicy", policyId);
        }

        @Override
        public User createEnterpriseUser(String name, boolean platformAccessOnly) {
            String id = create("createEnterpriseUser", "U", name);
            return new User(id, name, null);
        }

        @Override
        public void deleteEnterpriseUser(String userId, boolean notify, boolean force) {
            remove("deleteEnterpriseUser", userId);
        }

        private String create(String operation, String prefix, String name) {
            checkFailure(operation);
            String id = prefix + nextId++;
            live.add(id);
            names.put(id, name);
            journal.add(label + " " + operation + " " + id);
            return id;
        }

        private void remove(String operation, String id) {
            checkFailure(operation);
            live.remove(id);
            journal.add(label + " " + operation + " " + id);
        }

        private void record(String operation, String detail) {
            checkFailure(operation);
            journal.add(label + " " + operation + " " + detail);
        }

        private void checkFailure(String operation) {
            if (failing.contains(operation)) {
                throw new ApiException(operation, 500, "injected failure");
            }
        }
    }

}

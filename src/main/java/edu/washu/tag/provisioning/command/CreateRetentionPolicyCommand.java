package edu.washu.tag.provisioning.command;

import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.client.model.RetentionPolicy;
import edu.washu.tag.provisioning.client.model.RetentionPolicyRequest;

/**
 * Creates a short-lived retention policy and assigns it to a folder. Policies cannot be
 * deleted, so disposing retires it instead. Always runs with the admin client.
 */
public class CreateRetentionPolicyCommand extends AbstractDisposableCommand {

    private final String folderId;
    private final String policyName;
    private RetentionPolicy policy;

    public CreateRetentionPolicyCommand(String folderId, String policyName, CommandScope scope) {
        super(scope, CommandAccessLevel.ADMIN);
        this.folderId = folderId;
        this.policyName = policyName;
    }

    @Override
    public String execute(ContentClient client) throws Exception {
        RetentionPolicy created = client.createRetentionPolicy(RetentionPolicyRequest.shortLived(policyName));
        try {
            client.assignRetentionPolicy(created.id(), folderId);
        } catch (Exception e) {
            // not tracked yet, so retire here or the policy outlives the run
            try {
                client.retireRetentionPolicy(created.id());
            } catch (Exception retireFailure) {
                e.addSuppressed(retireFailure);
            }
            throw e;
        }
        policy = created;
        return policy.id();
    }

    @Override
    public void dispose(ContentClient client) throws Exception {
        client.retireRetentionPolicy(policy.id());
    }

    public RetentionPolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return "CreateRetentionPolicyCommand{" + policyName + (policy != null ? ", id=" + policy.id() : "") + "}";
    }

}

package edu.washu.tag.provisioning.client.model;

/**
 * Body of a retention policy creation request.
 *
 * @param policyName        unique policy name
 * @param policyType        {@code finite} or {@code indefinite}
 * @param retentionLength   retention length in days, ignored for indefinite policies
 * @param dispositionAction {@code permanently_delete} or {@code remove_retention}
 */
public record RetentionPolicyRequest(
    String policyName,
    String policyType,
    Integer retentionLength,
    String dispositionAction
) {

    /**
     * A one-day policy that simply drops retention when it expires, so nothing is deleted.
     */
    public static RetentionPolicyRequest shortLived(String policyName) {
        return new RetentionPolicyRequest(policyName, "finite", 1, "remove_retention");
    }

}

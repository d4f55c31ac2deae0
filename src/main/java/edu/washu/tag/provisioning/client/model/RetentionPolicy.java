package edu.washu.tag.provisioning.client.model;

/**
 * A retention policy. {@code status} is {@code active} or {@code retired}.
 */
public record RetentionPolicy(String id, String policyName, String status) {}

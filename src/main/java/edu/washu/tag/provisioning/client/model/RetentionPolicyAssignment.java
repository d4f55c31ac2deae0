package edu.washu.tag.provisioning.client.model;

public record RetentionPolicyAssignment(String id) {}

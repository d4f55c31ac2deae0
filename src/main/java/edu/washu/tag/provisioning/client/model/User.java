package edu.washu.tag.provisioning.client.model;

/**
 * An enterprise user.
 */
public record User(String id, String name, String login) {}

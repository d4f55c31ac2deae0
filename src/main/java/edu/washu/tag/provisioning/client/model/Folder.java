package edu.washu.tag.provisioning.client.model;

/**
 * A folder in the content service.
 */
public record Folder(String id, String name) {}

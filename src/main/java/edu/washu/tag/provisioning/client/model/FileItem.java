package edu.washu.tag.provisioning.client.model;

/**
 * An uploaded file in the content service.
 */
public record FileItem(String id, String name, Long size) {}

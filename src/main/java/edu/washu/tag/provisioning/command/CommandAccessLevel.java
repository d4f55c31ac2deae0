package edu.washu.tag.provisioning.command;

/**
 * Which credentialed client a command runs with.
 */
public enum CommandAccessLevel {
    ADMIN,
    USER
}

package edu.washu.tag.provisioning.command;

/**
 * The lifetime that owns a disposable command once it has run: it is disposed when that
 * scope ends.
 */
public enum CommandScope {
    TEST,
    CLASS
}

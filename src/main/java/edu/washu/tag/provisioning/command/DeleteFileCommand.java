package edu.washu.tag.provisioning.command;

import edu.washu.tag.provisioning.client.ContentClient;

/**
 * Deletes a file. There is nothing to undo, so it is never tracked for cleanup.
 */
public class DeleteFileCommand implements Command {

    private final String fileId;
    private final CommandAccessLevel accessLevel;

    public DeleteFileCommand(String fileId) {
        this(fileId, CommandAccessLevel.USER);
    }

    public DeleteFileCommand(String fileId, CommandAccessLevel accessLevel) {
        this.fileId = fileId;
        this.accessLevel = accessLevel;
    }

    @Override
    public CommandAccessLevel accessLevel() {
        return accessLevel;
    }

    @Override
    public String execute(ContentClient client) throws Exception {
        client.deleteFile(fileId);
        return fileId;
    }

}

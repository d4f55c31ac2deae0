package edu.washu.tag.provisioning.command;

import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.client.model.Folder;

/**
 * Creates a folder; disposing deletes it together with anything left inside.
 */
public class CreateFolderCommand extends AbstractDisposableCommand {

    private final String folderName;
    private final String parentId;
    private Folder folder;

    public CreateFolderCommand(String folderName, String parentId, CommandScope scope,
        CommandAccessLevel accessLevel) {
        super(scope, accessLevel);
        this.folderName = folderName;
        this.parentId = parentId;
    }

    @Override
    public String execute(ContentClient client) throws Exception {
        folder = client.createFolder(folderName, parentId);
        return folder.id();
    }

    @Override
    public void dispose(ContentClient client) throws Exception {
        client.deleteFolder(folder.id(), true);
    }

    public Folder getFolder() {
        return folder;
    }

    @Override
    public String toString() {
        return "CreateFolderCommand{" + folderName + (folder != null ? ", id=" + folder.id() : "") + "}";
    }

}

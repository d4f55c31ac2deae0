package edu.washu.tag.provisioning.command;

import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.client.model.FileItem;

/**
 * Uploads a file; disposing deletes it.
 */
public class CreateFileCommand extends AbstractDisposableCommand {

    private final String fileName;
    private final byte[] content;
    private final String parentId;
    private FileItem file;

    public CreateFileCommand(String fileName, byte[] content, String parentId, CommandScope scope,
        CommandAccessLevel accessLevel) {
        super(scope, accessLevel);
        this.fileName = fileName;
        this.content = content;
        this.parentId = parentId;
    }

    @Override
    public String execute(ContentClient client) throws Exception {
        file = client.uploadFile(fileName, parentId, content);
        return file.id();
    }

    @Override
    public void dispose(ContentClient client) throws Exception {
        client.deleteFile(file.id());
    }

    public FileItem getFile() {
        return file;
    }

    @Override
    public String toString() {
        return "CreateFileCommand{" + fileName + (file != null ? ", id=" + file.id() : "") + "}";
    }

}

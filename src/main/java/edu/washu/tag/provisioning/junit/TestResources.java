package edu.washu.tag.provisioning.junit;

import edu.washu.tag.provisioning.client.HttpContentClient;
import edu.washu.tag.provisioning.client.model.FileItem;
import edu.washu.tag.provisioning.client.model.Folder;
import edu.washu.tag.provisioning.client.model.RetentionPolicy;
import edu.washu.tag.provisioning.command.CommandAccessLevel;
import edu.washu.tag.provisioning.command.CommandScope;
import edu.washu.tag.provisioning.command.CreateFileCommand;
import edu.washu.tag.provisioning.command.CreateFolderCommand;
import edu.washu.tag.provisioning.command.CreateRetentionPolicyCommand;
import edu.washu.tag.provisioning.command.DeleteFileCommand;
import edu.washu.tag.provisioning.lifecycle.ResourceLifecycle;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.util.Random;
import java.util.UUID;
import org.junit.jupiter.api.TestInfo;

/**
 * Helpers for creating remote resources from test bodies. Everything created here is
 * tracked by the lifecycle and removed when its scope ends; defaults are test scope and
 * the shared user's client.
 */
public class TestResources {

    public static final String SMALL_FILE = "testdata/smalltest.pdf";
    public static final String SMALL_FILE_V2 = "testdata/smalltestV2.pdf";

    private final ResourceLifecycle lifecycle;

    public TestResources(ResourceLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * Appends a random UUID to {@code resourceName}. Collisions are not checked for.
     */
    public static String uniqueName(String resourceName) {
        return String.format("%s - %s", resourceName, UUID.randomUUID());
    }

    /**
     * Unique name labelled with the running test's method name, or its display name when
     * there is no method (class-level callbacks).
     */
    public static String uniqueName(TestInfo testInfo) {
        return uniqueName(testInfo.getTestMethod().map(Method::getName).orElse(testInfo.getDisplayName()));
    }

    public FileItem createSmallFile() throws Exception {
        return createSmallFile(HttpContentClient.ROOT_FOLDER_ID);
    }

    public FileItem createSmallFile(String parentId) throws Exception {
        return createSmallFile(parentId, CommandScope.TEST, CommandAccessLevel.USER);
    }

    public FileItem createSmallFile(String parentId, CommandScope scope, CommandAccessLevel accessLevel)
        throws Exception {
        CreateFileCommand command = new CreateFileCommand(uniqueName("file"), smallFileContent(), parentId,
            scope, accessLevel);
        lifecycle.execute(command);
        return command.getFile();
    }

    public FileItem createSmallFileAsAdmin(String parentId) throws Exception {
        return createSmallFile(parentId, CommandScope.TEST, CommandAccessLevel.ADMIN);
    }

    /**
     * Delete a file immediately. Not tracked, so use it on files nothing else will dispose.
     */
    public void deleteFile(String fileId) throws Exception {
        lifecycle.execute(new DeleteFileCommand(fileId));
    }

    public Folder createFolder() throws Exception {
        return createFolder(HttpContentClient.ROOT_FOLDER_ID);
    }

    public Folder createFolder(String parentId) throws Exception {
        return createFolder(parentId, CommandScope.TEST, CommandAccessLevel.USER);
    }

    public Folder createFolder(String parentId, CommandScope scope, CommandAccessLevel accessLevel)
        throws Exception {
        CreateFolderCommand command = new CreateFolderCommand(uniqueName("folder"), parentId, scope, accessLevel);
        lifecycle.execute(command);
        return command.getFolder();
    }

    public Folder createFolderAsAdmin(String parentId) throws Exception {
        return createFolder(parentId, CommandScope.TEST, CommandAccessLevel.ADMIN);
    }

    public RetentionPolicy createRetentionPolicy() throws Exception {
        return createRetentionPolicy(HttpContentClient.ROOT_FOLDER_ID, CommandScope.TEST);
    }

    public RetentionPolicy createRetentionPolicy(String folderId, CommandScope scope) throws Exception {
        CreateRetentionPolicyCommand command = new CreateRetentionPolicyCommand(folderId, uniqueName("policy"), scope);
        lifecycle.execute(command);
        return command.getPolicy();
    }

    public static byte[] smallFileContent() {
        return readFixture(SMALL_FILE);
    }

    public static byte[] smallFileV2Content() {
        return readFixture(SMALL_FILE_V2);
    }

    /**
     * Random content of the given size, for chunked upload tests.
     */
    public static InputStream bigFileContent(int fileSize) {
        byte[] data = new byte[fileSize];
        new Random().nextBytes(data);
        return new ByteArrayInputStream(data);
    }

    private static byte[] readFixture(String path) {
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture " + path);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read test fixture " + path, e);
        }
    }

}

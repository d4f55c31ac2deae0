package edu.washu.tag.provisioning.lifecycle;

import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.client.Session;
import edu.washu.tag.provisioning.client.model.User;
import edu.washu.tag.provisioning.command.Command;
import edu.washu.tag.provisioning.command.CommandScope;
import edu.washu.tag.provisioning.command.DisposableCommand;
import edu.washu.tag.provisioning.config.ProvisioningConfig;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the resources created during a test run and tears them down in reverse order at
 * the end of the scope that owns them.
 *
 * <ul>
 *   <li>Run start: authenticates both clients and resolves (or creates) the shared test user.</li>
 *   <li>Class start / test start: open a fresh, empty command stack for that scope.</li>
 *   <li>Test end / class end: drain that stack; a failing dispose fails the teardown.</li>
 *   <li>Run end: delete the shared user if this run created it. Failure is only logged.</li>
 * </ul>
 *
 * Not thread-safe; tests are expected to run sequentially.
 */
public class ResourceLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(ResourceLifecycle.class);
    static final String USER_NAME_PREFIX = "IT App User - ";

    private final ProvisioningConfig config;
    private final Session session;

    private LifecycleState state = LifecycleState.UNINITIALIZED;
    private SessionState sessionState;
    private ClientRouter router;
    private CommandStack classCommands;
    private CommandStack testCommands;

    public ResourceLifecycle(ProvisioningConfig config, Session session) {
        this.config = config;
        this.session = session;
    }

    /**
     * Create a lifecycle and run its start step.
     */
    public static ResourceLifecycle start(ProvisioningConfig config, Session session) throws Exception {
        ResourceLifecycle lifecycle = new ResourceLifecycle(config, session);
        lifecycle.startRun();
        return lifecycle;
    }

    public void startRun() throws Exception {
        requireState(LifecycleState.UNINITIALIZED, "start run");
        logger.info("--- Run setup ---");

        ContentClient adminClient = session.adminClient();

        String userId;
        boolean userCreated;
        if (config.hasUserId()) {
            userId = config.getUserId();
            userCreated = false;
            logger.info("Running tests as configured user {}", userId);
        } else {
            User user = adminClient.createEnterpriseUser(USER_NAME_PREFIX + UUID.randomUUID(), true);
            userId = user.id();
            userCreated = true;
            logger.info("Running tests as new user \"{}\" ({})", user.name(), userId);
        }

        ContentClient userClient;
        try {
            userClient = session.userClient(userId);
        } catch (Exception e) {
            if (userCreated) {
                deleteCreatedUser(adminClient, userId, e);
            }
            throw e;
        }

        sessionState = new SessionState(adminClient, userClient, userId, userCreated);
        router = new ClientRouter(sessionState);
        state = LifecycleState.RUN_ACTIVE;
        logger.info("--- Run setup complete ---");
    }

    public void startClass() {
        requireState(LifecycleState.RUN_ACTIVE, "start class");
        classCommands = new CommandStack(CommandScope.CLASS);
        state = LifecycleState.CLASS_ACTIVE;
    }

    public void startTest() {
        requireState(LifecycleState.CLASS_ACTIVE, "start test");
        testCommands = new CommandStack(CommandScope.TEST);
        state = LifecycleState.TEST_ACTIVE;
    }

    public void endTest() throws Exception {
        requireState(LifecycleState.TEST_ACTIVE, "end test");
        CommandStack commands = testCommands;
        testCommands = null;
        state = LifecycleState.CLASS_ACTIVE;
        drain(commands);
    }

    /**
     * Drain the class stack, ending an open test first. The class stack is drained even when
     * the test drain fails; the test failure is rethrown with any class failure suppressed.
     */
    public void endClass() throws Exception {
        Exception testFailure = null;
        if (state == LifecycleState.TEST_ACTIVE) {
            try {
                endTest();
            } catch (Exception e) {
                testFailure = e;
            }
        }
        requireState(LifecycleState.CLASS_ACTIVE, "end class");
        CommandStack commands = classCommands;
        classCommands = null;
        state = LifecycleState.RUN_ACTIVE;
        try {
            drain(commands);
        } catch (Exception e) {
            if (testFailure == null) {
                throw e;
            }
            testFailure.addSuppressed(e);
        }
        if (testFailure != null) {
            throw testFailure;
        }
    }

    /**
     * Delete the shared user if this run created it. Never throws: the delete legitimately
     * fails while content still references the user.
     */
    public void endRun() {
        if (state == LifecycleState.TORN_DOWN || state == LifecycleState.UNINITIALIZED) {
            return;
        }
        logger.info("--- Run teardown ---");
        if (classCommands != null && !classCommands.isEmpty()) {
            logLeaked(classCommands);
        }
        if (testCommands != null && !testCommands.isEmpty()) {
            logLeaked(testCommands);
        }
        classCommands = null;
        testCommands = null;
        state = LifecycleState.TORN_DOWN;

        if (sessionState.userCreated()) {
            try {
                sessionState.adminClient().deleteEnterpriseUser(sessionState.userId(), false, true);
                logger.info("Deleted test user {}", sessionState.userId());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while deleting test user {}", sessionState.userId(), e);
            } catch (Exception e) {
                logger.warn("Failed to delete test user {}", sessionState.userId(), e);
            }
        }
        logger.info("--- Run teardown complete ---");
    }

    /**
     * Run a command with the client matching its access level. A disposable command is
     * tracked in the stack of its scope, but only once it has executed successfully.
     *
     * @return the identifier the command produced
     * @throws IllegalStateException if the command's scope is not currently open
     */
    public String execute(Command command) throws Exception {
        requireRunActive();
        CommandStack target = null;
        if (command instanceof DisposableCommand) {
            target = stackFor(((DisposableCommand) command).scope());
            if (target == null) {
                throw new IllegalStateException(
                    "No " + ((DisposableCommand) command).scope() + " scope is open to track " + command);
            }
        }

        String resourceId = command.execute(router.clientFor(command));
        if (target != null) {
            target.push((DisposableCommand) command);
        }
        return resourceId;
    }

    /**
     * @return commands awaiting disposal in the given scope, most recent first
     */
    public List<DisposableCommand> pending(CommandScope scope) {
        CommandStack commands = stackFor(scope);
        return commands == null ? List.of() : commands.snapshot();
    }

    public SessionState getSessionState() {
        requireRunActive();
        return sessionState;
    }

    public ClientRouter getRouter() {
        requireRunActive();
        return router;
    }

    public LifecycleState getState() {
        return state;
    }

    // The run never became active, so endRun will not see this user
    private static void deleteCreatedUser(ContentClient adminClient, String userId, Exception cause) {
        try {
            adminClient.deleteEnterpriseUser(userId, false, true);
            logger.info("Deleted test user {} after failed run setup", userId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(e);
        } catch (Exception e) {
            cause.addSuppressed(e);
        }
    }

    private CommandStack stackFor(CommandScope scope) {
        return scope == CommandScope.CLASS ? classCommands : testCommands;
    }

    private void drain(CommandStack commands) throws Exception {
        try {
            commands.drain(router);
        } catch (Exception e) {
            logLeaked(commands);
            throw e;
        }
    }

    private static void logLeaked(CommandStack commands) {
        for (DisposableCommand command : commands.snapshot()) {
            logger.warn("Leaked {} from {} scope, it was not disposed", command, commands.getScope());
        }
    }

    private void requireRunActive() {
        if (state == LifecycleState.UNINITIALIZED || state == LifecycleState.TORN_DOWN) {
            throw new IllegalStateException("Run is not active (" + state + ")");
        }
    }

    private void requireState(LifecycleState expected, String transition) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + transition + " in state " + state + ", expected " + expected);
        }
    }

}

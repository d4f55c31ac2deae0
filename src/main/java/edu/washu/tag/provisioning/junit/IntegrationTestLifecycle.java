package edu.washu.tag.provisioning.junit;

import edu.washu.tag.provisioning.client.ClientCredentialsSession;
import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.client.Session;
import edu.washu.tag.provisioning.config.ProvisioningConfig;
import edu.washu.tag.provisioning.lifecycle.LifecycleState;
import edu.washu.tag.provisioning.lifecycle.ResourceLifecycle;
import edu.washu.tag.provisioning.lifecycle.SessionState;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JUnit 5 extension that drives a {@link ResourceLifecycle} for the whole test run.
 *
 * - First BeforeAll: loads the config, authenticates and resolves the shared user, once
 *   across the entire run (using the root ExtensionContext store)
 * - BeforeAll / AfterAll: open and drain the class scope
 * - BeforeEach / AfterEach: open and drain the test scope
 * - Run teardown happens when the root context closes (after all tests)
 *
 * Tests receive {@link TestResources}, {@link ResourceLifecycle}, {@link SessionState} or a
 * {@link ContentClient} via parameter resolution. A ContentClient parameter annotated with
 * {@link Admin} resolves to the admin client; otherwise to the shared user's client.
 *
 * <p>@Nested classes share the scope of their enclosing class.
 */
public class IntegrationTestLifecycle implements BeforeAllCallback, AfterAllCallback,
    BeforeEachCallback, AfterEachCallback, ParameterResolver {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationTestLifecycle.class);

    // ExtensionContext.Store keys
    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(IntegrationTestLifecycle.class);
    private static final String RUN_STATE_KEY = "runState";
    private static final String OWNS_CLASS_SCOPE_KEY = "ownsClassScope";

    private final Supplier<ProvisioningConfig> configSupplier;
    private final Function<ProvisioningConfig, Session> sessionFactory;

    public IntegrationTestLifecycle() {
        this(ProvisioningConfig::load, ClientCredentialsSession::new);
    }

    /**
     * Use a custom config source and session, e.g. from a {@code @RegisterExtension} field.
     * Only the first extension instance to run in a test run establishes the session.
     */
    public IntegrationTestLifecycle(Supplier<ProvisioningConfig> configSupplier,
        Function<ProvisioningConfig, Session> sessionFactory) {
        this.configSupplier = configSupplier;
        this.sessionFactory = sessionFactory;
    }

    /**
     * Teardown resource stored in the root context store.
     * JUnit calls close() after all tests finish.
     */
    private static class RunState implements ExtensionContext.Store.CloseableResource {

        private final ResourceLifecycle lifecycle;
        private final Exception startFailure;

        private RunState(ResourceLifecycle lifecycle, Exception startFailure) {
            this.lifecycle = lifecycle;
            this.startFailure = startFailure;
        }

        private ResourceLifecycle lifecycle() {
            if (startFailure != null) {
                throw new IllegalStateException("Run setup failed, no tests can run", startFailure);
            }
            return lifecycle;
        }

        @Override
        public void close() {
            if (lifecycle != null) {
                lifecycle.endRun();
            }
        }
    }

    @Override
    public void beforeAll(ExtensionContext context) throws Exception {
        ResourceLifecycle lifecycle = startRunIfNeeded(context);

        if (lifecycle.getState() == LifecycleState.CLASS_ACTIVE) {
            // @Nested class: keep using the enclosing class scope
            context.getStore(NAMESPACE).put(OWNS_CLASS_SCOPE_KEY, false);
            return;
        }
        lifecycle.startClass();
        context.getStore(NAMESPACE).put(OWNS_CLASS_SCOPE_KEY, true);
    }

    @Override
    public void afterAll(ExtensionContext context) throws Exception {
        Boolean ownsClassScope = context.getStore(NAMESPACE).get(OWNS_CLASS_SCOPE_KEY, Boolean.class);
        if (Boolean.TRUE.equals(ownsClassScope)) {
            lifecycle(context).endClass();
        }
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        lifecycle(context).startTest();
    }

    @Override
    public void afterEach(ExtensionContext context) throws Exception {
        lifecycle(context).endTest();
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        return type == TestResources.class
            || type == ResourceLifecycle.class
            || type == SessionState.class
            || type == ContentClient.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        ResourceLifecycle lifecycle;
        try {
            lifecycle = lifecycle(extensionContext);
        } catch (IllegalStateException e) {
            throw new ParameterResolutionException("No active test run to resolve " + type, e);
        }

        if (type == TestResources.class) {
            return new TestResources(lifecycle);
        }
        if (type == ResourceLifecycle.class) {
            return lifecycle;
        }
        if (type == SessionState.class) {
            return lifecycle.getSessionState();
        }
        if (type == ContentClient.class) {
            SessionState session = lifecycle.getSessionState();
            return parameterContext.isAnnotated(Admin.class) ? session.adminClient() : session.userClient();
        }
        throw new ParameterResolutionException("Unsupported parameter type: " + type);
    }

    private ResourceLifecycle startRunIfNeeded(ExtensionContext context) {
        // Use the root context store so setup/teardown runs exactly once
        ExtensionContext.Store rootStore = context.getRoot().getStore(NAMESPACE);
        RunState runState = rootStore.get(RUN_STATE_KEY, RunState.class);
        if (runState == null) {
            try {
                ProvisioningConfig config = configSupplier.get();
                runState = new RunState(ResourceLifecycle.start(config, sessionFactory.apply(config)), null);
            } catch (Exception e) {
                logger.error("Run setup failed", e);
                runState = new RunState(null, e);
            }
            rootStore.put(RUN_STATE_KEY, runState);
        }
        return runState.lifecycle();
    }

    private static ResourceLifecycle lifecycle(ExtensionContext context) {
        RunState runState = context.getRoot().getStore(NAMESPACE).get(RUN_STATE_KEY, RunState.class);
        if (runState == null) {
            throw new IllegalStateException("Run has not been set up; is the extension registered on the class?");
        }
        return runState.lifecycle();
    }

}

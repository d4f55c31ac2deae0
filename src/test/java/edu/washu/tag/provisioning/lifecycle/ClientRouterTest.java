package edu.washu.tag.provisioning.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;

import edu.washu.tag.provisioning.client.ContentClient;
import edu.washu.tag.provisioning.command.CommandAccessLevel;
import edu.washu.tag.provisioning.command.DeleteFileCommand;
import edu.washu.tag.provisioning.helpers.FakeContentService;
import org.junit.jupiter.api.Test;

class ClientRouterTest {

    private final FakeContentService service = new FakeContentService();
    private final ContentClient admin = service.client("admin");
    private final ContentClient user = service.client("user");
    private final ClientRouter router = new ClientRouter(new SessionState(admin, user, "U1", false));

    @Test
    void testAdminLevelRoutesToAdminClient() {
        assertThat(router.clientFor(CommandAccessLevel.ADMIN)).isSameAs(admin);
        assertThat(router.clientFor(new DeleteFileCommand("X1", CommandAccessLevel.ADMIN))).isSameAs(admin);
    }

    @Test
    void testUserLevelRoutesToUserClient() {
        assertThat(router.clientFor(CommandAccessLevel.USER)).isSameAs(user);
        assertThat(router.clientFor(new DeleteFileCommand("X1"))).isSameAs(user);
    }

    @Test
    void testUnsetLevelFallsBackToUserClient() {
        assertThat(router.clientFor((CommandAccessLevel) null)).isSameAs(user);
    }

}

package tuftrust.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.MockitoAnnotations;

import tuftrust.crypto.MemoryCryptoService;
import tuftrust.errors.InvalidRoleException;
import tuftrust.errors.SessionFailedException;
import tuftrust.errors.TransportException;
import tuftrust.model.Gun;
import tuftrust.model.KeyAlgorithm;
import tuftrust.model.RoleName;
import tuftrust.model.RoleWithSignatures;
import tuftrust.model.SignedMetadata;
import tuftrust.model.Target;
import tuftrust.model.TufPublicKey;

public class TrustSessionRemoteTest {

    private static final Gun     GUN = new Gun("example.com/remote");
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Captor
    private ArgumentCaptor<List<SignedMetadata>> captor;

    private AutoCloseable       mocks;
    private MemoryCryptoService custody;
    private TufPublicKey        rootKey;
    private RemoteStore         remote;
    private TrustSession        session;

    @BeforeEach
    public void before() {
        mocks = MockitoAnnotations.openMocks(this);
        custody = new MemoryCryptoService();
        rootKey = custody.create(RoleName.ROOT, GUN, KeyAlgorithm.ED25519);
        remote = mock(RemoteStore.class);
        TrustConfig config = TrustConfig.defaults()
                                        .withKeyAlgorithm(KeyAlgorithm.ED25519)
                                        .withClock(Clock.fixed(NOW, ZoneOffset.UTC));
        session = new TrustSession(GUN, custody, remote, config);
    }

    @AfterEach
    public void after() throws Exception {
        mocks.close();
    }

    private static Target target(String name) {
        return new Target(name, 3, Map.of("sha256", "abcdef"));
    }

    private List<SignedMetadata> lastPublished(int calls) {
        verify(remote, times(calls)).publish(eq(GUN), captor.capture());
        return captor.getValue();
    }

    private static SignedMetadata find(List<SignedMetadata> metadata, RoleName role) {
        return metadata.stream().filter(m -> m.role().equals(role)).findFirst().orElseThrow();
    }

    @Test
    public void firstPublishSendsEveryRole() {
        session.initialize(List.of(rootKey.id()));
        session.publish();

        List<SignedMetadata> published = lastPublished(1);
        assertEquals(RoleName.BASE_ROLES,
                published.stream().map(SignedMetadata::role).collect(Collectors.toList()));
        for (SignedMetadata m : published) {
            assertEquals(1, m.version());
            assertFalse(m.signatures().isEmpty(), m.role().value());
        }
        assertEquals(NOW.plus(Duration.ofDays(14)), find(published, RoleName.TIMESTAMP).expires());
        assertEquals(NOW.plus(Duration.ofDays(3650)), find(published, RoleName.ROOT).expires());
    }

    @Test
    public void laterPublishSendsOnlyWhatChanged() {
        session.initialize(List.of(rootKey.id()));
        session.publish();
        session.addTarget(target("a"));
        session.publish();

        List<SignedMetadata> published = lastPublished(2);
        assertEquals(List.of(RoleName.TARGETS, RoleName.SNAPSHOT, RoleName.TIMESTAMP),
                published.stream().map(SignedMetadata::role).collect(Collectors.toList()));
        assertEquals(2, find(published, RoleName.TARGETS).version());
    }

    @Test
    public void fieldLengthsCountUtf8Bytes() {
        session.initialize(List.of(rootKey.id()));
        session.addTarget(target("\u00e9t\u00e9"));
        session.publish();

        String payload = new String(find(lastPublished(1), RoleName.TARGETS).payload(), StandardCharsets.UTF_8);
        assertTrue(payload.contains("target:5:\u00e9t\u00e9|"), payload);
    }

    @Test
    public void transportFailureIsRetryable() {
        doThrow(new TransportException("unreachable", new IOException("connection reset")))
                .when(remote).publish(eq(GUN), anyList());
        session.initialize(List.of(rootKey.id()));
        session.addTarget(target("a"));

        TransportException e = assertThrows(TransportException.class, () -> session.publish());
        assertTrue(e.isRetryable());
        assertTrue(session.listTargets().isEmpty());
        assertEquals(1, session.getChangelist().size());
        assertEquals(SessionState.STAGING, session.state());

        doNothing().when(remote).publish(eq(GUN), anyList());
        session.publish();
        assertEquals(1, session.listTargets().size());
        assertTrue(session.getChangelist().isEmpty());
        verify(remote, times(2)).publish(eq(GUN), anyList());
    }

    @Test
    public void unexpectedFailureMarksSessionFailed() {
        IllegalStateException broken = new IllegalStateException("corrupt response");
        doThrow(broken).when(remote).publish(eq(GUN), anyList());
        session.initialize(List.of(rootKey.id()));
        session.addTarget(target("a"));

        SessionFailedException e = assertThrows(SessionFailedException.class, () -> session.publish());
        assertSame(broken, e.getCause());
        assertEquals(SessionState.FAILED, session.state());
        assertThrows(SessionFailedException.class, () -> session.addTarget(target("b")));
        assertThrows(SessionFailedException.class, () -> session.publish());

        session.deleteTrustData(false);
        assertEquals(SessionState.UNINITIALIZED, session.state());
        doNothing().when(remote).publish(eq(GUN), anyList());
        session.initialize(List.of(rootKey.id()));
        session.publish();
        assertEquals(SessionState.INITIALIZED, session.state());
    }

    @Test
    public void remoteDeleteFailureKeepsLocalState() {
        session.initialize(List.of(rootKey.id()));
        session.addTarget(target("a"));
        session.publish();

        doThrow(new TransportException(new IOException("timeout"))).when(remote).delete(GUN);
        assertThrows(TransportException.class, () -> session.deleteTrustData(true));
        assertEquals(SessionState.INITIALIZED, session.state());
        assertEquals(1, session.listTargets().size());

        doNothing().when(remote).delete(GUN);
        session.deleteTrustData(true);
        verify(remote, times(2)).delete(GUN);
        assertEquals(SessionState.UNINITIALIZED, session.state());
    }

    @Test
    public void serverManagedRolesAreLeftUnsigned() {
        TufPublicKey timestampKey = new MemoryCryptoService().create(RoleName.TIMESTAMP, GUN, KeyAlgorithm.ED25519);
        when(remote.managedKey(GUN, RoleName.TIMESTAMP)).thenReturn(timestampKey);

        session.initialize(List.of(rootKey.id()), RoleName.TIMESTAMP);
        session.publish();

        List<SignedMetadata> published = lastPublished(1);
        assertTrue(find(published, RoleName.TIMESTAMP).signatures().isEmpty());
        assertFalse(find(published, RoleName.SNAPSHOT).signatures().isEmpty());
        assertTrue(custody.listKeys(RoleName.TIMESTAMP).isEmpty());
        RoleWithSignatures timestamp = session.listRoles().get(3);
        assertEquals(RoleName.TIMESTAMP, timestamp.role().name());
        assertEquals(List.of(timestampKey.id()), timestamp.role().rootRole().keyIds());
        verify(remote).managedKey(GUN, RoleName.TIMESTAMP);
    }

    @Test
    public void rotateToServerManagedKey() {
        session.initialize(List.of(rootKey.id()));
        session.publish();
        TufPublicKey snapshotKey = new MemoryCryptoService().create(RoleName.SNAPSHOT, GUN, KeyAlgorithm.ED25519);
        when(remote.rotateManagedKey(GUN, RoleName.SNAPSHOT)).thenReturn(snapshotKey);

        assertThrows(InvalidRoleException.class,
                () -> session.rotateKey(RoleName.SNAPSHOT, true, List.of(rootKey.id())));
        session.rotateKey(RoleName.SNAPSHOT, true, List.of());
        session.publish();

        List<SignedMetadata> published = lastPublished(2);
        assertTrue(find(published, RoleName.SNAPSHOT).signatures().isEmpty());
        assertFalse(find(published, RoleName.ROOT).signatures().isEmpty());
        assertEquals(List.of(snapshotKey.id()), session.listRoles().get(2).role().rootRole().keyIds());
        verify(remote).rotateManagedKey(GUN, RoleName.SNAPSHOT);
    }
}

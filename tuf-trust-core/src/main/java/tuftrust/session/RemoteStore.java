package tuftrust.session;

import tuftrust.errors.UnimplementedException;
import tuftrust.model.Gun;
import tuftrust.model.RoleName;
import tuftrust.model.SignedMetadata;
import tuftrust.model.TufPublicKey;

import java.util.List;

/**
 * The remote metadata authority a session publishes to.
 * Implementations report failures as {@link tuftrust.errors.TransportException}
 * and unsupported operations as {@link UnimplementedException}.
 */
public interface RemoteStore {

    /**
     * Accept a new metadata generation. Roles the server manages arrive
     * unsigned and are signed remotely.
     */
    void publish(Gun gun, List<SignedMetadata> metadata);

    /** Delete every piece of remote trust data for {@code gun}. */
    void delete(Gun gun);

    /** The server-held key of a server-managed role. */
    TufPublicKey managedKey(Gun gun, RoleName role);

    /** Replace the server-held key of a role and return the new public key. */
    TufPublicKey rotateManagedKey(Gun gun, RoleName role);

    /**
     * A store for sessions that never talk to a server: publishing is a
     * local no-op, every remote-only operation is unimplemented.
     */
    static RemoteStore offline() {
        return new RemoteStore() {
            @Override
            public void publish(Gun gun, List<SignedMetadata> metadata) {
            }

            @Override
            public void delete(Gun gun) {
                throw new UnimplementedException("delete remote trust data");
            }

            @Override
            public TufPublicKey managedKey(Gun gun, RoleName role) {
                throw new UnimplementedException("server managed key for " + role);
            }

            @Override
            public TufPublicKey rotateManagedKey(Gun gun, RoleName role) {
                throw new UnimplementedException("server managed key rotation for " + role);
            }
        };
    }
}

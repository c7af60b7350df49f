package tuftrust.session;

import tuftrust.catalog.TargetCatalog;
import tuftrust.delegation.DelegationTree;
import tuftrust.registry.RoleRegistry;

/**
 * One committed generation: roles, delegations and targets.
 * Generation 0 is the freshly initialized, never published state.
 */
record TrustState(
        RoleRegistry registry,
        DelegationTree delegations,
        TargetCatalog catalog,
        int generation
) {
    boolean published() {
        return generation > 0;
    }
}

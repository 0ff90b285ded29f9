// file: core/src/main/java/io/fedlite/core/FederationIdentity.java
package io.fedlite.core;

import java.util.Objects;

/**
 * Identities a client is bound to for its whole lifetime.
 *
 *  - aggregatorUuid:          the aggregator every response must come from
 *  - federationUuid:          the federation every message must belong to
 *  - singleColCertCommonName: optional certificate common name shared by all
 *                             collaborators; null means "not configured"
 *
 * The caller's own name (collaborator or admin) is supplied per call.
 */
public record FederationIdentity(
        String aggregatorUuid,
        String federationUuid,
        String singleColCertCommonName
) {
    public FederationIdentity {
        Objects.requireNonNull(aggregatorUuid, "aggregatorUuid");
        Objects.requireNonNull(federationUuid, "federationUuid");
    }

    /** Common name as it travels on the wire: empty when unset. */
    public String commonNameOrEmpty() {
        return singleColCertCommonName == null ? "" : singleColCertCommonName;
    }
}

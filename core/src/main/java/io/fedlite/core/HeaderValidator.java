// file: core/src/main/java/io/fedlite/core/HeaderValidator.java
package io.fedlite.core;

import java.util.Objects;

/**
 * Builds the identity header for outgoing requests and checks the header of
 * every incoming response.
 *
 * Checks run in a fixed order and stop at the first violation:
 *  1. receiver        == caller name
 *  2. sender          == aggregator uuid
 *  3. federation uuid == configured federation uuid
 *  4. common name     == configured common name (or "" when unset)
 */
public final class HeaderValidator {

    private final FederationIdentity identity;

    public HeaderValidator(FederationIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    /**
     * Header for a request sent by {@code callerName} to the aggregator.
     */
    public MessageHeader stamp(String callerName) {
        Objects.requireNonNull(callerName, "callerName");
        return new MessageHeader(
                callerName,
                identity.aggregatorUuid(),
                identity.federationUuid(),
                identity.commonNameOrEmpty()
        );
    }

    /**
     * @throws HeaderMismatchException on the first field that does not match
     */
    public void validate(MessageHeader header, String callerName) {
        Objects.requireNonNull(header, "header");
        check(HeaderMismatchException.Field.RECEIVER, callerName, header.receiver());
        check(HeaderMismatchException.Field.SENDER, identity.aggregatorUuid(), header.sender());
        check(HeaderMismatchException.Field.FEDERATION_UUID, identity.federationUuid(), header.federationUuid());
        check(HeaderMismatchException.Field.COMMON_NAME, identity.commonNameOrEmpty(), header.commonName());
    }

    private static void check(HeaderMismatchException.Field field, String expected, String actual) {
        if (!Objects.equals(expected, actual)) {
            throw new HeaderMismatchException(field, expected, actual);
        }
    }
}

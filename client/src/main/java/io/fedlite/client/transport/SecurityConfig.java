package io.fedlite.client.transport;

/**
 * Security posture of the channel to the aggregator.
 * <p>
 * In TLS mode the root certificate is always required; the client
 * certificate and private key are required unless client authentication is
 * disabled. Missing material is reported by the {@link ChannelFactory} when
 * it opens a channel, so every field except {@code tls} may be null here.
 *
 * @param tls               false means plaintext
 * @param rootCertificate   CA bundle used to verify the aggregator
 * @param certificate       client certificate chain for mutual TLS
 * @param privateKey        client private key for mutual TLS
 * @param disableClientAuth TLS with server authentication only
 */
public record SecurityConfig(
        boolean tls,
        CredentialSource rootCertificate,
        CredentialSource certificate,
        CredentialSource privateKey,
        boolean disableClientAuth
) {

    public static SecurityConfig plaintext() {
        return new SecurityConfig(false, null, null, null, false);
    }

    public static SecurityConfig mutualTls(CredentialSource root, CredentialSource cert, CredentialSource key) {
        return new SecurityConfig(true, root, cert, key, false);
    }

    public static SecurityConfig serverAuthOnly(CredentialSource root) {
        return new SecurityConfig(true, root, null, null, true);
    }
}

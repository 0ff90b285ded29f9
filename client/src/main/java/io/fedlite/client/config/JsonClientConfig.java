package io.fedlite.client.config;

import java.util.List;

/**
 * JSON shape of a client config file. Missing keys keep these defaults.
 */
public class JsonClientConfig {
    public String aggregatorAddress;
    public int aggregatorPort;
    public boolean tls = true;
    public boolean disableClientAuth;
    public String rootCertificate;
    public String certificate;
    public String privateKey;
    public String aggregatorUuid;
    public String federationUuid;
    public String singleColCertCommonName;
    public long clientReconnectInterval = 1;
    public List<String> retryableStatuses = List.of("UNAVAILABLE");
    public List<String> resendStatuses = List.of("UNKNOWN");
    public int maxAttempts;
    public int maxStreamChunkBytes = 2 * 1024 * 1024;
    public int maxMessageBytes = 128 * 1024 * 1024;
}

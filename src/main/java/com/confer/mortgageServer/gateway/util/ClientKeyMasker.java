package com.confer.mortgageServer.gateway.util;

/**
 * Utility class for masking client keys (API keys, addresses) in logs.
 */
public class ClientKeyMasker {

    private ClientKeyMasker() {}

    /**
     * Shows the first 2 and last 2 characters, masks the middle.
     *
     * @param clientKey The client key to mask
     * @return Masked key (e.g., "ab****yz")
     */
    public static String mask(String clientKey) {
        if (clientKey == null || clientKey.length() <= 4) {
            return "****";
        }
        return clientKey.substring(0, 2) + "****" + clientKey.substring(clientKey.length() - 2);
    }
}

package com.pipeline.service.api;

/**
 * Persistent store for service credentials saved with the {@code auth} command.
 * <p>
 * Credentials are kept encrypted at rest and decrypted on read.
 */
public interface CredentialStore {

    /**
     * Saves or replaces the credential of a service.
     *
     * @param service the service name the credential belongs to
     * @param token   the plain-text credential
     */
    void saveCredential(String service, String token);

    /**
     * @param service the service name
     * @return the plain-text credential, or {@code null} when none is stored or it cannot be decrypted
     */
    String getCredential(String service);
}

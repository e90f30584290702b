package com.pipeline.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.service.api.CredentialStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A file-based {@link CredentialStore} that keeps service credentials in
 * {@code <data-dir>/.api-pipeline/credentials.json}.
 * <p>
 * Every credential is encrypted with the jasypt {@link StringEncryptor} before it is held in
 * memory or written to disk, and decrypted only when read. File I/O is synchronized so concurrent
 * pipeline runs cannot interleave writes.
 */
@Service
@Slf4j
public class CredentialStoreImpl implements CredentialStore {

    private final File credentialsFile;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StringEncryptor encryptor;

    private Map<String, String> credentials = new ConcurrentHashMap<>();

    /**
     * @param encryptor     the encryptor provided by the jasypt Spring Boot starter
     * @param dataDirectory directory holding {@code .api-pipeline}; {@code API_PIPELINE_HOME} or the user's home
     */
    public CredentialStoreImpl(StringEncryptor encryptor,
                               @Value("${API_PIPELINE_HOME:${user.home}}") String dataDirectory) {
        this.encryptor = encryptor;
        this.credentialsFile = new File(dataDirectory, ".api-pipeline/credentials.json");
    }

    @PostConstruct
    public void init() {
        loadCredentials();
    }

    @Override
    public void saveCredential(String service, String token) {
        log.info("Encrypting and saving credential for service '{}'", service);
        credentials.put(service, encryptor.encrypt(token));
        saveCredentials();
    }

    /**
     * {@inheritDoc}
     * <p>
     * A credential that no longer decrypts, usually because the jasypt password changed, is
     * logged and reported as absent.
     */
    @Override
    public String getCredential(String service) {
        String encrypted = credentials.get(service);
        if (encrypted == null) {
            return null;
        }
        try {
            return encryptor.decrypt(encrypted);
        } catch (Exception e) {
            log.error("Could not decrypt credential for service '{}'. The encryptor password may have changed.", service);
            return null;
        }
    }

    private synchronized void saveCredentials() {
        try {
            File parentDir = credentialsFile.getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create directory " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(credentialsFile, Map.of("credentials", credentials));
        } catch (IOException e) {
            log.error("Failed to save credentials to {}", credentialsFile, e);
            throw new UncheckedIOException("Failed to save credentials", e);
        }
    }

    /**
     * Loads stored credentials. A file that cannot be parsed is moved aside with a
     * {@code .corrupted.<timestamp>} suffix and the store starts empty.
     */
    private synchronized void loadCredentials() {
        if (!credentialsFile.exists() || credentialsFile.length() == 0) {
            log.info("No credentials file found at {}, starting empty.", credentialsFile);
            return;
        }
        try {
            Map<String, Map<String, String>> stored = objectMapper.readValue(credentialsFile, new TypeReference<>() {});
            Map<String, String> loaded = stored.get("credentials");
            if (loaded != null) {
                this.credentials = new ConcurrentHashMap<>(loaded);
            }
            log.info("Loaded {} stored credential(s) from {}", credentials.size(), credentialsFile);
        } catch (IOException e) {
            log.warn("Could not parse credentials file {}; backing it up and starting empty. Error: {}", credentialsFile, e.getMessage());
            backupCorruptedFile();
            this.credentials = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedFile() {
        File backup = new File(credentialsFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(credentialsFile.toPath(), backup.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted credentials file to {}", backup.getAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to back up corrupted credentials file {}", credentialsFile, e);
        }
    }
}

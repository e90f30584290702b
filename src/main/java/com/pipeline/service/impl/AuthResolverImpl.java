package com.pipeline.service.impl;

import com.pipeline.model.AuthConfig;
import com.pipeline.model.AuthType;
import com.pipeline.service.api.AuthResolver;
import com.pipeline.service.api.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves credentials from the Spring {@link Environment}, which covers environment variables,
 * system properties and {@code application.yml} entries (including jasypt {@code ENC(...)}
 * values). Descriptors with {@code config_fallback} also consult the {@link CredentialStore}
 * under the service's name.
 */
@Service
@Slf4j
public class AuthResolverImpl implements AuthResolver {

    private final Environment environment;
    private final CredentialStore credentialStore;

    public AuthResolverImpl(Environment environment, CredentialStore credentialStore) {
        this.environment = environment;
        this.credentialStore = credentialStore;
    }

    @Override
    public Optional<String> validate(String serviceName, AuthConfig auth) {
        AuthType type = auth.getType() == null ? AuthType.NONE : auth.getType();
        switch (type) {
            case QUERY_PARAM:
                return credential(serviceName, auth).isEmpty() ? notSet(List.of(nullToEmpty(auth.getEnvVar()))) : Optional.empty();
            case HEADER:
                if (StringUtils.hasText(auth.getStaticValue())) {
                    return Optional.empty();
                }
                return credential(serviceName, auth).isEmpty() ? notSet(List.of(nullToEmpty(auth.getEnvVar()))) : Optional.empty();
            case HEADER_PAIR:
                List<String> missing = new ArrayList<>();
                auth.getHeaders().values().forEach(name -> {
                    if (secret(name).isEmpty()) {
                        missing.add(name);
                    }
                });
                return missing.isEmpty() ? Optional.empty() : notSet(missing);
            default:
                return Optional.empty();
        }
    }

    @Override
    public Map<String, String> headers(String serviceName, AuthConfig auth) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (auth.getType() == AuthType.HEADER && auth.getHeaderName() != null) {
            if (StringUtils.hasText(auth.getStaticValue())) {
                headers.put(auth.getHeaderName(), auth.getStaticValue());
            } else {
                headers.put(auth.getHeaderName(), nullToEmpty(auth.getPrefix()) + credential(serviceName, auth));
            }
        } else if (auth.getType() == AuthType.HEADER_PAIR) {
            auth.getHeaders().forEach((header, name) -> headers.put(header, secret(name)));
        }
        return headers;
    }

    @Override
    public Map<String, String> queryParams(String serviceName, AuthConfig auth) {
        if (auth.getType() != AuthType.QUERY_PARAM) {
            return Map.of();
        }
        String keyName = StringUtils.hasText(auth.getKeyName()) ? auth.getKeyName() : "apiKey";
        return Map.of(keyName, credential(serviceName, auth));
    }

    @Override
    public String secret(String name) {
        if (!StringUtils.hasText(name)) {
            return "";
        }
        return nullToEmpty(environment.getProperty(name));
    }

    private String credential(String serviceName, AuthConfig auth) {
        String value = secret(auth.getEnvVar());
        if (value.isEmpty() && auth.isConfigFallback() && serviceName != null) {
            log.debug("'{}' is not set, falling back to the stored credential of '{}'", auth.getEnvVar(), serviceName);
            value = nullToEmpty(credentialStore.getCredential(serviceName));
        }
        return value;
    }

    private static Optional<String> notSet(List<String> names) {
        return Optional.of(String.join(", ", names) + " is not set");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

package com.pipeline.cli;

import com.pipeline.dto.request.AuthRequest;
import com.pipeline.dto.response.CommandResponse;
import com.pipeline.service.api.CredentialStore;
import com.pipeline.service.api.ServiceRegistry;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Stores credentials for configured services.
 */
@ShellComponent
public class AuthCommand {

    private final ServiceRegistry serviceRegistry;
    private final CredentialStore credentialStore;

    public AuthCommand(ServiceRegistry serviceRegistry, CredentialStore credentialStore) {
        this.serviceRegistry = serviceRegistry;
        this.credentialStore = credentialStore;
    }

    /**
     * Saves an encrypted credential for a service. It is used by services whose auth sets
     * {@code config-fallback} when the environment does not provide the credential.
     *
     * @param service the configured service name
     * @param token   the credential
     * @return a colored confirmation or error
     */
    @ShellMethod(key = "auth", value = "Store a credential for a configured service.")
    public String auth(
            @ShellOption(help = "The service the credential belongs to.") String service,
            @ShellOption(help = "The credential or token.") String token
    ) {
        var request = new AuthRequest(service, token);
        CommandResponse response;
        if (serviceRegistry.find(request.service()).isEmpty()) {
            response = new CommandResponse(false, "Unknown service: " + request.service());
        } else if (request.token() == null || request.token().isBlank()) {
            response = new CommandResponse(false, "The token must not be empty.");
        } else {
            credentialStore.saveCredential(request.service(), request.token());
            response = new CommandResponse(true, "Stored credential for '" + request.service() + "'");
        }
        return response.toAnsiString();
    }
}

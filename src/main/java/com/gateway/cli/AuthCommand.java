package com.gateway.cli;

import com.gateway.auth.OAuth2Status;
import com.gateway.dto.response.AuthorizationRequest;
import com.gateway.dto.response.CommandResponse;
import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import com.gateway.model.UserAuthorization;
import com.gateway.service.api.Gateway;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that provides commands for handling authentication.
 * <p>
 * Static credentials (basic, bearer, API key) are attached to a document, or to every document,
 * with {@code auth-add}. OAuth2 is a two step flow: {@code auth-begin} prints the provider URL
 * and {@code auth-complete} takes the code and state returned to the redirect URI.
 */
@ShellComponent
public class AuthCommand {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final Gateway gateway;

    public AuthCommand(Gateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Attaches an authentication configuration.
     *
     * @param documentId The document the configuration belongs to. Ignored with {@code --global}.
     * @param scheme     One of basic, bearer, api_key or oauth2.
     * @param config     Scheme settings as {@code name=value} pairs, e.g. {@code token=abc}.
     * @param priority   Higher priorities are tried first.
     * @param optional   If set, calls go ahead unauthenticated when this configuration fails.
     * @param global     If set, the configuration applies to every document.
     * @return A string formatted with ANSI colors indicating the result of the operation.
     */
    @ShellMethod(key = "auth-add", value = "Configure authentication for a document.")
    public String add(
            @ShellOption(value = {"--document", "-d"}, help = "The document id.", defaultValue = ShellOption.NULL) String documentId,
            @ShellOption(value = {"--scheme", "-s"}, help = "basic, bearer, api_key or oauth2.") String scheme,
            @ShellOption(value = {"--config", "-c"}, arity = Integer.MAX_VALUE, help = "Settings as name=value.") String[] config,
            @ShellOption(value = "--priority", help = "Higher priorities are tried first.", defaultValue = "0") int priority,
            @ShellOption(value = "--optional", help = "Do not fail calls when this configuration fails.", defaultValue = "false", arity = 0) boolean optional,
            @ShellOption(value = "--global", help = "Apply to every document.", defaultValue = "false", arity = 0) boolean global
    ) {
        CommandResponse response;
        try {
            AuthConfig authConfig = new AuthConfig();
            authConfig.setApiDocumentId(global ? null : documentId);
            authConfig.setScheme(AuthScheme.fromValue(scheme));
            authConfig.getConfig().putAll(KeyValueOptions.parse(config));
            authConfig.setPriority(priority);
            authConfig.setRequired(!optional);
            authConfig.setGlobal(global);
            AuthConfig saved = gateway.addAuthConfig(authConfig);
            String target = global ? "all documents" : "document " + documentId;
            response = new CommandResponse(true, "Added " + saved.getScheme().value() + " configuration " + saved.getId() + " for " + target + ".");
        } catch (Exception e) {
            response = new CommandResponse(false, "Failed to configure authentication: " + e.getMessage());
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "auth-list", value = "List the authentication configurations of a document.")
    public void list(@ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId) {
        try {
            List<AuthConfig> configs = gateway.listAuthConfigs(documentId);
            if (configs.isEmpty()) {
                System.out.println(ANSI_YELLOW + "No authentication configured for document " + documentId + "." + ANSI_RESET);
                return;
            }
            for (AuthConfig config : configs) {
                // Only the keys, the values may be secrets.
                System.out.printf("%s%-36s%s %-8s priority=%d required=%s global=%s keys=%s%n",
                        ANSI_CYAN, config.getId(), ANSI_RESET, config.getScheme().value(), config.getPriority(),
                        config.isRequired(), config.isGlobal(), config.getConfig().keySet());
            }
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString());
        }
    }

    @ShellMethod(key = "auth-begin", value = "Start an OAuth2 authorization for a user.")
    public String begin(
            @ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId,
            @ShellOption(value = {"--user", "-u"}, help = "The user id.") String userId
    ) {
        try {
            AuthorizationRequest request = gateway.beginAuthorization(userId, documentId);
            return new CommandResponse(true, "Open this URL to authorize:").toAnsiString()
                    + "\n" + ANSI_CYAN + request.authorizationUrl() + ANSI_RESET
                    + "\nState id: " + request.stateId() + " (expires " + request.expiresAt() + ")";
        } catch (Exception e) {
            return new CommandResponse(false, "Failed to start authorization: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "auth-complete", value = "Complete an OAuth2 authorization with the returned code.")
    public String complete(
            @ShellOption(value = "--state-id", help = "The state id printed by auth-begin.") String stateId,
            @ShellOption(value = "--code", help = "The authorization code.") String code,
            @ShellOption(value = "--state", help = "The state parameter returned to the redirect URI.") String state
    ) {
        CommandResponse response;
        try {
            UserAuthorization authorization = gateway.completeAuthorization(stateId, code, state);
            String expiry = authorization.getExpiresAt() != null ? " until " + authorization.getExpiresAt() : "";
            response = new CommandResponse(true, "User '" + authorization.getUserId() + "' is authorized for document "
                    + authorization.getApiDocumentId() + expiry + ".");
        } catch (Exception e) {
            response = new CommandResponse(false, "Authorization failed: " + e.getMessage());
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "auth-status", value = "Show the OAuth2 status of a user for a document.")
    public String status(
            @ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId,
            @ShellOption(value = {"--user", "-u"}, help = "The user id.") String userId
    ) {
        try {
            OAuth2Status status = gateway.authorizationStatus(userId, documentId);
            return new CommandResponse(status == OAuth2Status.AUTHORIZED, "OAuth2 status: " + status).toAnsiString();
        } catch (Exception e) {
            return new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "auth-refresh", value = "Refresh the OAuth2 access token of a user.")
    public String refresh(
            @ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId,
            @ShellOption(value = {"--user", "-u"}, help = "The user id.") String userId
    ) {
        try {
            UserAuthorization authorization = gateway.refreshAuthorization(userId, documentId);
            String expiry = authorization.getExpiresAt() != null ? " Expires " + authorization.getExpiresAt() + "." : "";
            return new CommandResponse(true, "Refreshed access token." + expiry).toAnsiString();
        } catch (Exception e) {
            return new CommandResponse(false, "Refresh failed: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "auth-revoke", value = "Forget the OAuth2 tokens of a user.")
    public String revoke(
            @ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId,
            @ShellOption(value = {"--user", "-u"}, help = "The user id.") String userId
    ) {
        boolean removed = gateway.revokeAuthorization(userId, documentId);
        return removed
                ? new CommandResponse(true, "Revoked authorization of '" + userId + "'.").toAnsiString()
                : new CommandResponse(false, "User '" + userId + "' has no authorization for document " + documentId + ".").toAnsiString();
    }
}

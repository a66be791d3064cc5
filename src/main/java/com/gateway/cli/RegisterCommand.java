package com.gateway.cli;

import com.gateway.cli.ui.Spinner;
import com.gateway.dto.request.RegisterSpecificationRequest;
import com.gateway.dto.response.CommandResponse;
import com.gateway.dto.response.RegistrationResult;
import com.gateway.service.api.Gateway;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that registers OpenAPI and AsyncAPI documents with the gateway
 * and removes them again.
 */
@ShellComponent
public class RegisterCommand {

    private final Gateway gateway;
    private final Spinner spinner;

    public RegisterCommand(Gateway gateway, Spinner spinner) {
        this.gateway = gateway;
        this.spinner = spinner;
    }

    /**
     * Registers a specification document from a URL or a local file path. The family is
     * detected from the document unless {@code --family} is given.
     *
     * @return A string formatted with ANSI colors, naming the new document and its endpoint count.
     */
    @ShellMethod(key = "register", value = "Registers an OpenAPI 3.x or AsyncAPI 2.x document.")
    public String register(
            @ShellOption(value = {"--source", "-s"}, help = "The URL or file path of the document.") String source,
            @ShellOption(value = {"--name", "-n"}, help = "A name for the API. Defaults to the document title.", defaultValue = ShellOption.NULL) String name,
            @ShellOption(value = {"--family", "-f"}, help = "Force the family: rest or pubsub.", defaultValue = ShellOption.NULL) String family,
            @ShellOption(value = {"--base-url", "-b"}, help = "Override the document's first server.", defaultValue = ShellOption.NULL) String baseUrl
    ) {
        var request = new RegisterSpecificationRequest(name, source, family, baseUrl);
        CommandResponse response;
        try {
            RegistrationResult result = spinner.spin("Registering...", () -> gateway.registerSpecification(request));
            response = new CommandResponse(true, "Registered " + result.specFamily() + " document " + result.documentId()
                    + " with " + result.endpoints().size() + " endpoints.");
        } catch (Exception e) {
            response = new CommandResponse(false, "Failed to register document: " + e.getMessage());
        }
        return response.toAnsiString();
    }

    @ShellMethod(key = "unregister", value = "Removes a registered document and everything attached to it.")
    public String unregister(@ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId) {
        CommandResponse response;
        try {
            gateway.unregisterDocument(documentId);
            response = new CommandResponse(true, "Removed document " + documentId + ".");
        } catch (Exception e) {
            response = new CommandResponse(false, "Failed to remove document: " + e.getMessage());
        }
        return response.toAnsiString();
    }
}

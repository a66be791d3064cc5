package com.gateway.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gateway.dto.response.CommandResponse;
import com.gateway.exception.GatewayException;
import com.gateway.model.ApiDocument;
import com.gateway.model.CallLog;
import com.gateway.model.Endpoint;
import com.gateway.service.api.Gateway;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for inspecting registered documents, their endpoints with call
 * statistics, and the call log.
 */
@ShellComponent
public class InspectCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_RED = "\u001B[31m";

    private final Gateway gateway;
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public InspectCommand(Gateway gateway) {
        this.gateway = gateway;
    }

    @ShellMethod(key = "documents", value = "Lists the registered documents.")
    public void documents() {
        List<ApiDocument> documents = gateway.listDocuments();
        if (documents.isEmpty()) {
            System.out.println(ANSI_YELLOW + "No documents registered yet. Use the 'register' command first." + ANSI_RESET);
            return;
        }
        documents.forEach(document -> System.out.println(ANSI_GREEN + document.getId() + ANSI_RESET + "  "
                + document.getName() + " " + ANSI_PURPLE + "[" + document.getSpecFamily() + "]" + ANSI_RESET
                + "  " + (document.getBaseAddress() != null ? document.getBaseAddress() : "(no server)")));
    }

    @ShellMethod(key = "endpoints", value = "Lists the endpoints of a document.")
    public void endpoints(@ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId) {
        try {
            ApiDocument document = gateway.getDocument(documentId);
            System.out.println(ANSI_CYAN + "Endpoints of " + ANSI_YELLOW + document.getName() + ANSI_RESET);
            gateway.listEndpoints(documentId).forEach(endpoint -> System.out.println("  " + ANSI_GREEN + endpoint.getId() + ANSI_RESET
                    + "  " + ANSI_PURPLE + endpoint.getOperationKind().toUpperCase() + ANSI_RESET + " " + endpoint.getAddressPattern()
                    + "  (" + endpoint.getProtocol() + ", " + endpoint.getOperationId() + ")"));
        } catch (GatewayException e) {
            System.out.println(new CommandResponse(false, e.getMessage()).toAnsiString());
        }
    }

    /**
     * Shows one endpoint with its parameters, request schema and call statistics.
     */
    @ShellMethod(key = "endpoint", value = "Shows the details and statistics of an endpoint.")
    public void endpoint(@ShellOption(value = {"--id", "-i"}, help = "The endpoint id.") String endpointId) {
        Endpoint endpoint;
        try {
            endpoint = gateway.getEndpoint(endpointId);
        } catch (GatewayException e) {
            System.out.println(new CommandResponse(false, e.getMessage()).toAnsiString());
            return;
        }
        System.out.println("-".repeat(50));
        System.out.println(ANSI_GREEN + "Operation ID: " + ANSI_YELLOW + endpoint.getOperationId() + ANSI_RESET);
        System.out.println("  " + ANSI_PURPLE + endpoint.getOperationKind().toUpperCase() + ANSI_RESET + " " + endpoint.getAddressPattern()
                + " over " + endpoint.getProtocol());
        if (endpoint.getDescription() != null) {
            System.out.println("  Description: " + endpoint.getDescription());
        }
        if (!endpoint.getParameters().isEmpty()) {
            System.out.println(ANSI_CYAN + "  Parameters:" + ANSI_RESET);
            endpoint.getParameters().forEach(p ->
                    System.out.println("    - " + p.getName() + " (in: " + p.getLocation().value() + ", required: " + p.isRequired() + ")"));
        }
        if (endpoint.getRequestSchema() != null) {
            System.out.println(ANSI_CYAN + "  Request schema:" + ANSI_RESET);
            try {
                for (String line : jsonMapper.writeValueAsString(endpoint.getRequestSchema()).split("\n")) {
                    System.out.println("    " + line);
                }
            } catch (JsonProcessingException e) {
                System.out.println("    Could not format request schema.");
            }
        }
        System.out.println(ANSI_CYAN + "  Statistics:" + ANSI_RESET + " calls=" + endpoint.getCallCount()
                + " success=" + endpoint.getSuccessCount() + " errors=" + endpoint.getErrorCount()
                + String.format(" avgLatency=%.1fms", endpoint.getAverageLatencyMs())
                + (endpoint.getLastCalledAt() != null ? " last=" + endpoint.getLastCalledAt() : ""));
    }

    @ShellMethod(key = "calls", value = "Shows the most recent calls, newest first.")
    public void calls(
            @ShellOption(value = {"--endpoint", "-e"}, help = "Only calls of this endpoint.", defaultValue = ShellOption.NULL) String endpointId,
            @ShellOption(value = {"--limit", "-l"}, help = "How many calls to show.", defaultValue = "20") int limit
    ) {
        List<CallLog> calls = gateway.recentCalls(endpointId, limit);
        if (calls.isEmpty()) {
            System.out.println(ANSI_YELLOW + "No calls recorded." + ANSI_RESET);
            return;
        }
        calls.forEach(call -> System.out.println((call.isSuccess() ? ANSI_GREEN : ANSI_RED) + call.getTimestamp() + ANSI_RESET
                + "  " + call.getEndpointId() + "  " + (call.getStatus() != null ? call.getStatus() : "-")
                + "  " + call.getLatencyMs() + " ms" + (call.getError() != null ? "  " + call.getError() : "")));
    }
}

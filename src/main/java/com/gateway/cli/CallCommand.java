package com.gateway.cli;

import static com.gateway.cli.ui.AnsiJson.ANSI_CYAN;
import static com.gateway.cli.ui.AnsiJson.ANSI_GREEN;
import static com.gateway.cli.ui.AnsiJson.ANSI_PURPLE;
import static com.gateway.cli.ui.AnsiJson.ANSI_RESET;
import static com.gateway.cli.ui.AnsiJson.ANSI_YELLOW;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gateway.cli.ui.AnsiJson;
import com.gateway.cli.ui.Spinner;
import com.gateway.dto.request.CallRequest;
import com.gateway.dto.response.CallResult;
import com.gateway.dto.response.CommandResponse;
import com.gateway.protocol.InboundMessage;
import com.gateway.service.api.Gateway;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for calling endpoints, either by id or by a concrete address, and
 * for reading the messages of pub/sub subscriptions.
 * <p>
 * Parameters are given as {@code name=value} pairs and placed by the gateway according to
 * the endpoint's declaration. Results are pretty-printed in color.
 */
@ShellComponent
public class CallCommand {

    private final Gateway gateway;
    private final Spinner spinner;
    private final ObjectMapper jsonMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public CallCommand(Gateway gateway, Spinner spinner) {
        this.gateway = gateway;
        this.spinner = spinner;
    }

    /**
     * Calls an endpoint by its id.
     *
     * @param endpointId The endpoint to call.
     * @param params     Parameter values as {@code name=value} pairs.
     * @param headers    Extra headers as {@code name=value} pairs.
     * @param body       The request body or message payload, JSON or plain text.
     * @param user       The user whose OAuth2 authorization should be used.
     * @param verbose    If true, enables debug logging for the duration of the call.
     */
    @ShellMethod(key = "call", value = "Calls an endpoint by id.")
    public void call(
            @ShellOption(value = {"--endpoint", "-e"}, help = "The endpoint id.") String endpointId,
            @ShellOption(value = {"--params", "-p"}, arity = Integer.MAX_VALUE, help = "Parameters as name=value.", defaultValue = ShellOption.NULL) String[] params,
            @ShellOption(value = {"--headers", "-H"}, arity = Integer.MAX_VALUE, help = "Headers as name=value.", defaultValue = ShellOption.NULL) String[] headers,
            @ShellOption(value = {"--body", "-b"}, help = "The body, JSON or text.", defaultValue = ShellOption.NULL) String body,
            @ShellOption(value = {"--user", "-u"}, help = "The user id for OAuth2.", defaultValue = ShellOption.NULL) String user,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        withLogging(verbose, () -> {
            CallRequest request = toRequest(params, headers, body, user);
            CallResult result = spinner.spin("Calling...", () -> gateway.callEndpoint(endpointId, request));
            print(result);
            return null;
        });
    }

    /**
     * Calls the endpoint of a document matching a concrete address such as {@code /pets/42}.
     */
    @ShellMethod(key = "call-address", value = "Calls the endpoint matching a concrete address.")
    public void callAddress(
            @ShellOption(value = {"--document", "-d"}, help = "The document id.") String documentId,
            @ShellOption(value = {"--method", "-m"}, help = "The HTTP verb, or publish/subscribe.") String method,
            @ShellOption(value = {"--address", "-a"}, help = "The concrete path or channel.") String address,
            @ShellOption(value = {"--params", "-p"}, arity = Integer.MAX_VALUE, help = "Parameters as name=value.", defaultValue = ShellOption.NULL) String[] params,
            @ShellOption(value = {"--headers", "-H"}, arity = Integer.MAX_VALUE, help = "Headers as name=value.", defaultValue = ShellOption.NULL) String[] headers,
            @ShellOption(value = {"--body", "-b"}, help = "The body, JSON or text.", defaultValue = ShellOption.NULL) String body,
            @ShellOption(value = {"--user", "-u"}, help = "The user id for OAuth2.", defaultValue = ShellOption.NULL) String user,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        withLogging(verbose, () -> {
            CallRequest request = toRequest(params, headers, body, user);
            CallResult result = spinner.spin("Calling...", () -> gateway.callByAddress(address, method, documentId, request));
            print(result);
            return null;
        });
    }

    @ShellMethod(key = "messages", value = "Prints and removes the buffered messages of a subscription.")
    public void messages(
            @ShellOption(value = {"--subscription", "-s"}, help = "The subscription id returned by a subscribe call.") String subscriptionId,
            @ShellOption(value = {"--max", "-n"}, help = "The maximum number of messages.", defaultValue = "20") int max
    ) {
        try {
            List<InboundMessage> messages = gateway.drainMessages(subscriptionId, max);
            if (messages.isEmpty()) {
                System.out.println(ANSI_YELLOW + "No messages waiting." + ANSI_RESET);
                return;
            }
            for (InboundMessage message : messages) {
                System.out.println(ANSI_CYAN + message.receivedAt() + " " + message.channel() + ANSI_RESET);
                System.out.println(AnsiJson.format(jsonMapper.valueToTree(message.payload())));
            }
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString());
        }
    }

    @ShellMethod(key = "unsubscribe", value = "Cancels a subscription.")
    public String unsubscribe(@ShellOption(value = {"--subscription", "-s"}, help = "The subscription id.") String subscriptionId) {
        CommandResponse response;
        try {
            gateway.cancelSubscription(subscriptionId);
            response = new CommandResponse(true, "Cancelled subscription " + subscriptionId + ".");
        } catch (Exception e) {
            response = new CommandResponse(false, "Failed to cancel subscription: " + e.getMessage());
        }
        return response.toAnsiString();
    }

    private CallRequest toRequest(String[] params, String[] headers, String body, String user) {
        Map<String, Object> values = new LinkedHashMap<>(KeyValueOptions.parse(params));
        return new CallRequest(values, KeyValueOptions.parse(headers), parseBody(body), user);
    }

    private Object parseBody(String body) {
        if (body == null) {
            return null;
        }
        try {
            return jsonMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private void print(CallResult result) {
        if (!result.success()) {
            System.out.println(new CommandResponse(false, "[" + result.errorKind() + "] " + result.error()).toAnsiString());
            return;
        }
        String outcome = result.status() != null ? "HTTP " + result.status() : "Acknowledged";
        System.out.println(ANSI_GREEN + outcome + ANSI_RESET + " in " + result.latencyMs() + " ms " + ANSI_PURPLE + "(call " + result.callId() + ")" + ANSI_RESET);
        if (result.body() instanceof String text) {
            System.out.println(text);
        } else if (result.body() != null) {
            System.out.println("\n" + AnsiJson.format(jsonMapper.valueToTree(result.body())));
        }
    }

    /**
     * Runs the action, switching the root logger to DEBUG around it when asked to.
     */
    private void withLogging(boolean verbose, Supplier<Void> action) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }
        try {
            action.get();
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }
}

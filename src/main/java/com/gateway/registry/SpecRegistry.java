package com.gateway.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateway.exception.UnsupportedFamilyException;
import com.gateway.exception.UnsupportedProtocolException;
import com.gateway.protocol.ProtocolAdapter;
import com.gateway.spec.SpecExecutor;
import com.gateway.spec.SpecModelFactory;
import com.gateway.spec.SpecParser;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

/**
 * The plug-in points of the gateway: which specification families it understands and which
 * protocols it can talk.
 * <p>
 * A family is usable once it has a model factory, a parser and an executor. Protocol adapters
 * are registered as factories and created lazily, at most once per protocol; registering a
 * protocol again replaces the factory and closes the adapter it had produced.
 */
@Slf4j
public class SpecRegistry implements DisposableBean {

    private final Set<String> families = ConcurrentHashMap.newKeySet();
    private final Map<String, SpecModelFactory> modelFactories = new ConcurrentHashMap<>();
    private final Map<String, SpecParser> parsers = new ConcurrentHashMap<>();
    private final Map<String, SpecExecutor> executors = new ConcurrentHashMap<>();
    private final Map<String, Supplier<? extends ProtocolAdapter>> protocolFactories = new ConcurrentHashMap<>();
    private final Map<String, ProtocolAdapter> adapters = new ConcurrentHashMap<>();

    public void registerSpecFamily(String family) {
        families.add(family);
    }

    public void registerModelFactory(String family, SpecModelFactory factory) {
        families.add(family);
        modelFactories.put(family, factory);
    }

    public void registerParser(String family, SpecParser parser) {
        families.add(family);
        parsers.put(family, parser);
    }

    public void registerExecutor(String family, SpecExecutor executor) {
        families.add(family);
        executors.put(family, executor);
    }

    public void registerProtocol(String protocol, Supplier<? extends ProtocolAdapter> factory) {
        protocolFactories.put(protocol, factory);
        ProtocolAdapter previous = adapters.remove(protocol);
        if (previous != null) {
            closeQuietly(previous);
        }
        log.debug("Registered protocol '{}'", protocol);
    }

    /**
     * Removes a family and every component registered for it.
     */
    public void unregisterSpecFamily(String family) {
        families.remove(family);
        modelFactories.remove(family);
        parsers.remove(family);
        executors.remove(family);
    }

    public SpecModelFactory modelFactory(String family) {
        return require(modelFactories, family, "model factory");
    }

    public SpecParser parser(String family) {
        return require(parsers, family, "parser");
    }

    public SpecExecutor executor(String family) {
        return require(executors, family, "executor");
    }

    /**
     * Returns the adapter for the protocol, creating it on first use.
     *
     * @throws UnsupportedProtocolException if no factory is registered under that name.
     */
    public ProtocolAdapter adapter(String protocol) {
        Supplier<? extends ProtocolAdapter> factory = protocolFactories.get(protocol);
        if (factory == null) {
            throw new UnsupportedProtocolException("No adapter registered for protocol '" + protocol + "'");
        }
        return adapters.computeIfAbsent(protocol, name -> {
            log.info("Creating {} protocol adapter", name);
            return factory.get();
        });
    }

    public boolean hasProtocol(String protocol) {
        return protocolFactories.containsKey(protocol);
    }

    /**
     * Finds the first registered family whose parser recognizes the document. Families are
     * tried in name order so detection does not depend on registration order.
     */
    public Optional<String> detectFamily(JsonNode rawDocument) {
        return new TreeSet<>(parsers.keySet()).stream()
                .filter(family -> parsers.get(family).canParse(rawDocument))
                .findFirst();
    }

    public RegistrationStatus validateCompleteness(String family) {
        return new RegistrationStatus(
                modelFactories.containsKey(family),
                parsers.containsKey(family),
                executors.containsKey(family));
    }

    public Set<String> families() {
        return new TreeSet<>(families);
    }

    public Set<String> protocols() {
        return new TreeSet<>(protocolFactories.keySet());
    }

    @Override
    public void destroy() {
        adapters.values().forEach(this::closeQuietly);
        adapters.clear();
    }

    private void closeQuietly(ProtocolAdapter adapter) {
        try {
            adapter.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close {} adapter: {}", adapter.protocol(), e.getMessage());
        }
    }

    private <T> T require(Map<String, T> components, String family, String role) {
        T component = components.get(family);
        if (component == null) {
            throw new UnsupportedFamilyException("No " + role + " registered for specification family '" + family + "'");
        }
        return component;
    }

    /**
     * Which of the three components a family needs are present.
     */
    public record RegistrationStatus(boolean hasModelFactory, boolean hasParser, boolean hasExecutor) {

        public boolean complete() {
            return hasModelFactory && hasParser && hasExecutor;
        }
    }
}

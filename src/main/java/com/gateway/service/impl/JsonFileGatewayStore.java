package com.gateway.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gateway.config.GatewayProperties;
import com.gateway.exception.ErrorKind;
import com.gateway.exception.GatewayException;
import com.gateway.model.ApiDocument;
import com.gateway.model.AuthConfig;
import com.gateway.model.CallLog;
import com.gateway.model.Endpoint;
import com.gateway.model.OAuth2AuthState;
import com.gateway.model.Specification;
import com.gateway.model.UserAuthorization;
import com.gateway.service.api.GatewayStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of the {@link GatewayStore} that keeps the gateway's state in
 * concurrent in-memory maps and mirrors it to a JSON file.
 * <p>
 * Secret material (authentication configuration values, PKCE verifiers and OAuth2 tokens) is
 * encrypted with a {@link StringEncryptor} before it is written to the file and decrypted when
 * the file is loaded. When {@code gateway.state-file} is blank nothing is written and the
 * store lives in memory only. The call log is never written to disk; it is capped at
 * {@code gateway.call-log-capacity} entries.
 */
@Service
@Slf4j
public class JsonFileGatewayStore implements GatewayStore {

    private final File stateFile;
    private final int callLogCapacity;
    private final StringEncryptor encryptor;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Map<String, Specification> specifications = new ConcurrentHashMap<>();
    private Map<String, ApiDocument> documents = new ConcurrentHashMap<>();
    private Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();
    private Map<String, AuthConfig> authConfigs = new ConcurrentHashMap<>();
    private Map<String, OAuth2AuthState> authStates = new ConcurrentHashMap<>();
    private Map<String, UserAuthorization> userAuthorizations = new ConcurrentHashMap<>();
    private final Deque<CallLog> callLog = new ArrayDeque<>();

    /**
     * Constructs the store with a Jasypt {@link StringEncryptor}, which is provided by the
     * Jasypt Spring Boot starter and configured through {@code jasypt.encryptor.password}.
     *
     * @param properties The gateway settings naming the state file and call log capacity.
     * @param encryptor  The encryptor used for every secret written to the state file.
     */
    public JsonFileGatewayStore(GatewayProperties properties, StringEncryptor encryptor) {
        this.stateFile = properties.getStateFile() == null || properties.getStateFile().isBlank()
                ? null
                : new File(properties.getStateFile());
        this.callLogCapacity = properties.getCallLogCapacity();
        this.encryptor = encryptor;
    }

    /**
     * Loads the persisted state, if any, once the bean has been constructed.
     */
    @PostConstruct
    public void init() {
        loadState();
    }

    /**
     * Writes the final state on shutdown so endpoint statistics survive a restart.
     */
    @PreDestroy
    public void shutdown() {
        if (stateFile != null) {
            saveState();
        }
    }

    @Override
    public synchronized void saveRegistration(Specification specification, ApiDocument document, List<Endpoint> newEndpoints) {
        specifications.put(specification.getSpecId(), specification);
        documents.put(document.getId(), document);
        newEndpoints.forEach(endpoint -> endpoints.put(endpoint.getId(), endpoint));
        try {
            saveState();
        } catch (GatewayException e) {
            specifications.remove(specification.getSpecId());
            documents.remove(document.getId());
            newEndpoints.forEach(endpoint -> endpoints.remove(endpoint.getId()));
            throw e;
        }
        log.info("Stored document '{}' ({}) with {} endpoints", document.getName(), document.getId(), newEndpoints.size());
    }

    @Override
    public Optional<Specification> findSpecification(String specId) {
        return Optional.ofNullable(specifications.get(specId));
    }

    @Override
    public Optional<ApiDocument> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public List<ApiDocument> listDocuments() {
        return documents.values().stream()
                .sorted(Comparator.comparing(ApiDocument::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public synchronized boolean deleteDocument(String documentId) {
        ApiDocument document = documents.remove(documentId);
        if (document == null) {
            return false;
        }
        specifications.remove(document.getSpecId());
        endpoints.values().removeIf(endpoint -> documentId.equals(endpoint.getApiDocumentId()));
        authConfigs.values().removeIf(config -> documentId.equals(config.getApiDocumentId()));
        authStates.values().removeIf(state -> documentId.equals(state.getApiDocumentId()));
        userAuthorizations.values().removeIf(authorization -> documentId.equals(authorization.getApiDocumentId()));
        saveState();
        log.info("Deleted document '{}' ({})", document.getName(), documentId);
        return true;
    }

    @Override
    public Optional<Endpoint> findEndpoint(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }

    @Override
    public List<Endpoint> listEndpoints(String documentId) {
        return endpoints.values().stream()
                .filter(endpoint -> documentId == null || documentId.equals(endpoint.getApiDocumentId()))
                .sorted(Comparator.comparing(Endpoint::getAddressPattern).thenComparing(Endpoint::getOperationKind))
                .toList();
    }

    /**
     * {@inheritDoc}
     * <p>
     * The statistics are computed on a copy of the endpoint that replaces the stored one
     * inside {@link ConcurrentHashMap#computeIfPresent}, so concurrent calls to the same
     * endpoint never lose an update and readers never see a half-updated endpoint.
     */
    @Override
    public Optional<Endpoint> recordCall(CallLog entry) {
        synchronized (callLog) {
            callLog.addFirst(entry);
            while (callLog.size() > callLogCapacity) {
                callLog.removeLast();
            }
        }
        if (entry.getEndpointId() == null) {
            return Optional.empty();
        }
        boolean succeeded = entry.isSuccess()
                && (entry.getStatus() == null || (entry.getStatus() >= 200 && entry.getStatus() < 300));
        return Optional.ofNullable(endpoints.computeIfPresent(entry.getEndpointId(), (id, current) -> {
            Endpoint updated = objectMapper.convertValue(current, Endpoint.class);
            long calls = current.getCallCount() + 1;
            updated.setCallCount(calls);
            updated.setSuccessCount(current.getSuccessCount() + (succeeded ? 1 : 0));
            updated.setErrorCount(current.getErrorCount() + (succeeded ? 0 : 1));
            updated.setAverageLatencyMs(current.getAverageLatencyMs()
                    + (entry.getLatencyMs() - current.getAverageLatencyMs()) / calls);
            updated.setLastCalledAt(entry.getTimestamp());
            return updated;
        }));
    }

    @Override
    public List<CallLog> recentCalls(String endpointId, int limit) {
        List<CallLog> result = new ArrayList<>();
        synchronized (callLog) {
            Iterator<CallLog> entries = callLog.iterator();
            while (entries.hasNext() && result.size() < limit) {
                CallLog entry = entries.next();
                if (endpointId == null || endpointId.equals(entry.getEndpointId())) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    @Override
    public synchronized AuthConfig saveAuthConfig(AuthConfig config) {
        authConfigs.put(config.getId(), config);
        saveState();
        log.info("Saved {} auth config {} for {}", config.getScheme(), config.getId(),
                config.isGlobal() ? "every document" : "document " + config.getApiDocumentId());
        return config;
    }

    @Override
    public Optional<AuthConfig> findAuthConfig(String authConfigId) {
        return Optional.ofNullable(authConfigs.get(authConfigId));
    }

    @Override
    public List<AuthConfig> listAuthConfigs(String documentId) {
        return authConfigs.values().stream()
                .filter(config -> !config.isGlobal() && Objects.equals(documentId, config.getApiDocumentId()))
                .toList();
    }

    @Override
    public List<AuthConfig> listGlobalAuthConfigs() {
        return authConfigs.values().stream().filter(AuthConfig::isGlobal).toList();
    }

    @Override
    public synchronized void saveAuthState(OAuth2AuthState state) {
        authStates.put(state.getId(), state);
        saveState();
    }

    @Override
    public Optional<OAuth2AuthState> findAuthState(String stateId) {
        return Optional.ofNullable(authStates.get(stateId));
    }

    @Override
    public synchronized boolean consumeAuthState(String stateId) {
        OAuth2AuthState state = authStates.get(stateId);
        if (state == null || state.isConsumed()) {
            return false;
        }
        state.setConsumed(true);
        saveState();
        return true;
    }

    @Override
    public List<OAuth2AuthState> listAuthStates(String userId, String documentId) {
        return authStates.values().stream()
                .filter(state -> Objects.equals(userId, state.getUserId()) && Objects.equals(documentId, state.getApiDocumentId()))
                .toList();
    }

    @Override
    public synchronized void saveUserAuthorization(UserAuthorization authorization) {
        userAuthorizations.put(authorizationKey(authorization.getUserId(), authorization.getApiDocumentId()), authorization);
        saveState();
    }

    @Override
    public Optional<UserAuthorization> findUserAuthorization(String userId, String documentId) {
        return Optional.ofNullable(userAuthorizations.get(authorizationKey(userId, documentId)));
    }

    @Override
    public synchronized boolean deleteUserAuthorization(String userId, String documentId) {
        boolean removed = userAuthorizations.remove(authorizationKey(userId, documentId)) != null;
        if (removed) {
            saveState();
        }
        return removed;
    }

    private static String authorizationKey(String userId, String documentId) {
        return userId + ":" + documentId;
    }

    /**
     * Saves the current in-memory state to the JSON file on disk, secrets encrypted. This
     * method is synchronized to prevent concurrent write operations. The file is written to a
     * temporary sibling first and then moved into place.
     *
     * @throws GatewayException if an I/O error occurs during directory creation or writing.
     */
    private synchronized void saveState() {
        if (stateFile == null) {
            return;
        }
        try {
            File parentDir = stateFile.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }

            Map<String, Object> state = new LinkedHashMap<>();
            state.put("specifications", specifications);
            state.put("documents", documents);
            state.put("endpoints", endpoints);
            state.put("authConfigs", transformSecrets(authConfigs, AuthConfig.class, this::encryptConfig));
            state.put("authStates", transformSecrets(authStates, OAuth2AuthState.class, this::encryptState));
            state.put("userAuthorizations", transformSecrets(userAuthorizations, UserAuthorization.class, this::encryptTokens));

            File tempFile = new File(parentDir, stateFile.getName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile, state);
            Files.move(tempFile.toPath(), stateFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save gateway state to {}", stateFile, e);
            throw new GatewayException(ErrorKind.INTERNAL, "Failed to save gateway state", e);
        }
    }

    /**
     * Loads the state from the JSON file into the in-memory maps. If the file does not exist,
     * the gateway starts with a fresh state. If the file is corrupted or cannot be parsed, it is
     * backed up, and the gateway starts fresh to prevent a crash loop.
     */
    private synchronized void loadState() {
        if (stateFile == null) {
            log.info("No state file configured, keeping gateway state in memory only.");
            return;
        }
        if (!stateFile.exists() || stateFile.length() == 0) {
            log.info("No state file found at {}, starting with a clean state.", stateFile);
            return;
        }
        try {
            Map<String, Object> state = objectMapper.readValue(stateFile, new TypeReference<HashMap<String, Object>>() {});
            specifications = read(state.get("specifications"), new TypeReference<ConcurrentHashMap<String, Specification>>() {});
            documents = read(state.get("documents"), new TypeReference<ConcurrentHashMap<String, ApiDocument>>() {});
            endpoints = read(state.get("endpoints"), new TypeReference<ConcurrentHashMap<String, Endpoint>>() {});
            ConcurrentHashMap<String, AuthConfig> storedConfigs = read(state.get("authConfigs"), new TypeReference<ConcurrentHashMap<String, AuthConfig>>() {});
            ConcurrentHashMap<String, OAuth2AuthState> storedStates = read(state.get("authStates"), new TypeReference<ConcurrentHashMap<String, OAuth2AuthState>>() {});
            ConcurrentHashMap<String, UserAuthorization> storedAuthorizations = read(state.get("userAuthorizations"), new TypeReference<ConcurrentHashMap<String, UserAuthorization>>() {});
            storedConfigs.replaceAll((id, config) -> decryptConfig(config));
            storedStates.replaceAll((id, authState) -> decryptState(authState));
            storedAuthorizations.replaceAll((key, authorization) -> decryptTokens(authorization));
            authConfigs = storedConfigs;
            authStates = storedStates;
            userAuthorizations = storedAuthorizations;
            log.info("Successfully loaded state from {}: {} documents, {} endpoints", stateFile, documents.size(), endpoints.size());
        } catch (Exception e) {
            log.warn("Could not load or parse state file at {}. A backup will be created, and the gateway will start with a fresh state. Error: {}", stateFile, e.getMessage());
            backupCorruptedStateFile();
            specifications = new ConcurrentHashMap<>();
            documents = new ConcurrentHashMap<>();
            endpoints = new ConcurrentHashMap<>();
            authConfigs = new ConcurrentHashMap<>();
            authStates = new ConcurrentHashMap<>();
            userAuthorizations = new ConcurrentHashMap<>();
        }
    }

    private <T> ConcurrentHashMap<String, T> read(Object section, TypeReference<ConcurrentHashMap<String, T>> type) {
        if (section == null) {
            return new ConcurrentHashMap<>();
        }
        return objectMapper.convertValue(section, type);
    }

    /**
     * Backs up a state file that cannot be parsed by renaming it with a ".corrupted" suffix and
     * a timestamp, preserving the data for manual inspection.
     */
    private void backupCorruptedStateFile() {
        File backupFile = new File(stateFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(stateFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted state file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted state file from {} to {}", stateFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }

    private <T> Map<String, T> transformSecrets(Map<String, T> source, Class<T> type, UnaryOperator<T> transform) {
        Map<String, T> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(key, transform.apply(objectMapper.convertValue(value, type))));
        return result;
    }

    private AuthConfig encryptConfig(AuthConfig config) {
        config.getConfig().replaceAll((name, value) -> encrypt(value));
        return config;
    }

    private AuthConfig decryptConfig(AuthConfig config) {
        config.getConfig().replaceAll((name, value) -> decrypt(value, "auth config " + config.getId()));
        return config;
    }

    private OAuth2AuthState encryptState(OAuth2AuthState state) {
        state.setCodeVerifier(encrypt(state.getCodeVerifier()));
        return state;
    }

    private OAuth2AuthState decryptState(OAuth2AuthState state) {
        state.setCodeVerifier(decrypt(state.getCodeVerifier(), "authorization state " + state.getId()));
        return state;
    }

    private UserAuthorization encryptTokens(UserAuthorization authorization) {
        authorization.setAccessToken(encrypt(authorization.getAccessToken()));
        authorization.setRefreshToken(encrypt(authorization.getRefreshToken()));
        return authorization;
    }

    private UserAuthorization decryptTokens(UserAuthorization authorization) {
        String owner = "authorization of user '" + authorization.getUserId() + "'";
        authorization.setAccessToken(decrypt(authorization.getAccessToken(), owner));
        authorization.setRefreshToken(decrypt(authorization.getRefreshToken(), owner));
        return authorization;
    }

    private String encrypt(String value) {
        return value == null ? null : encryptor.encrypt(value);
    }

    /**
     * Decrypts a stored secret. If decryption fails, which happens when the secret key changed,
     * an error is logged and {@code null} is returned.
     */
    private String decrypt(String value, String owner) {
        if (value == null) {
            return null;
        }
        try {
            return encryptor.decrypt(value);
        } catch (Exception e) {
            log.error("Could not decrypt a secret of {}. The secret key may have changed or is incorrect.", owner);
            return null;
        }
    }
}

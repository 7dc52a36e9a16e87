package com.example.vaultagent.core.aws;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultagent.core.ConfigurationException;
import com.example.vaultagent.core.secrets.DatabaseLease;
import com.example.vaultagent.core.secrets.SecretStore;
import com.example.vaultagent.core.secrets.SecretStoreException;
import com.example.vaultagent.core.secrets.SecretStoreException.Reason;
import com.example.vaultagent.core.secrets.SecretValue;
import com.example.vaultagent.core.secrets.Session;
import com.example.vaultagent.core.secrets.StaticCredential;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.Filter;
import software.amazon.awssdk.services.secretsmanager.model.FilterNameStringType;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * {@link SecretStore} backed by AWS Secrets Manager.
 *
 * <p>Mapping onto the store contract:
 *
 * <ul>
 *   <li>{@code login(roleId, secretId)} takes an access key id and secret access key. The pair is
 *       checked with a cheap {@code ListSecrets} call and the session is kept under an opaque token
 *       that expires after the session duration. Sessions for the same key pair share one client,
 *       which is closed once no live session uses it.
 *   <li>{@code read} fetches a secret by name and optional version id. JSON objects become the
 *       secret fields; any other payload is exposed as the single field {@code value}.
 *   <li>{@code issueCredential} and {@code staticCredential} read an RDS-style database secret
 *       named after the role. The lease is the rotation period when rotation is enabled.
 * </ul>
 *
 * <p>Configuration can be supplied via system properties or environment variables with {@link
 * Builder#fromEnvironment()}:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 * </ul>
 */
public final class AwsSecretsManagerStore implements SecretStore, AutoCloseable {

  private static final System.Logger logger =
      System.getLogger(AwsSecretsManagerStore.class.getName());

  private static final Set<String> UNAUTHORIZED_CODES =
      Set.of(
          "AccessDeniedException",
          "UnrecognizedClientException",
          "InvalidSignatureException",
          "ExpiredTokenException",
          "IncompleteSignature",
          "DecryptionFailure");

  private static final Set<String> NOT_FOUND_CODES =
      Set.of("InvalidRequestException", "InvalidParameterException");

  private static final TypeReference<LinkedHashMap<String, Object>> FIELDS =
      new TypeReference<>() {};

  private final Function<AwsCredentialsProvider, SecretsManagerClient> clientFactory;
  private final Duration sessionDuration;
  private final Duration credentialLease;
  private final Clock clock;
  private final ObjectMapper mapper;
  private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();
  private final Map<KeyPair, SecretsManagerClient> clients = new HashMap<>();

  private AwsSecretsManagerStore(final Builder builder) {
    this.clientFactory = builder.clientFactory;
    this.sessionDuration = builder.sessionDuration;
    this.credentialLease = builder.credentialLease;
    this.clock = builder.clock;
    this.mapper = builder.mapper;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Session login(final String roleId, final String secretId) {
    purgeExpiredSessions();
    final var keys = new KeyPair(roleId, secretId);
    final var token = UUID.randomUUID().toString();
    final ClientSession session;
    // Registered before the check so a concurrent purge keeps the shared client open.
    synchronized (clients) {
      final var client = clients.computeIfAbsent(keys, this::newClient);
      session = new ClientSession(client, clock.instant().plus(sessionDuration));
      sessions.put(token, session);
    }
    try {
      session.client().listSecrets(ListSecretsRequest.builder().maxResults(1).build());
    } catch (final RuntimeException e) {
      sessions.remove(token, session);
      releaseIdleClients();
      throw translate("login", e);
    }
    logger.log(INFO, "Opened Secrets Manager session valid for {0}", sessionDuration);
    return new Session(token, sessionDuration);
  }

  @Override
  public SecretValue read(final String token, final String path, final String version) {
    final var client = client(token);
    final var request = GetSecretValueRequest.builder().secretId(path).versionId(version).build();
    final var response = call("read " + path, () -> client.getSecretValue(request));
    return new SecretValue(fields(response.secretString()), response.versionId(), null);
  }

  @Override
  public List<String> list(final String token, final String path) {
    final var client = client(token);
    final var names = new ArrayList<String>();
    String next = null;
    do {
      final var request = ListSecretsRequest.builder().nextToken(next);
      if (path != null && !path.isBlank())
        request.filters(Filter.builder().key(FilterNameStringType.NAME).values(path).build());
      final var response = call("list " + path, () -> client.listSecrets(request.build()));
      response.secretList().forEach(entry -> names.add(entry.name()));
      next = response.nextToken();
    } while (next != null);
    return names;
  }

  @Override
  public DatabaseLease issueCredential(final String token, final String role) {
    final var client = client(token);
    final var response = fetch(client, role);
    final var secret = dbSecret(role, response);
    final var lease = rotationPeriod(describe(client, role)).orElse(credentialLease);
    return secret.toLease(response.versionId(), lease);
  }

  @Override
  public StaticCredential staticCredential(final String token, final String role) {
    final var client = client(token);
    final var secret = dbSecret(role, fetch(client, role));
    final var description = describe(client, role);
    return new StaticCredential(
        secret.username(),
        secret.password(),
        description.lastRotatedDate(),
        rotationPeriod(description).orElse(null));
  }

  /** Ends every open session and closes the shared clients. */
  @Override
  public void close() {
    synchronized (clients) {
      sessions.clear();
      clients.values().forEach(AwsSecretsManagerStore::closeQuietly);
      clients.clear();
    }
  }

  /**
   * Maps an AWS SDK failure onto a {@link SecretStoreException} reason.
   *
   * @param operation operation name for the message
   * @param e failure thrown by the SDK
   * @return the translated exception
   */
  static SecretStoreException translate(final String operation, final RuntimeException e) {
    if (e instanceof SecretStoreException sse) return sse;
    if (e instanceof ResourceNotFoundException)
      return new SecretStoreException(Reason.NOT_FOUND, operation + ": no such secret", e);
    if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException)
      return new SecretStoreException(Reason.TIMEOUT, operation + " timed out", e);
    if (e instanceof AwsServiceException ase) {
      final var code = ase.awsErrorDetails() != null ? ase.awsErrorDetails().errorCode() : null;
      if (ase.statusCode() == 401 || ase.statusCode() == 403 || UNAUTHORIZED_CODES.contains(code))
        return new SecretStoreException(Reason.UNAUTHORIZED, operation + " denied: " + code, e);
      if (NOT_FOUND_CODES.contains(code))
        return new SecretStoreException(Reason.NOT_FOUND, operation + " rejected: " + code, e);
      return new SecretStoreException(
          Reason.UNAVAILABLE, operation + " failed with status " + ase.statusCode(), e);
    }
    if (e instanceof SdkClientException)
      return new SecretStoreException(Reason.UNAVAILABLE, operation + " could not reach AWS", e);
    return new SecretStoreException(Reason.UNAVAILABLE, operation + " failed", e);
  }

  private SecretsManagerClient client(final String token) {
    final var session = token != null ? sessions.get(token) : null;
    if (session == null) throw new SecretStoreException(Reason.UNAUTHORIZED, "Unknown token");
    if (!clock.instant().isBefore(session.expiresAt())) {
      if (sessions.remove(token, session)) releaseIdleClients();
      throw new SecretStoreException(Reason.UNAUTHORIZED, "Session expired");
    }
    return session.client();
  }

  private GetSecretValueResponse fetch(final SecretsManagerClient client, final String role) {
    final var request = GetSecretValueRequest.builder().secretId(role).build();
    return call("read database secret " + role, () -> client.getSecretValue(request));
  }

  private DescribeSecretResponse describe(final SecretsManagerClient client, final String role) {
    final var request = DescribeSecretRequest.builder().secretId(role).build();
    return call("describe " + role, () -> client.describeSecret(request));
  }

  private Map<String, Object> fields(final String secretString) {
    if (secretString == null) return Map.of();
    try {
      final var node = mapper.readTree(secretString);
      if (!node.isObject()) return Map.of("value", secretString);
      final var fields = mapper.convertValue(node, FIELDS);
      fields.values().removeIf(Objects::isNull);
      return fields;
    } catch (final JsonProcessingException e) {
      logger.log(DEBUG, "Secret is not JSON, exposing it as a single value");
      return Map.of("value", secretString);
    }
  }

  private DbSecret dbSecret(final String role, final GetSecretValueResponse response) {
    try {
      final var secret = mapper.readValue(response.secretString(), DbSecret.class);
      if (!secret.hasLogin())
        throw new SecretStoreException(
            Reason.NOT_FOUND, "Secret " + role + " has no username/password");
      return secret;
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new SecretStoreException(
          Reason.NOT_FOUND, "Secret " + role + " is not a database secret", e);
    }
  }

  private static Optional<Duration> rotationPeriod(final DescribeSecretResponse description) {
    if (!Boolean.TRUE.equals(description.rotationEnabled())) return Optional.empty();
    return Optional.ofNullable(description.rotationRules())
        .map(rules -> rules.automaticallyAfterDays())
        .map(Duration::ofDays);
  }

  private static <T> T call(final String operation, final Supplier<T> sdkCall) {
    try {
      return sdkCall.get();
    } catch (final RuntimeException e) {
      throw translate(operation, e);
    }
  }

  private void purgeExpiredSessions() {
    final var now = clock.instant();
    if (sessions.values().removeIf(session -> !now.isBefore(session.expiresAt())))
      releaseIdleClients();
  }

  private SecretsManagerClient newClient(final KeyPair keys) {
    logger.log(DEBUG, "Creating Secrets Manager client for access key {0}", keys.accessKeyId());
    return clientFactory.apply(
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(keys.accessKeyId(), keys.secretAccessKey())));
  }

  private void releaseIdleClients() {
    synchronized (clients) {
      final var idle = clients.values().iterator();
      while (idle.hasNext()) {
        final var client = idle.next();
        if (sessions.values().stream().anyMatch(session -> session.client() == client)) continue;
        idle.remove();
        closeQuietly(client);
      }
    }
  }

  private static void closeQuietly(final SecretsManagerClient client) {
    try {
      client.close();
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to close Secrets Manager client", e);
    }
  }

  private record ClientSession(SecretsManagerClient client, Instant expiresAt) {}

  private record KeyPair(String accessKeyId, String secretAccessKey) {

    @Override
    public String toString() {
      return "KeyPair[" + accessKeyId + "]";
    }
  }

  /**
   * Builder for {@link AwsSecretsManagerStore}.
   *
   * <pre>{@code
   * var store = AwsSecretsManagerStore.builder()
   *     .fromEnvironment()
   *     .apiCallTimeout(Duration.ofSeconds(5))
   *     .build();
   * }</pre>
   */
  public static final class Builder {
    private Function<AwsCredentialsProvider, SecretsManagerClient> clientFactory;
    private Region region = Region.US_EAST_1;
    private URI endpoint;
    private Duration apiCallTimeout = Duration.ofSeconds(10);
    private Duration sessionDuration = Duration.ofHours(1);
    private Duration credentialLease = Duration.ofHours(1);
    private Clock clock = Clock.systemUTC();
    private ObjectMapper mapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Builder() {}

    /**
     * Reads region and endpoint override from system properties, falling back to environment
     * variables.
     *
     * @return this builder
     */
    public Builder fromEnvironment() {
      Optional.ofNullable(System.getProperty("aws.region"))
          .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
          .filter(val -> !val.isBlank())
          .map(Region::of)
          .ifPresent(this::region);
      Optional.ofNullable(System.getProperty("aws.sm.endpoint"))
          .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")))
          .filter(val -> !val.isBlank())
          .map(URI::create)
          .ifPresent(this::endpoint);
      return this;
    }

    public Builder region(final Region region) {
      this.region = region;
      return this;
    }

    public Builder endpoint(final URI endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Bounds every SDK call, retries included. Default: 10 seconds.
     *
     * @param apiCallTimeout positive timeout
     * @return this builder
     */
    public Builder apiCallTimeout(final Duration apiCallTimeout) {
      this.apiCallTimeout = apiCallTimeout;
      return this;
    }

    /**
     * Lifetime of a login token. Default: 1 hour.
     *
     * @param sessionDuration positive duration
     * @return this builder
     */
    public Builder sessionDuration(final Duration sessionDuration) {
      this.sessionDuration = sessionDuration;
      return this;
    }

    /**
     * Lease of database credentials whose secret has no rotation schedule. Default: 1 hour.
     *
     * @param credentialLease positive duration
     * @return this builder
     */
    public Builder credentialLease(final Duration credentialLease) {
      this.credentialLease = credentialLease;
      return this;
    }

    /**
     * Replaces client construction, e.g. with a mock in tests. Region, endpoint and timeout are
     * then ignored.
     *
     * @param clientFactory creates a client for the given credentials
     * @return this builder
     */
    public Builder clientFactory(
        final Function<AwsCredentialsProvider, SecretsManagerClient> clientFactory) {
      this.clientFactory = clientFactory;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder objectMapper(final ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * Builds the store.
     *
     * @return configured store
     * @throws ConfigurationException if a duration is not positive
     * @throws IllegalStateException if region, clock or object mapper is missing
     */
    public AwsSecretsManagerStore build() {
      requirePositive("apiCallTimeout", apiCallTimeout);
      requirePositive("sessionDuration", sessionDuration);
      requirePositive("credentialLease", credentialLease);
      if (clock == null) throw new IllegalStateException("clock is required");
      if (mapper == null) throw new IllegalStateException("objectMapper is required");
      if (clientFactory == null) {
        if (region == null) throw new IllegalStateException("region is required");
        clientFactory = defaultClientFactory(region, endpoint, apiCallTimeout);
      }
      return new AwsSecretsManagerStore(this);
    }

    private static Function<AwsCredentialsProvider, SecretsManagerClient> defaultClientFactory(
        final Region region, final URI endpoint, final Duration apiCallTimeout) {
      final var overrides = ClientOverrideConfiguration.builder().apiCallTimeout(apiCallTimeout);
      return credentials -> {
        final var builder =
            SecretsManagerClient.builder()
                .region(region)
                .credentialsProvider(credentials)
                .overrideConfiguration(overrides.build());
        if (endpoint != null) builder.endpointOverride(endpoint);
        return builder.build();
      };
    }

    private static void requirePositive(final String name, final Duration value) {
      if (value == null || value.isZero() || value.isNegative())
        throw new ConfigurationException(name + " must be positive, was " + value);
    }
  }
}

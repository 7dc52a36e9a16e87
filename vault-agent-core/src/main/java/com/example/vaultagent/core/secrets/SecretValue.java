package com.example.vaultagent.core.secrets;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value secret payload.
 *
 * <p>The payload can be projected onto a typed record with {@link #as(Class)}:
 *
 * <pre>{@code
 * record ApiKeys(String publicKey, String privateKey) {}
 * var keys = client.read("payments/api").as(ApiKeys.class);
 * }</pre>
 *
 * @param data secret fields
 * @param version store version of the secret, or null if the store is not versioned
 * @param leaseDuration lease reported by the store, or null when the value carries none
 */
public record SecretValue(Map<String, Object> data, String version, Duration leaseDuration) {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public SecretValue {
    data = Map.copyOf(data);
  }

  public static SecretValue of(final Map<String, Object> data) {
    return new SecretValue(data, null, null);
  }

  /**
   * @param field field name
   * @return the field rendered as a string, or empty if absent
   */
  public Optional<String> get(final String field) {
    return Optional.ofNullable(data.get(field)).map(String::valueOf);
  }

  public Optional<Duration> lease() {
    return Optional.ofNullable(leaseDuration);
  }

  /**
   * Converts the payload into {@code type} with Jackson. Unknown fields are ignored.
   *
   * @param type target type
   * @param <T> target type
   * @return converted payload
   * @throws IllegalArgumentException if the payload does not fit the type
   */
  public <T> T as(final Class<T> type) {
    return MAPPER.convertValue(data, type);
  }

  @Override
  public String toString() {
    return "SecretValue[fields=" + data.keySet() + ", version=" + version + "]";
  }
}

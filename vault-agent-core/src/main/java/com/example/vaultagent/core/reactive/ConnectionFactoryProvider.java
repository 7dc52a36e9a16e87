package com.example.vaultagent.core.reactive;

import com.example.vaultagent.core.secrets.Credential;
import io.r2dbc.spi.ConnectionFactory;

/**
 * Factory that creates a {@link ConnectionFactory} from a {@link Credential}. Implementations
 * typically configure a reactive connection pool with the credential's user and password.
 */
@FunctionalInterface
public interface ConnectionFactoryProvider {
  /**
   * Creates a new {@link ConnectionFactory} configured for the provided credential.
   *
   * @param credential the database credential
   * @return a new {@link ConnectionFactory}
   */
  ConnectionFactory create(final Credential credential);
}

/**
 * Root package for the vault-agent client library.
 *
 * <p>{@link com.example.vaultagent.core.VaultAgentClient VaultAgentClient} wires a secret store
 * login into cached secret reads and into connection pools whose database credentials are renewed
 * before their lease runs out.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.vaultagent.core.cache.TtlCache} – bounded cache with per-entry expiry,
 *       LRU eviction and hit/miss counters.
 *   <li>{@link com.example.vaultagent.core.auth.AuthSession} – login token holder; concurrent
 *       callers share a single in-flight login.
 *   <li>{@link com.example.vaultagent.core.secrets.SecretStore} – store contract: login, key/value
 *       reads, listing and database credential issuance.
 *   <li>{@link com.example.vaultagent.core.secrets.CredentialBroker} – cached reads and credential
 *       issuance on behalf of an {@code AuthSession}.
 *   <li>{@link com.example.vaultagent.core.secrets.TimeBoundedSecretStore} – puts a deadline on
 *       every call to a delegate store.
 *   <li>{@link com.example.vaultagent.core.pool.PoolCoordinator} – swaps validated pools per role
 *       and drains the retired ones.
 *   <li>{@link com.example.vaultagent.core.pool.RefreshScheduler} – renews a role's credential
 *       once a share of its lease has elapsed.
 *   <li>{@link com.example.vaultagent.core.jdbc.RotatingDataSource} – {@code DataSource} view of a
 *       rotating pool; {@link com.example.vaultagent.core.jdbc.DbClient} retries once on auth
 *       failures.
 *   <li>{@link com.example.vaultagent.core.reactive.RotatingConnectionFactory} – R2DBC
 *       counterpart, with {@link com.example.vaultagent.core.reactive.R2dbcRetry} error detection.
 *   <li>{@link com.example.vaultagent.core.aws.AwsSecretsManagerStore} – {@code SecretStore} backed
 *       by AWS Secrets Manager.
 * </ul>
 */
package com.example.vaultagent.core;

/**
 * Public API for zkvault.
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.zkvault.api.config.VaultConfig} - SDK configuration</li>
 *   <li>{@link io.github.hongjungwan.zkvault.api.domain.SecretVersion} - One entry of a secret's history</li>
 *   <li>{@link io.github.hongjungwan.zkvault.api.domain.ServiceToken} - Token record holding a wrapped project key</li>
 *   <li>{@link io.github.hongjungwan.zkvault.api.exception.VaultException} - Root of the error hierarchy</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * VaultClient client = new VaultClient(
 *         VaultConfig.clientConfig("billing", "production", tokenId, token),
 *         secretStore);
 *
 * String dbPassword = client.get("DB_PASSWORD").orElseThrow();
 * }</pre>
 */
package io.github.hongjungwan.zkvault.api;

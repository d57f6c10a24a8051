/**
 * Service Provider Interfaces (SPI) for zkvault.
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.zkvault.spi.SecretStore} - Untrusted hash-oriented backing store</li>
 *   <li>{@link io.github.hongjungwan.zkvault.spi.AuditIdentityProvider} - Author identity for version audit trail</li>
 * </ul>
 *
 * <p>The Spring Boot starter registers a Redis-backed store and a Spring Security aware identity provider.</p>
 */
package io.github.hongjungwan.zkvault.spi;

/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters. The core and application layers depend
 * only on these contracts.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.spi.EventStore} - append-only event log</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.SagaStateStore} - durable saga state with leases</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.EventQueryStore} /
 *       {@link com.ryuqq.provisioning.core.spi.ProjectionStore} - read models</li>
 *   <li>{@link com.ryuqq.provisioning.core.spi.DnsProvider},
 *       {@link com.ryuqq.provisioning.core.spi.DnsResolver},
 *       {@link com.ryuqq.provisioning.core.spi.EmailSender} - external capabilities</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.spi;

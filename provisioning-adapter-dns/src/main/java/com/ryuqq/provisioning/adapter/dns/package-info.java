/**
 * JNDI DNS provider 기반 {@link com.ryuqq.provisioning.core.spi.DnsResolver} 구현.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.adapter.dns;

package com.ryuqq.provisioning.core.spi;

import java.time.Duration;
import java.util.List;

/**
 * A single public DNS resolver used as one oracle in quorum verification.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface DnsResolver {

    /**
     * Resolver identity, usually its address (e.g. "8.8.8.8").
     *
     * @return resolver name
     */
    String name();

    /**
     * Looks up the A records of a domain.
     *
     * @param domain the fully qualified domain name
     * @param timeout per-query timeout
     * @return resolved IPv4 addresses (empty if the name does not resolve yet)
     * @throws com.ryuqq.provisioning.core.exception.TransientProviderException on timeout or resolver failure
     */
    List<String> resolveA(String domain, Duration timeout);
}

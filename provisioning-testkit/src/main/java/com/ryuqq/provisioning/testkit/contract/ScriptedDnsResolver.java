package com.ryuqq.provisioning.testkit.contract;

import com.ryuqq.provisioning.core.exception.TransientProviderException;
import com.ryuqq.provisioning.core.spi.DnsResolver;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DNS resolver whose answers are scripted by the test.
 *
 * <p>A domain resolves only after {@link #propagate} was called for it, which models a record
 * that reaches public resolvers one by one.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ScriptedDnsResolver implements DnsResolver {

    private final String name;
    private final Map<String, List<String>> answers = new ConcurrentHashMap<>();
    private final AtomicInteger queryCount = new AtomicInteger();
    private volatile String failure;

    public ScriptedDnsResolver(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * Makes the domain resolve to the given address from now on.
     */
    public void propagate(String domain, String address) {
        answers.put(domain, List.of(address));
    }

    public void forget(String domain) {
        answers.remove(domain);
    }

    /**
     * Makes every following query fail, e.g. with "SERVFAIL". Pass null to recover.
     */
    public void failWith(String error) {
        this.failure = error;
    }

    public int queryCount() {
        return queryCount.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> resolveA(String domain, Duration timeout) {
        queryCount.incrementAndGet();
        String error = failure;
        if (error != null) {
            throw new TransientProviderException(error);
        }
        return answers.getOrDefault(domain, List.of());
    }
}

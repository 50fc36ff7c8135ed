package com.ryuqq.provisioning.adapter.dns;

import com.ryuqq.provisioning.core.exception.TransientProviderException;
import com.ryuqq.provisioning.core.spi.DnsResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.Context;
import javax.naming.NameNotFoundException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;

/**
 * JDK JNDI DNS provider를 이용해 특정 공용 resolver에 직접 A 레코드를 질의하는 구현체.
 *
 * <p>시스템 resolver나 로컬 캐시를 거치지 않고 지정한 서버에 질의하므로,
 * resolver마다 전파 여부를 독립적으로 관찰할 수 있습니다.</p>
 *
 * <p><strong>결과 해석:</strong></p>
 * <ul>
 *   <li>A 레코드 있음 → 주소 목록</li>
 *   <li>NXDOMAIN 또는 A 레코드 없음 → 빈 목록 (아직 전파되지 않음)</li>
 *   <li>CNAME만 있음 → 대상 이름을 같은 resolver로 다시 질의 (최대 {@value #MAX_CNAME_DEPTH}단계)</li>
 *   <li>타임아웃, SERVFAIL 등 → {@link TransientProviderException}</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class JndiDnsResolver implements DnsResolver {

    private static final Logger log = LoggerFactory.getLogger(JndiDnsResolver.class);

    static final String CONTEXT_FACTORY = "com.sun.jndi.dns.DnsContextFactory";
    static final int MAX_CNAME_DEPTH = 5;

    private static final String[] RECORD_TYPES = {"A", "CNAME"};

    private final String address;

    /**
     * 생성자.
     *
     * @param address resolver 주소 (예: "8.8.8.8", "1.1.1.1:53")
     * @throws IllegalArgumentException address가 null이거나 비어있는 경우
     */
    public JndiDnsResolver(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address cannot be null or blank");
        }
        this.address = address.trim();
    }

    /**
     * 주소 목록으로 resolver 목록 생성.
     *
     * @param addresses resolver 주소 목록 (보통 {@code DnsVerificationConfig.resolverAddresses()})
     * @return 주소 순서대로 만든 resolver
     */
    public static List<DnsResolver> forAddresses(List<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw new IllegalArgumentException("addresses cannot be null or empty");
        }
        List<DnsResolver> resolvers = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            resolvers.add(new JndiDnsResolver(address));
        }
        return List.copyOf(resolvers);
    }

    @Override
    public String name() {
        return address;
    }

    @Override
    public List<String> resolveA(String domain, Duration timeout) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }

        DirContext context = null;
        try {
            context = new InitialDirContext(environment(timeout));
            return lookup(context, domain, 0);
        } catch (NameNotFoundException e) {
            log.debug("{} returned NXDOMAIN for {}", address, domain);
            return List.of();
        } catch (NamingException e) {
            throw new TransientProviderException(
                "DNS lookup of " + domain + " via " + address + " failed: " + e.getMessage(), e);
        } finally {
            close(context);
        }
    }

    private List<String> lookup(DirContext context, String domain, int depth) throws NamingException {
        Attributes attributes = context.getAttributes(domain, RECORD_TYPES);

        List<String> addresses = values(attributes.get("A"));
        if (!addresses.isEmpty()) {
            return addresses;
        }

        List<String> aliases = values(attributes.get("CNAME"));
        if (aliases.isEmpty() || depth >= MAX_CNAME_DEPTH) {
            return List.of();
        }
        String target = stripTrailingDot(aliases.get(0));
        log.debug("{} resolved {} as CNAME {}", address, domain, target);
        return lookup(context, target, depth + 1);
    }

    private static List<String> values(Attribute attribute) throws NamingException {
        if (attribute == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        NamingEnumeration<?> all = attribute.getAll();
        while (all.hasMore()) {
            values.add(String.valueOf(all.next()));
        }
        return values;
    }

    Hashtable<String, String> environment(Duration timeout) {
        Hashtable<String, String> env = new Hashtable<>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, CONTEXT_FACTORY);
        env.put(Context.PROVIDER_URL, providerUrl(address));
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(Math.max(1L, timeout.toMillis())));
        env.put("com.sun.jndi.dns.timeout.retries", "1");
        return env;
    }

    /**
     * IPv6 주소는 대괄호로 감쌉니다.
     */
    static String providerUrl(String address) {
        boolean bareIpv6 = address.indexOf(':') != address.lastIndexOf(':') && !address.startsWith("[");
        return "dns://" + (bareIpv6 ? "[" + address + "]" : address);
    }

    static String stripTrailingDot(String name) {
        return name.endsWith(".") ? name.substring(0, name.length() - 1) : name;
    }

    private void close(DirContext context) {
        if (context == null) {
            return;
        }
        try {
            context.close();
        } catch (NamingException e) {
            log.debug("Failed to close DNS context for {}", address, e);
        }
    }
}

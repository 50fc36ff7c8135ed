package com.ryuqq.provisioning.adapter.inmemory.dns;

import com.ryuqq.provisioning.core.dns.DnsRecord;
import com.ryuqq.provisioning.core.dns.DnsRecordFilter;
import com.ryuqq.provisioning.core.dns.DnsRecordSpec;
import com.ryuqq.provisioning.core.dns.DnsZone;
import com.ryuqq.provisioning.core.exception.TransientProviderException;
import com.ryuqq.provisioning.core.spi.DnsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory {@link DnsProvider} with failure injection.
 *
 * <p>Zones are registered up front with {@link #addZone(String)}. {@link #failNextCalls(int)}
 * makes the next N provider calls throw {@link TransientProviderException}, which lets tests
 * exercise the saga's retry path.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryDnsProvider implements DnsProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDnsProvider.class);

    private final ConcurrentHashMap<String, DnsZone> zones = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DnsRecord> records = new ConcurrentHashMap<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final AtomicInteger createCalls = new AtomicInteger();

    /**
     * Registers a zone.
     *
     * @param name zone name (e.g. example.com)
     * @return the zone
     */
    public DnsZone addZone(String name) {
        DnsZone zone = new DnsZone("zone-" + name.toLowerCase(Locale.ROOT), name.toLowerCase(Locale.ROOT));
        zones.put(zone.name(), zone);
        return zone;
    }

    public void failNextCalls(int count) {
        pendingFailures.set(count);
    }

    @Override
    public List<DnsZone> listZones(String domain) {
        maybeFail("listZones");
        DnsZone zone = zones.get(domain.toLowerCase(Locale.ROOT));
        return zone == null ? List.of() : List.of(zone);
    }

    @Override
    public List<DnsRecord> listRecords(String zoneId, DnsRecordFilter filter) {
        maybeFail("listRecords");
        return records.values().stream()
            .filter(record -> record.zoneId().equals(zoneId))
            .filter(record -> filter == null || filter.matches(record))
            .collect(Collectors.toList());
    }

    @Override
    public DnsRecord createRecord(String zoneId, DnsRecordSpec spec) {
        maybeFail("createRecord");
        if (zones.values().stream().noneMatch(zone -> zone.id().equals(zoneId))) {
            throw new IllegalArgumentException("Unknown zone: " + zoneId);
        }
        createCalls.incrementAndGet();
        DnsRecord record = new DnsRecord("rec-" + UUID.randomUUID(), zoneId, spec.type(), spec.name(),
            spec.content(), spec.ttl(), spec.proxied());
        records.put(record.id(), record);
        log.info("Created {} record {} {} -> {}", record.type(), record.id(), record.name(), record.content());
        return record;
    }

    @Override
    public void deleteRecord(String zoneId, String recordId) {
        maybeFail("deleteRecord");
        DnsRecord removed = records.computeIfPresent(recordId, (id, record) -> record.zoneId().equals(zoneId) ? null : record);
        if (removed == null) {
            log.info("Deleted record {} from zone {}", recordId, zoneId);
        }
    }

    /**
     * All records currently held.
     */
    public List<DnsRecord> records() {
        return List.copyOf(records.values());
    }

    public int createCallCount() {
        return createCalls.get();
    }

    private void maybeFail(String operation) {
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            log.warn("Simulating DNS provider failure on {}", operation);
            throw new TransientProviderException("Simulated DNS provider failure on " + operation);
        }
    }
}

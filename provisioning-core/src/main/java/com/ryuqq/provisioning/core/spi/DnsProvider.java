package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.dns.DnsRecord;
import com.ryuqq.provisioning.core.dns.DnsRecordFilter;
import com.ryuqq.provisioning.core.dns.DnsRecordSpec;
import com.ryuqq.provisioning.core.dns.DnsZone;

import java.util.List;

/**
 * DNS registrar capability SPI.
 *
 * <p>Accessed only from activities. Implementations throw
 * {@link com.ryuqq.provisioning.core.exception.TransientProviderException} for timeouts and
 * other retryable API failures.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface DnsProvider {

    /**
     * Lists zones matching a domain name.
     *
     * @param domain the zone name (e.g. "firstovertheline.com")
     * @return matching zones (empty if none)
     */
    List<DnsZone> listZones(String domain);

    List<DnsRecord> listRecords(String zoneId, DnsRecordFilter filter);

    DnsRecord createRecord(String zoneId, DnsRecordSpec spec);

    /**
     * Deletes a record. Deleting an absent record is a no-op.
     *
     * @param zoneId the zone id
     * @param recordId the record id
     */
    void deleteRecord(String zoneId, String recordId);
}

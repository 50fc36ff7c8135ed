package com.ryuqq.provisioning.adapter.inmemory.dns;

import com.ryuqq.provisioning.core.dns.DnsRecord;
import com.ryuqq.provisioning.core.dns.DnsRecordFilter;
import com.ryuqq.provisioning.core.dns.DnsRecordSpec;
import com.ryuqq.provisioning.core.dns.DnsZone;
import com.ryuqq.provisioning.core.exception.TransientProviderException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class InMemoryDnsProviderTest {

    @Test
    void createListDelete() {
        // given
        InMemoryDnsProvider provider = new InMemoryDnsProvider();
        DnsZone zone = provider.addZone("example.com");

        // when
        DnsRecord record = provider.createRecord(zone.id(), DnsRecordSpec.cname("acme.example.com", "a4c.example.com", 3600));

        // then
        assertThat(provider.listRecords(zone.id(), new DnsRecordFilter("acme.example.com", "CNAME"))).containsExactly(record);
        assertThat(provider.listRecords(zone.id(), new DnsRecordFilter("other.example.com", "CNAME"))).isEmpty();

        provider.deleteRecord(zone.id(), record.id());
        assertThat(provider.records()).isEmpty();
        assertDoesNotThrow(() -> provider.deleteRecord(zone.id(), record.id()));
    }

    @Test
    void failNextCalls_transient_실패_주입() {
        InMemoryDnsProvider provider = new InMemoryDnsProvider();
        provider.addZone("example.com");
        provider.failNextCalls(1);

        assertThatThrownBy(() -> provider.listZones("example.com"))
            .isInstanceOf(TransientProviderException.class);
        assertThat(provider.listZones("example.com")).hasSize(1);
    }
}

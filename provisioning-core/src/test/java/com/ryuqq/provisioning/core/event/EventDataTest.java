package com.ryuqq.provisioning.core.event;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventData 불변성 및 조회 테스트.
 */
class EventDataTest {

    @Test
    void typedAccessors_readBuiltValues() {
        UUID orgId = UUID.randomUUID();
        Instant at = Instant.parse("2026-03-01T10:15:30Z");

        EventData data = EventData.builder()
            .put("org_id", orgId)
            .put("name", "Acme")
            .put("attempts", 3)
            .put("will_retry", false)
            .put("verified_at", at)
            .putList("roles", List.of("provider_admin", "viewer"))
            .build();

        assertThat(data.uuid("org_id")).isEqualTo(orgId);
        assertThat(data.text("name")).isEqualTo("Acme");
        assertThat(data.intValue("attempts")).isEqualTo(3);
        assertThat(data.bool("will_retry")).isFalse();
        assertThat(data.instant("verified_at")).isEqualTo(at);
        assertThat(data.textList("roles")).containsExactly("provider_admin", "viewer");
    }

    @Test
    void missingRequiredField_throwsIllegalState() {
        EventData data = EventData.builder().put("subdomain", (String) null).build();

        assertThat(data.has("subdomain")).isFalse();
        assertThat(data.optionalText("subdomain")).isEmpty();
        assertThatThrownBy(() -> data.text("subdomain"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("subdomain");
    }

    @Test
    void exposedNode_isACopy() {
        EventData data = EventData.builder().put("name", "Acme").build();

        ObjectNode node = data.toObjectNode();
        node.put("name", "Mutated");

        assertThat(data.text("name")).isEqualTo("Acme");
    }

    @Test
    void sourceNode_isCopiedOnCreation() {
        ObjectNode source = EventSerializer.objectMapper().createObjectNode().put("name", "Acme");

        EventData data = EventData.of(source);
        source.put("name", "Mutated");

        assertThat(data.text("name")).isEqualTo("Acme");
    }
}

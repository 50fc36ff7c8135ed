package com.ryuqq.provisioning.application.activity;

import com.ryuqq.provisioning.application.event.EventAppender;
import com.ryuqq.provisioning.core.event.AddressEventType;
import com.ryuqq.provisioning.core.event.ContactEventType;
import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.event.OrganizationEventType;
import com.ryuqq.provisioning.core.event.PhoneEventType;
import com.ryuqq.provisioning.core.event.StreamType;
import com.ryuqq.provisioning.core.model.AddressInfo;
import com.ryuqq.provisioning.core.model.BootstrapRequest;
import com.ryuqq.provisioning.core.model.ContactInfo;
import com.ryuqq.provisioning.core.model.OrganizationParams;
import com.ryuqq.provisioning.core.model.PhoneInfo;
import com.ryuqq.provisioning.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * 조직과 연락처 정보를 생성하는 activity.
 *
 * <p><strong>멱등성:</strong> org_id 스트림에 이미 이벤트가 있으면 조직 생성을 건너뜁니다.
 * 연락처/주소/전화번호 id는 (org_id, 종류, 순번)에서 결정적으로 파생되므로
 * 재시도 시 같은 스트림을 다시 확인하게 됩니다. junction 연결은 junction 스트림에 같은
 * 대상의 linked 이벤트가 있으면 건너뜁니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class CreateOrganizationActivity {

    private static final Logger log = LoggerFactory.getLogger(CreateOrganizationActivity.class);

    private final EventStore eventStore;
    private final EventAppender appender;

    public CreateOrganizationActivity(EventStore eventStore, EventAppender appender) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        this.eventStore = eventStore;
        this.appender = appender;
    }

    /**
     * 조직 생성.
     *
     * @param orgId saga 시작 시 배정된 조직 id
     * @param request bootstrap 요청
     * @param context 실행 컨텍스트
     * @return 생성 결과
     */
    public Result execute(UUID orgId, BootstrapRequest request, ActivityContext context) {
        OrganizationParams organization = request.organization();

        // 1. 조직
        boolean created = false;
        if (eventStore.currentVersion(orgId, StreamType.ORGANIZATION) == 0) {
            String slug = organization.slug();
            EventData data = EventData.builder()
                .put("name", organization.name())
                .put("slug", slug)
                .put("type", organization.type())
                .put("path", "root." + slug.replace('-', '_'))
                .put("subdomain", request.subdomain())
                .put("bootstrap_id", context.bootstrapId().getValue())
                .build();
            appender.append(orgId, OrganizationEventType.CREATED, data,
                context.metadata("Organization created via bootstrap"));
            created = true;
            log.info("Organization {} created ({})", orgId, organization.name());
        } else {
            log.info("Organization {} already exists, skipping creation", orgId);
        }

        // 2. 연락처 정보
        List<DomainEvent> junction = eventStore.readStream(orgId, StreamType.JUNCTION);
        int contacts = 0;
        for (int i = 0; i < organization.contacts().size(); i++) {
            UUID contactId = derivedId(orgId, "contact", i);
            createContact(orgId, contactId, organization.contacts().get(i), context);
            link(orgId, junction, JunctionEventType.ORGANIZATION_CONTACT_LINKED, "contact_id", contactId, context);
            contacts++;
        }
        int addresses = 0;
        for (int i = 0; i < organization.addresses().size(); i++) {
            UUID addressId = derivedId(orgId, "address", i);
            createAddress(orgId, addressId, organization.addresses().get(i), context);
            link(orgId, junction, JunctionEventType.ORGANIZATION_ADDRESS_LINKED, "address_id", addressId, context);
            addresses++;
        }
        int phones = 0;
        for (int i = 0; i < organization.phones().size(); i++) {
            UUID phoneId = derivedId(orgId, "phone", i);
            createPhone(orgId, phoneId, organization.phones().get(i), context);
            link(orgId, junction, JunctionEventType.ORGANIZATION_PHONE_LINKED, "phone_id", phoneId, context);
            phones++;
        }

        return new Result(orgId, created, contacts, addresses, phones);
    }

    private void createContact(UUID orgId, UUID contactId, ContactInfo contact, ActivityContext context) {
        if (eventStore.currentVersion(contactId, StreamType.CONTACT) > 0) {
            return;
        }
        EventData data = EventData.builder()
            .put("organization_id", orgId)
            .put("label", contact.label())
            .put("first_name", contact.firstName())
            .put("last_name", contact.lastName())
            .put("email", contact.email())
            .put("title", contact.title())
            .build();
        appender.append(contactId, ContactEventType.CREATED, data, context.metadata("Contact created via bootstrap"));
    }

    private void createAddress(UUID orgId, UUID addressId, AddressInfo address, ActivityContext context) {
        if (eventStore.currentVersion(addressId, StreamType.ADDRESS) > 0) {
            return;
        }
        EventData data = EventData.builder()
            .put("organization_id", orgId)
            .put("label", address.label())
            .put("street1", address.street1())
            .put("street2", address.street2())
            .put("city", address.city())
            .put("state", address.state())
            .put("zip_code", address.zipCode())
            .put("country", address.country())
            .build();
        appender.append(addressId, AddressEventType.CREATED, data, context.metadata("Address created via bootstrap"));
    }

    private void createPhone(UUID orgId, UUID phoneId, PhoneInfo phone, ActivityContext context) {
        if (eventStore.currentVersion(phoneId, StreamType.PHONE) > 0) {
            return;
        }
        EventData data = EventData.builder()
            .put("organization_id", orgId)
            .put("label", phone.label())
            .put("number", phone.number())
            .put("type", phone.type())
            .build();
        appender.append(phoneId, PhoneEventType.CREATED, data, context.metadata("Phone created via bootstrap"));
    }

    private void link(UUID orgId, List<DomainEvent> junction, JunctionEventType type, String field, UUID targetId,
                      ActivityContext context) {
        boolean alreadyLinked = junction.stream()
            .anyMatch(event -> event.is(type) && targetId.toString().equals(event.data().optionalText(field).orElse(null)));
        if (alreadyLinked) {
            return;
        }
        EventData data = EventData.builder()
            .put("organization_id", orgId)
            .put(field, targetId)
            .build();
        appender.append(orgId, type, data, context.metadata("Linked via bootstrap"));
    }

    static UUID derivedId(UUID orgId, String kind, int index) {
        return UUID.nameUUIDFromBytes((orgId + ":" + kind + ":" + index).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @param orgId 조직 id
     * @param created 이번 호출에서 조직이 생성되었는지 여부
     * @param contacts 연락처 수
     * @param addresses 주소 수
     * @param phones 전화번호 수
     */
    public record Result(UUID orgId, boolean created, int contacts, int addresses, int phones) {
    }
}

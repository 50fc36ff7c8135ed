package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.EventData;
import com.ryuqq.provisioning.core.event.JunctionEventType;
import com.ryuqq.provisioning.core.projection.LinkKind;
import com.ryuqq.provisioning.core.projection.OrganizationLinks;
import com.ryuqq.provisioning.core.spi.ProjectionStore;

/**
 * 조직-연락처 정보 연결(junction) 핸들러.
 *
 * <p>{@code organization.<kind>.linked|unlinked} 이름 규칙을 따르는 이벤트는
 * 스트림 유형과 무관하게 이 핸들러로 라우팅됩니다. link/unlink는 집합 연산이라 재적용해도 같은 결과입니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class JunctionProjectionHandler implements ProjectionHandler<JunctionEventType> {

    private final ProjectionStore store;

    public JunctionProjectionHandler(ProjectionStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void apply(DomainEvent event, JunctionEventType type) {
        EventData data = event.data();
        OrganizationLinks links = store.findLinks(data.uuid("organization_id"));

        OrganizationLinks next = switch (type) {
            case ORGANIZATION_CONTACT_LINKED -> links.link(LinkKind.CONTACT, data.uuid("contact_id"));
            case ORGANIZATION_CONTACT_UNLINKED -> links.unlink(LinkKind.CONTACT, data.uuid("contact_id"));
            case ORGANIZATION_ADDRESS_LINKED -> links.link(LinkKind.ADDRESS, data.uuid("address_id"));
            case ORGANIZATION_ADDRESS_UNLINKED -> links.unlink(LinkKind.ADDRESS, data.uuid("address_id"));
            case ORGANIZATION_PHONE_LINKED -> links.link(LinkKind.PHONE, data.uuid("phone_id"));
            case ORGANIZATION_PHONE_UNLINKED -> links.unlink(LinkKind.PHONE, data.uuid("phone_id"));
        };
        store.saveLinks(next);
    }
}

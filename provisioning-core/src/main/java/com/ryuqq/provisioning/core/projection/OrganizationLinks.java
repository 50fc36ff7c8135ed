package com.ryuqq.provisioning.core.projection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 조직 junction projection (조직 ↔ 연락처/주소/전화).
 *
 * <p>link/unlink는 집합 연산이므로 같은 이벤트를 두 번 반영해도 결과가 같습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class OrganizationLinks {

    private final UUID orgId;
    private final Map<LinkKind, Set<UUID>> links;

    private OrganizationLinks(UUID orgId, Map<LinkKind, Set<UUID>> links) {
        if (orgId == null) {
            throw new IllegalArgumentException("orgId cannot be null");
        }
        this.orgId = orgId;
        this.links = links;
    }

    public static OrganizationLinks empty(UUID orgId) {
        Map<LinkKind, Set<UUID>> links = new EnumMap<>(LinkKind.class);
        for (LinkKind kind : LinkKind.values()) {
            links.put(kind, Set.of());
        }
        return new OrganizationLinks(orgId, links);
    }

    public OrganizationLinks link(LinkKind kind, UUID targetId) {
        Set<UUID> next = new LinkedHashSet<>(links.get(kind));
        next.add(targetId);
        return replace(kind, next);
    }

    public OrganizationLinks unlink(LinkKind kind, UUID targetId) {
        Set<UUID> next = new LinkedHashSet<>(links.get(kind));
        next.remove(targetId);
        return replace(kind, next);
    }

    public UUID getOrgId() {
        return orgId;
    }

    public Set<UUID> get(LinkKind kind) {
        return links.get(kind);
    }

    public boolean isEmpty() {
        return links.values().stream().allMatch(Set::isEmpty);
    }

    private OrganizationLinks replace(LinkKind kind, Set<UUID> values) {
        Map<LinkKind, Set<UUID>> copy = new EnumMap<>(links);
        copy.put(kind, Collections.unmodifiableSet(values));
        return new OrganizationLinks(orgId, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrganizationLinks that = (OrganizationLinks) o;
        return orgId.equals(that.orgId) && links.equals(that.links);
    }

    @Override
    public int hashCode() {
        return 31 * orgId.hashCode() + links.hashCode();
    }

    @Override
    public String toString() {
        return "OrganizationLinks{" + orgId + ", " + links + '}';
    }
}

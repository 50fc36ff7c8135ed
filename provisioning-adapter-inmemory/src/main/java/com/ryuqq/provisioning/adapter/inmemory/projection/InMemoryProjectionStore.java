package com.ryuqq.provisioning.adapter.inmemory.projection;

import com.ryuqq.provisioning.core.projection.AddressView;
import com.ryuqq.provisioning.core.projection.BootstrapView;
import com.ryuqq.provisioning.core.projection.ContactView;
import com.ryuqq.provisioning.core.projection.InvitationStatus;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.projection.OrganizationLinks;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.projection.PhoneView;
import com.ryuqq.provisioning.core.spi.ProjectionStore;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ProjectionStore}: one map per read model.
 *
 * <p>A "live" invitation is one that is still PENDING and not past its expiry.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public class InMemoryProjectionStore implements ProjectionStore {

    private final ConcurrentHashMap<UUID, OrganizationView> organizations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, InvitationView> invitations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, ContactView> contacts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, AddressView> addresses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, PhoneView> phones = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, OrganizationLinks> links = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, BootstrapView> bootstraps = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProjectionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProjectionStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<OrganizationView> findOrganization(UUID orgId) {
        return Optional.ofNullable(organizations.get(orgId));
    }

    @Override
    public Optional<InvitationView> findInvitation(UUID invitationId) {
        return Optional.ofNullable(invitations.get(invitationId));
    }

    @Override
    public Optional<InvitationView> findLiveInvitation(UUID orgId, String email) {
        return invitations.values().stream()
            .filter(view -> view.orgId().equals(orgId))
            .filter(view -> view.email().equalsIgnoreCase(email))
            .filter(view -> view.status() == InvitationStatus.PENDING)
            .filter(view -> view.expiresAt() == null || view.expiresAt().isAfter(clock.instant()))
            .min(Comparator.comparing(InvitationView::createdAt));
    }

    @Override
    public List<InvitationView> findInvitations(UUID orgId) {
        return invitations.values().stream()
            .filter(view -> view.orgId().equals(orgId))
            .sorted(Comparator.comparing(InvitationView::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<ContactView> findContact(UUID contactId) {
        return Optional.ofNullable(contacts.get(contactId));
    }

    @Override
    public List<ContactView> findContacts(UUID orgId) {
        return contacts.values().stream()
            .filter(view -> view.orgId().equals(orgId))
            .sorted(Comparator.comparing(ContactView::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<AddressView> findAddress(UUID addressId) {
        return Optional.ofNullable(addresses.get(addressId));
    }

    @Override
    public List<AddressView> findAddresses(UUID orgId) {
        return addresses.values().stream()
            .filter(view -> view.orgId().equals(orgId))
            .sorted(Comparator.comparing(AddressView::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<PhoneView> findPhone(UUID phoneId) {
        return Optional.ofNullable(phones.get(phoneId));
    }

    @Override
    public List<PhoneView> findPhones(UUID orgId) {
        return phones.values().stream()
            .filter(view -> view.orgId().equals(orgId))
            .sorted(Comparator.comparing(PhoneView::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public OrganizationLinks findLinks(UUID orgId) {
        return links.getOrDefault(orgId, OrganizationLinks.empty(orgId));
    }

    @Override
    public Optional<BootstrapView> findBootstrap(UUID bootstrapId) {
        return Optional.ofNullable(bootstraps.get(bootstrapId));
    }

    @Override
    public void saveOrganization(OrganizationView view) {
        organizations.put(view.orgId(), view);
    }

    @Override
    public void saveInvitation(InvitationView view) {
        invitations.put(view.invitationId(), view);
    }

    @Override
    public void saveContact(ContactView view) {
        contacts.put(view.contactId(), view);
    }

    @Override
    public void saveAddress(AddressView view) {
        addresses.put(view.addressId(), view);
    }

    @Override
    public void savePhone(PhoneView view) {
        phones.put(view.phoneId(), view);
    }

    @Override
    public void saveLinks(OrganizationLinks organizationLinks) {
        links.put(organizationLinks.getOrgId(), organizationLinks);
    }

    @Override
    public void saveBootstrap(BootstrapView view) {
        bootstraps.put(view.bootstrapId(), view);
    }

    @Override
    public void clear() {
        organizations.clear();
        invitations.clear();
        contacts.clear();
        addresses.clear();
        phones.clear();
        links.clear();
        bootstraps.clear();
    }
}

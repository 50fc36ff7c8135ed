package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.projection.AddressView;
import com.ryuqq.provisioning.core.projection.BootstrapView;
import com.ryuqq.provisioning.core.projection.ContactView;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.projection.OrganizationLinks;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.projection.PhoneView;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only projection query surface.
 *
 * <p>Activities use it only for idempotency pre-checks, for example
 * "does this organization already exist" or "is it already active".</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface EventQueryStore {

    Optional<OrganizationView> findOrganization(UUID orgId);

    Optional<InvitationView> findInvitation(UUID invitationId);

    /**
     * Finds the live (non-revoked) invitation for an organization and email.
     *
     * @param orgId the organization id
     * @param email normalized email
     * @return the invitation, or empty if none or only revoked ones exist
     */
    Optional<InvitationView> findLiveInvitation(UUID orgId, String email);

    List<InvitationView> findInvitations(UUID orgId);

    Optional<ContactView> findContact(UUID contactId);

    List<ContactView> findContacts(UUID orgId);

    Optional<AddressView> findAddress(UUID addressId);

    List<AddressView> findAddresses(UUID orgId);

    Optional<PhoneView> findPhone(UUID phoneId);

    List<PhoneView> findPhones(UUID orgId);

    /**
     * Returns the junction links of an organization.
     *
     * @param orgId the organization id
     * @return links (empty links if none)
     */
    OrganizationLinks findLinks(UUID orgId);

    Optional<BootstrapView> findBootstrap(UUID bootstrapId);
}

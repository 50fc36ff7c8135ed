package com.ryuqq.provisioning.core.spi;

import com.ryuqq.provisioning.core.projection.AddressView;
import com.ryuqq.provisioning.core.projection.BootstrapView;
import com.ryuqq.provisioning.core.projection.ContactView;
import com.ryuqq.provisioning.core.projection.InvitationView;
import com.ryuqq.provisioning.core.projection.OrganizationLinks;
import com.ryuqq.provisioning.core.projection.OrganizationView;
import com.ryuqq.provisioning.core.projection.PhoneView;

/**
 * Writable projection store SPI.
 *
 * <p>Only projection handlers may call the mutators. Each projection entity is owned by
 * exactly one handler. Saves are upserts keyed by the entity's natural id, which keeps
 * re-delivered events harmless.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface ProjectionStore extends EventQueryStore {

    void saveOrganization(OrganizationView view);

    void saveInvitation(InvitationView view);

    void saveContact(ContactView view);

    void saveAddress(AddressView view);

    void savePhone(PhoneView view);

    void saveLinks(OrganizationLinks links);

    void saveBootstrap(BootstrapView view);

    /**
     * Drops all projections (used before a full replay).
     */
    void clear();
}

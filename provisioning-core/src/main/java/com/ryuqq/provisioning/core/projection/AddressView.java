package com.ryuqq.provisioning.core.projection;

import java.time.Instant;
import java.util.UUID;

/**
 * 주소 projection. 삭제는 soft delete.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record AddressView(
    UUID addressId,
    UUID orgId,
    String label,
    String street1,
    String street2,
    String city,
    String state,
    String zipCode,
    String country,
    Instant createdAt,
    Instant deletedAt
) {

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public AddressView deleted(Instant at) {
        return new AddressView(addressId, orgId, label, street1, street2, city, state, zipCode, country,
            createdAt, at);
    }
}

package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.repository.StaffRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The organization's designated primary staff member.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class PrimaryStaffStrategy implements IdentityStrategy {

    private final StaffRepository staffRepository;
    private final CredentialLookup credentialLookup;

    @Override
    public Optional<SenderIdentity> resolve(IdentityRequest request) {
        return staffRepository.findFirstByOrganizationIdAndPrimaryContactTrue(request.organizationId())
                .flatMap(staff -> credentialLookup.findUsable(CredentialOwnerType.STAFF, staff.getId())
                        .map(credential -> new SenderIdentity(CredentialOwnerType.STAFF, staff.getId(),
                                staff.getDisplayName(), staff.getEmail(), credential)));
    }

    @Override
    public String name() {
        return "primary-staff";
    }
}

package com.donorline.dispatch.identity;

import com.donorline.dispatch.model.CredentialOwnerType;
import com.donorline.dispatch.repository.DonorRepository;
import com.donorline.dispatch.repository.StaffRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Staff member assigned to the donor.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class AssignedStaffStrategy implements IdentityStrategy {

    private final DonorRepository donorRepository;
    private final StaffRepository staffRepository;
    private final CredentialLookup credentialLookup;

    @Override
    public Optional<SenderIdentity> resolve(IdentityRequest request) {
        return donorRepository.findById(request.donorId())
                .filter(donor -> donor.getAssignedStaffId() != null)
                .flatMap(donor -> staffRepository.findById(donor.getAssignedStaffId()))
                .flatMap(staff -> credentialLookup.findUsable(CredentialOwnerType.STAFF, staff.getId())
                        .map(credential -> new SenderIdentity(CredentialOwnerType.STAFF, staff.getId(),
                                staff.getDisplayName(), staff.getEmail(), credential)));
    }

    @Override
    public String name() {
        return "assigned-staff";
    }
}

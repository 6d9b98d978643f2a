package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.Staff;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface StaffRepository extends JpaRepository<Staff, UUID> {

    Optional<Staff> findFirstByOrganizationIdAndPrimaryContactTrue(String organizationId);
}

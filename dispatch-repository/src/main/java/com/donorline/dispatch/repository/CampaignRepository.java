package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.Campaign;
import com.donorline.dispatch.model.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

    List<Campaign> findByOrganizationIdAndStatusIn(String organizationId, Collection<CampaignStatus> statuses);

    @Query("select distinct c.organizationId from Campaign c where c.status in :statuses")
    List<String> findOrganizationIdsWithStatusIn(@Param("statuses") Collection<CampaignStatus> statuses);
}

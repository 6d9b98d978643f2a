package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.SendStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface CampaignMessageRepository extends JpaRepository<CampaignMessage, UUID> {

    List<CampaignMessage> findByCampaignIdAndSendStatusAndSentFalseOrderByCreatedAtAsc(UUID campaignId, SendStatus status);

    @Query("select m.sendStatus, count(m) from CampaignMessage m where m.campaignId = :campaignId group by m.sendStatus")
    List<Object[]> countByStatus(@Param("campaignId") UUID campaignId);

    /**
     * Guarded status change: only applies while the message is unsent and still in one
     * of the expected statuses.
     *
     * @return 1 if the row moved, 0 if another writer got there first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignMessage m set m.sendStatus = :next
            where m.id = :id and m.sent = false and m.sendStatus in :expected
            """)
    int transition(@Param("id") UUID id,
                   @Param("expected") Collection<SendStatus> expected,
                   @Param("next") SendStatus next);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignMessage m
            set m.sendStatus = :sentStatus, m.sent = true, m.sentAt = :sentAt,
                m.providerMessageId = :providerMessageId, m.lastError = null
            where m.id = :id and m.sent = false and m.sendStatus = :expected
            """)
    int markSent(@Param("id") UUID id,
                 @Param("expected") SendStatus expected,
                 @Param("sentStatus") SendStatus sentStatus,
                 @Param("sentAt") Instant sentAt,
                 @Param("providerMessageId") String providerMessageId);
}

package com.donorline.dispatch.tracking;

import com.donorline.dispatch.model.CampaignMessage;
import com.donorline.dispatch.model.EmailTracker;
import com.donorline.dispatch.model.LinkTracker;
import com.donorline.dispatch.repository.EmailTrackerRepository;
import com.donorline.dispatch.repository.LinkTrackerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores the open tracker and link trackers of a message so the tracking endpoints
 * can resolve them later.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackingRecorder {

    private final EmailTrackerRepository emailTrackerRepository;
    private final LinkTrackerRepository linkTrackerRepository;

    @Transactional
    public void record(String trackingId, CampaignMessage message, InstrumentedContent content) {
        emailTrackerRepository.save(EmailTracker.builder()
                .id(trackingId)
                .messageId(message.getId())
                .campaignId(message.getCampaignId())
                .recipientEmail(message.getRecipientEmail())
                .build());
        linkTrackerRepository.saveAll(content.links().stream()
                .map(link -> LinkTracker.builder()
                        .id(link.linkId())
                        .emailTrackerId(trackingId)
                        .originalUrl(link.originalUrl())
                        .build())
                .toList());
        log.debug("Recorded tracker {} with {} links for message {}", trackingId, content.links().size(), message.getId());
    }
}

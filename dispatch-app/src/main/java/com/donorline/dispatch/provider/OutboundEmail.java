package com.donorline.dispatch.provider;

/**
 * A fully composed message ready for delivery.
 */
public record OutboundEmail(
        String toAddress,
        String toName,
        String subject,
        String htmlBody,
        String textBody
) {
}

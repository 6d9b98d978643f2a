package com.donorline.dispatch.tracking;

import java.util.List;

/**
 * HTML body with click and open tracking, the untracked plain-text body, and the
 * links that were rewritten.
 */
public record InstrumentedContent(String html, String text, List<TrackedLink> links) {
}

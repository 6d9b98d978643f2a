package com.donorline.dispatch.tracking;

import org.junit.jupiter.api.Test;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TrackingInstrumenterTest {

    private final TrackingInstrumenter instrumenter = new TrackingInstrumenter("https://track.example.org/");

    @Test
    void instrument_shouldRewriteLinksAndAppendPixel() {
        InstrumentedContent content = instrumenter.instrument(
                "Thanks for giving. See https://example.org/impact?year=2025.", "abc123");

        assertThat(content.links()).hasSize(1);
        TrackedLink link = content.links().get(0);
        assertThat(link.originalUrl()).isEqualTo("https://example.org/impact?year=2025");
        assertThat(content.html()).contains("<a href=\"https://track.example.org/api/track/click/" + link.linkId()
                + "?url=" + URLEncoder.encode(link.originalUrl(), StandardCharsets.UTF_8) + "\">");
        assertThat(content.html()).contains("</a>.</p>");
        assertThat(content.html()).endsWith("<img src=\"https://track.example.org/api/track/open/abc123\""
                + " width=\"1\" height=\"1\" alt=\"\" style=\"display:none\" />");
    }

    @Test
    void instrument_shouldEscapeHtmlAndKeepParagraphs() {
        InstrumentedContent content = instrumenter.instrument("Dear <Pat> & family,\nthank you.\n\nDana", "t1");

        assertThat(content.html()).startsWith("<p>Dear &lt;Pat&gt; &amp; family,<br>thank you.</p><p>Dana</p>");
        assertThat(content.text()).isEqualTo("Dear <Pat> & family,\nthank you.\n\nDana");
        assertThat(content.links()).isEmpty();
    }

    @Test
    void instrument_shouldGiveEachLinkItsOwnId() {
        InstrumentedContent content = instrumenter.instrument("https://a.example.org and https://b.example.org", "t2");

        assertThat(content.links()).extracting(TrackedLink::originalUrl)
                .containsExactly("https://a.example.org", "https://b.example.org");
        assertThat(content.links().get(0).linkId()).isNotEqualTo(content.links().get(1).linkId());
    }

    @Test
    void newTrackingId_shouldBeThirtyTwoHexCharacters() {
        assertThat(TrackingInstrumenter.newTrackingId()).matches("[0-9a-f]{32}");
    }
}

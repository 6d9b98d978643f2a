package com.donorline.dispatch.tracking;

public record TrackedLink(String linkId, String originalUrl) {
}

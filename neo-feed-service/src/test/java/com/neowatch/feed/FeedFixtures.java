package com.neowatch.feed;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class FeedFixtures {

    private FeedFixtures() {}

    public static String sampleFeedJson() {
        try (InputStream in = FeedFixtures.class.getResourceAsStream("/feed/neo-feed-sample.json")) {
            if (in == null) {
                throw new IllegalStateException("missing fixture /feed/neo-feed-sample.json");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.neowatch.feed.fallback;

import com.neowatch.common.model.NearEarthObject;
import com.neowatch.feed.model.NeoFeedPayload;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Static sample objects served when the upstream feed is unavailable and nothing has
 * been cached for the requested range. The objects are dated to the first day of the
 * requested range.
 */
@Component
public class FallbackNeoCatalog {

    public NeoFeedPayload forDate(LocalDate date, Instant generatedAt) {
        List<NearEarthObject> samples = List.of(
            new NearEarthObject("3542519", "(2010 PK9)",        true,  0.284, 7_230_000,  67_600, date),
            new NearEarthObject("3726710", "(2015 RC)",         false, 0.041, 15_400_000, 54_200, date),
            new NearEarthObject("2465633", "465633 (2009 JR5)", true,  1.2,   12_500_000, 58_900, date),
            new NearEarthObject("3550117", "(2010 VB)",         false, 0.045, 53_200_000, 43_849, date)
        );
        return new NeoFeedPayload(samples.size(), samples, 0, generatedAt);
    }
}

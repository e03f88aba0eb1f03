package com.neowatch;

import com.neowatch.alert.evaluator.AlertEvaluator;
import com.neowatch.alert.scheduler.AlertScheduler;
import com.neowatch.feed.provider.NeoFeedProvider;
import com.neowatch.feed.service.NeoFeedService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    properties = "neo.alerts.enabled=false"
)
class NeoWatchApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void wiresFeedAndAlertModules() {
        assertInstanceOf(NeoFeedService.class, context.getBean(NeoFeedProvider.class));
        assertNotNull(context.getBean(AlertEvaluator.class));
        assertNotNull(context.getBean(AlertScheduler.class));
    }
}

package com.syro.test;

import com.syro.api.Capability;
import com.syro.api.InboundMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Base class for all unit tests.
 * Provides a controllable clock and message factories.
 */
public abstract class TestBase {
    protected static final Logger logger = LoggerFactory.getLogger(TestBase.class);
    protected MutableClock clock;

    @BeforeEach
    void setUp(TestInfo testInfo) {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    }

    @AfterEach
    void tearDown(TestInfo testInfo) {
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }

    protected static InboundMessage guildMessage(String text, String actorId, List<String> roles,
                                                 Set<Capability> caps, String guildId) {
        return new InboundMessage(text, actorId, roles, caps, guildId, "channel-1");
    }

    protected static InboundMessage guildMessage(String text, String actorId, String guildId) {
        return guildMessage(text, actorId, List.of(), Set.of(), guildId);
    }

    protected static InboundMessage directMessage(String text, String actorId) {
        return new InboundMessage(text, actorId, List.of(), Set.of(), null, "dm-" + actorId);
    }
}

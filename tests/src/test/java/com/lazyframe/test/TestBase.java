package com.lazyframe.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for engine tests.
 *
 * <p>Logs each test's name on entry and exit, and gives subclasses {@link #doSetUp()} and
 * {@link #doTearDown()} hooks plus step and data logging for given/when/then style tests.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void baseSetUp(TestInfo info) {
        testName = info.getDisplayName();
        logger.debug("=== Starting: {} ===", testName);
        doSetUp();
    }

    @AfterEach
    void baseTearDown() {
        doTearDown();
        logger.debug("=== Finished: {} ===", testName);
    }

    protected void doSetUp() {
        // Subclass hook
    }

    protected void doTearDown() {
        // Subclass hook
    }

    protected void logStep(String step) {
        logger.info("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {}: {}", testName, label, value);
    }
}

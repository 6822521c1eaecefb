package com.sargasso.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for planner tests.
 *
 * <p>Logs the start and end of each test and offers Given/When/Then step logging.
 * Subclasses put per-test setup in {@link #doSetUp()} and cleanup in
 * {@link #doTearDown()}.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void setUpBase(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
        doSetUp();
    }

    @AfterEach
    void tearDownBase() {
        doTearDown();
        logger.debug("Finished test: {}", testName);
    }

    /**
     * Per-test setup hook.
     */
    protected void doSetUp() {
    }

    /**
     * Per-test cleanup hook.
     */
    protected void doTearDown() {
    }

    /**
     * Logs a test step, usually phrased as Given, When or Then.
     *
     * @param step the step description
     */
    protected void logStep(String step) {
        logger.info("  {}", step);
    }

    /**
     * Logs a value produced or inspected by the test.
     *
     * @param label what the value is
     * @param value the value
     */
    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }
}

package com.edgedispatch.core.execution;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPropertiesTest {

    @Test
    void defaultsMatchSidecarBehaviour() {
        var props = new ExecutionProperties();
        assertEquals("root", props.getSshUser());
        assertEquals(22, props.getSshPort());
        assertEquals("ssh", props.getSshBinary());
        assertEquals(25, props.getConnectTimeoutSeconds());
        assertEquals(10, props.getServerAliveIntervalSeconds());
        assertEquals(Duration.ofSeconds(20), props.getProbeTimeout());
        assertEquals(Duration.ofSeconds(60), props.getOverallTimeout());
        assertEquals("policy does not permit", props.getPolicyDenialPattern());
    }

    @Test
    void blankPatternFallsBackToDefaultClassifier() {
        var props = new ExecutionProperties();
        props.setPolicyDenialPattern(" ");

        var classifier = new ExecutionConfig().policyDenialClassifier(props);

        assertTrue(classifier.isPolicyDenial("policy does not permit"));
    }

    @Test
    void customPatternReplacesDefault() {
        var props = new ExecutionProperties();
        props.setPolicyDenialPattern("blocked by acl");

        var classifier = new ExecutionConfig().policyDenialClassifier(props);

        assertTrue(classifier.isPolicyDenial("ssh: blocked by ACL"));
        assertFalse(classifier.isPolicyDenial("policy does not permit"));
    }
}

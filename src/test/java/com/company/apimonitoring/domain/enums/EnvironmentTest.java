package com.company.apimonitoring.domain.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    @Test
    void fromString_KnownTags_ResolveByValueOrName() {
        assertEquals(Environment.ON_PREMISES, Environment.fromString("on-premises"));
        assertEquals(Environment.ON_PREMISES, Environment.fromString("ON_PREMISES"));
        assertEquals(Environment.AWS, Environment.fromString(" AWS "));
        assertEquals(Environment.GCP, Environment.fromString("gcp"));
    }

    @Test
    void fromString_UnknownOrMissingTag_FallsBackToOther() {
        assertEquals(Environment.OTHER, Environment.fromString("multi-cloud"));
        assertEquals(Environment.OTHER, Environment.fromString(null));
    }

    @Test
    void getTopologyStage_OnPremisesBeforeCloudBeforeOther() {
        assertTrue(Environment.ON_PREMISES.getTopologyStage() < Environment.AWS.getTopologyStage());
        assertEquals(Environment.AWS.getTopologyStage(), Environment.AZURE.getTopologyStage());
        assertTrue(Environment.GCP.getTopologyStage() < Environment.OTHER.getTopologyStage());
    }
}

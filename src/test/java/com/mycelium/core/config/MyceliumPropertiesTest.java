package com.mycelium.core.config;

import com.mycelium.core.supervisor.RetryOwnership;
import com.mycelium.core.supervisor.SupervisorSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MyceliumPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new MyceliumProperties();
        assertEquals(256, props.getBus().getMailboxCapacity());
        assertEquals(1000, props.getBus().getDeadLetterRetention());
        assertEquals(1000, props.getRuntime().getHeartbeatIntervalMs());
        assertEquals(5000, props.getHealth().getStalenessMs());
        assertEquals("strategic", props.getStrategic().getId());
        assertEquals("gateway", props.getGatewayId());
        assertTrue(props.getDomains().isEmpty());
    }

    @Test
    void defaultSupervisorSettingsMatchBuiltInDefaults() {
        assertEquals(SupervisorSettings.defaults(), new MyceliumProperties().toSupervisorSettings());
    }

    @Test
    void supervisorSettingsCarryOverrides() {
        var props = new MyceliumProperties();
        props.getSupervisor().setMaxRetries(1);
        props.getSupervisor().setBaseDelayMs(50);
        props.getSupervisor().setFailureThreshold(2);
        props.getSupervisor().setRetryOwnership(Map.of("billing", RetryOwnership.ESCALATE));

        SupervisorSettings settings = props.toSupervisorSettings();

        assertEquals(1, settings.retry().maxRetries());
        assertEquals(Duration.ofMillis(50), settings.retry().baseDelay());
        assertEquals(2, settings.breaker().failureThreshold());
        assertEquals(RetryOwnership.ESCALATE, settings.ownershipFor("billing"));
        assertEquals(RetryOwnership.SUPERVISOR, settings.ownershipFor("echo"));
    }

    @Test
    void runtimeAndCoordinatorSettings() {
        var props = new MyceliumProperties();
        props.getBus().setMailboxCapacity(8);
        props.getRuntime().setHeartbeatIntervalMs(250);
        props.getStrategic().setSilenceThresholdMs(1500);
        props.getStrategic().setAlternates(Map.of("echo", "echo-backup"));

        assertEquals(Duration.ofMillis(250), props.toRuntimeSettings().heartbeatInterval());
        assertEquals(8, props.toRuntimeSettings().mailboxCapacity());
        assertEquals(Duration.ofMillis(1500), props.toCoordinatorSettings().silenceThreshold());
        assertEquals("echo-backup", props.toCoordinatorSettings().alternates().get("echo"));
    }
}

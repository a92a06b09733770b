import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

class SimulatorConfigTest {

    private static SimulatorConfig config(String overrides) {
        return new SimulatorConfig(ConfigFactory.parseString(overrides).withFallback(ConfigFactory.defaultReference()));
    }

    @Test
    void defaultsComeFromReferenceConf() {
        SimulatorConfig c = config("");

        assertEquals("fcfs", c.getScheduler());
        assertEquals(2, c.getQuantum());
        assertEquals(10, c.getResources());
        assertEquals(0, c.getMaxResolutionAttempts());
        assertTrue(c.isInteractive());
        assertTrue(c.createScheduler() instanceof FCFSScheduler);
    }

    @Test
    void schedulerNamesMapToPolicies() {
        assertTrue(config("simulator.scheduler = SJF").createScheduler() instanceof SJFScheduler);
        assertTrue(config("simulator.scheduler = srtf").createScheduler() instanceof SRTFScheduler);

        Scheduler rr = config("simulator { scheduler = rr, quantum = 4 }").createScheduler();
        assertEquals(4, ((StaticRRScheduler) rr).getQuantum());
    }

    @Test
    void badValuesAreRejected() {
        assertThrows(ConfigException.BadValue.class, () -> config("simulator.scheduler = lottery").createScheduler());
        assertThrows(ConfigException.BadValue.class, () -> config("simulator.quantum = 0"));
        assertThrows(ConfigException.BadValue.class, () -> config("simulator.resources = 0"));
        assertThrows(ConfigException.BadValue.class, () -> config("simulator.max-resolution-attempts = -1"));
    }
}

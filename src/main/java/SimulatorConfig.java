import java.util.Locale;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

// Defaults in reference.conf, overridable with -Dsimulator.<key>=...
public class SimulatorConfig {
    private final String scheduler;
    private final int quantum;
    private final int resources;
    private final int maxResolutionAttempts;
    private final boolean interactive;

    public SimulatorConfig(Config root) {
        Config c = root.getConfig("simulator");
        this.scheduler = c.getString("scheduler").toLowerCase(Locale.ROOT);
        this.quantum = c.getInt("quantum");
        this.resources = c.getInt("resources");
        this.maxResolutionAttempts = c.getInt("max-resolution-attempts");
        this.interactive = c.getBoolean("interactive");

        if (quantum < 1) throw new ConfigException.BadValue("simulator.quantum", "must be at least 1");
        if (resources < 1) throw new ConfigException.BadValue("simulator.resources", "must be at least 1");
        if (maxResolutionAttempts < 0) {
            throw new ConfigException.BadValue("simulator.max-resolution-attempts", "must be 0 (unlimited) or more");
        }
    }

    public static SimulatorConfig load() {
        return new SimulatorConfig(ConfigFactory.load());
    }

    public Scheduler createScheduler() {
        return createScheduler(scheduler, quantum);
    }

    public static Scheduler createScheduler(String name, int quantum) {
        switch (name) {
            case "fcfs": return new FCFSScheduler();
            case "sjf":  return new SJFScheduler();
            case "srtf": return new SRTFScheduler();
            case "rr":   return new StaticRRScheduler(quantum);
            default:
                throw new ConfigException.BadValue("simulator.scheduler", "unknown scheduler '" + name + "'");
        }
    }

    public String getScheduler() { return scheduler; }
    public int getQuantum() { return quantum; }
    public int getResources() { return resources; }
    public int getMaxResolutionAttempts() { return maxResolutionAttempts; }
    public boolean isInteractive() { return interactive; }
}

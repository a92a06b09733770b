import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SimulationController {
    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final BufferedReader operator;
    private final PrintWriter out;
    private final SimulatorConfig config;
    private final List<Job> jobs;

    private final List<SimulationEvent> actionLog = new ArrayList<>();
    private PrManager prManager;

    public SimulationController(BufferedReader programs, BufferedReader operator, PrintWriter out,
                                SimulatorConfig config) throws IOException, ProgramFormatException {
        this.operator = operator;
        this.out = out;
        this.config = config;
        this.jobs = new ProgramLoader().load(programs);
        log.info("Loaded {} programs", jobs.size());
    }

    public void run() throws IOException {
        Scheduler scheduler = config.isInteractive() ? askScheduler() : config.createScheduler();
        DeadlockResolver resolver = new ConsoleResolver(operator, out);

        prManager = new PrManager(jobs, scheduler, new ResourceTable(config.getResources()),
                resolver, this::onEvent, config.getMaxResolutionAttempts());
        out.println("Running " + jobs.size() + " processes with " + scheduler.name());
        try {
            prManager.runToCompletion();
        } finally {
            printSummary();
            out.flush();
        }
    }

    // ---- scheduler choice ----
    private Scheduler askScheduler() throws IOException {
        out.println("Choose scheduling algorithm:");
        out.println("1. First-Come-First-Serve (FCFS)");
        out.println("2. Shortest Job First (SJF)");
        out.println("3. Round Robin (RR)");
        String choice = prompt("Enter choice (1/2/3): ");

        switch (choice) {
            case "1":
                return new FCFSScheduler();
            case "2":
                out.println("SJF selected. Choose type:");
                out.println("1. Non-preemptive");
                out.println("2. Preemptive (SRTF)");
                return "2".equals(prompt("Enter choice (1/2): ")) ? new SRTFScheduler() : new SJFScheduler();
            case "3":
                String q = prompt("Enter time quantum (default=" + config.getQuantum() + "): ");
                try {
                    return new StaticRRScheduler(Integer.parseInt(q));
                } catch (NumberFormatException e) {
                    return new StaticRRScheduler(config.getQuantum());
                }
            default:
                out.println("Invalid choice, defaulting to FCFS");
                return new FCFSScheduler();
        }
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        String line = operator.readLine();
        return line == null ? "" : line.trim();
    }

    // ---- running log ----
    private void onEvent(SimulationEvent e) {
        actionLog.add(e);
        out.println(describe(e));
        if (e.type == SimulationEvent.Type.DEADLOCK_DETECTED) printStatus();
    }

    private static String describe(SimulationEvent e) {
        String r = e.resourceId == null ? "" : "R" + e.resourceId;
        switch (e.type) {
            case PROCESS_STARTED:    return e.pid + " started execution";
            case PROCESS_WAITED:     return e.pid + " waits";
            case RESOURCE_GRANTED:   return e.pid + " allocated " + r;
            case RESOURCE_BLOCKED:   return e.pid + " is blocked waiting for " + r;
            case RESOURCE_RELEASED:  return e.pid + " released " + r;
            case PROCESS_PREEMPTED:  return e.pid + " re-queued";
            case DEADLOCK_DETECTED:  return "\nDeadlock detected involving: " + String.join(", ", e.involved);
            case INVALID_RESOLUTION: return r + " is not held by a deadlocked process";
            case FORCED_RELEASE:     return "Force releasing " + r + " from " + e.pid;
            case PROCESS_TERMINATED: return e.pid + " ends and releases all resources";
            case PROCESS_ABORTED:    return e.pid + " aborted: " + r + " does not exist";
            default:                 return e.toString();
        }
    }

    private void printStatus() {
        ResourceTable table = prManager.getResourceTable();
        out.println("\nCurrent Resource Allocation:");
        for (int id : table.resourceIds()) {
            String owner = table.ownerOf(id);
            out.printf("  R%d: %s%n", id, owner == null ? "None" : owner);
        }
        out.println("Waiting List:");
        for (Process p : prManager.snapshotBlocked()) {
            out.printf("  %s -> R%d%n", p.name, p.blockedOn);
        }
        out.println();
    }

    // ---------------- SUMMARY ----------------
    private void printSummary() {
        List<Process> done = prManager.snapshotFinished();
        ResourceTable table = prManager.getResourceTable();

        out.println("\nSimulation Complete!");
        out.println("Completed Processes: " + done.stream()
                .filter(p -> !p.aborted).map(p -> p.name).sorted().collect(Collectors.joining(", ")));

        out.println("Final Resource Allocation:");
        for (int id : table.resourceIds()) {
            String owner = table.ownerOf(id);
            out.printf("  R%d: %s%n", id, owner == null ? "None" : owner);
        }

        List<ResourceTable.Handoff> forced = prManager.snapshotForcedReleases();
        if (!forced.isEmpty()) {
            out.println("Force Released Resources:");
            for (ResourceTable.Handoff h : forced)
                out.printf("  R%d was released from %s%n", h.resourceId, h.formerOwner);
        }

        out.println("\nProcess Completion Table:");
        out.printf("%-10s%-10s%-10s%-15s%-10s%n", "Process", "Start", "Finish", "Turnaround", "Burst Est.");
        for (Process p : done) {
            out.printf("%-10s%-10d%-10d%-15s%-10d%n", p.name, p.startTick, p.completeTick,
                    p.aborted ? "aborted" : String.valueOf(p.turnaround()), p.estimatedBurst);
        }

        out.println("\nAction Log Table:");
        out.printf("%-6s %-8s %-20s %-5s %s%n", "Tick", "Process", "Action", "Res", "Note");
        for (SimulationEvent e : actionLog) {
            out.printf("%-6d %-8s %-20s %-5s %s%n", e.tick, e.pid == null ? "SYSTEM" : e.pid,
                    e.type.name().toLowerCase(Locale.ROOT).replace('_', ' '),
                    e.resourceId == null ? "" : "R" + e.resourceId, note(e));
        }
    }

    private static String note(SimulationEvent e) {
        switch (e.type) {
            case DEADLOCK_DETECTED:  return "involving " + String.join(", ", e.involved);
            case FORCED_RELEASE:     return "to " + (e.newOwner == null ? "none" : e.newOwner);
            case PROCESS_TERMINATED: return "turnaround " + e.turnaround;
            default:                 return "";
        }
    }

    public PrManager getPrManager() {
        return prManager;
    }

    public List<SimulationEvent> getActionLog() {
        return new ArrayList<>(actionLog);
    }
}

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PrManager {
    private static final Logger log = LoggerFactory.getLogger(PrManager.class);

    // 0 keeps asking the resolver until it names a valid resource
    public static final int DEFAULT_MAX_RESOLUTION_ATTEMPTS = 0;

    private final ResourceTable table;
    private final Scheduler cpuScheduler;
    private final DeadlockDetector detector = new DeadlockDetector();
    private final DeadlockResolver resolver;
    private final Consumer<SimulationEvent> listener;
    private final int maxResolutionAttempts;

    // Queues
    private final Map<String, Process> processes = new LinkedHashMap<>();
    private final List<Process> readyQ = new ArrayList<>();
    private final List<Process> finished = new ArrayList<>();
    private final List<ResourceTable.Handoff> forcedReleases = new ArrayList<>();

    private Process running = null;
    private int tick = 0;

    public PrManager(List<Job> jobs, Scheduler scheduler, ResourceTable table,
                     DeadlockResolver resolver, Consumer<SimulationEvent> listener) {
        this(jobs, scheduler, table, resolver, listener, DEFAULT_MAX_RESOLUTION_ATTEMPTS);
    }

    public PrManager(List<Job> jobs, Scheduler scheduler, ResourceTable table,
                     DeadlockResolver resolver, Consumer<SimulationEvent> listener,
                     int maxResolutionAttempts) {
        this.cpuScheduler = scheduler;
        this.table = table;
        this.resolver = resolver;
        this.listener = listener == null ? e -> { } : listener;
        this.maxResolutionAttempts = Math.max(0, maxResolutionAttempts);

        List<Job> ordered = new ArrayList<>(jobs);
        ordered.sort(Comparator.comparingInt(j -> j.arrivalOrder));
        for (Job j : ordered) {
            if (processes.containsKey(j.name)) {
                throw new IllegalArgumentException("Duplicate process id: " + j.name);
            }
            Process p = new Process(j);
            processes.put(p.name, p);
            pushReady(p);
        }
        log.info("Loaded {} processes, scheduler {}", processes.size(), scheduler.name());
    }

    public boolean hasUnfinishedWork() {
        return finished.size() < processes.size();
    }

    public void runToCompletion() {
        while (hasUnfinishedWork()) {
            dispatch();
        }
        log.info("All processes finished at tick {}", tick);
    }

    // One scheduling decision: pick if idle, then execute a single instruction step.
    public void dispatch() {
        if (running == null) {
            if (readyQ.isEmpty()) {
                resolveStall();
                return;
            }
            startNext();
        }
        step(running);
    }

    private void startNext() {
        Process next = cpuScheduler.pickNext(Collections.unmodifiableList(readyQ));
        readyQ.remove(next);
        running = next;
        running.state = ProcessState.RUNNING;
        running.quantumLeft = cpuScheduler.chooseQuantum(running);

        if (running.startTick < 0) {
            running.startTick = tick;
            emit(SimulationEvent.of(SimulationEvent.Type.PROCESS_STARTED, running.name, null, tick));
        }
        log.debug("t={} dispatch {} (quantum {})", tick, running.name, running.quantumLeft);
    }

    private void step(Process p) {
        if (!p.hasNextInstruction()) {
            // script ran out without an explicit end
            terminate(p);
            return;
        }

        Instruction in = p.currentInstruction();
        switch (in.type) {
            case REQUEST:
                request(p, in.arg);
                break;
            case WAIT:
                doWait(p, in.arg);
                break;
            case END:
                tick++;
                terminate(p);
                break;
        }

        if (running == p && p.quantumLeft <= 0) {
            // Time slice expired, back of the queue
            p.state = ProcessState.READY;
            pushReady(p);
            running = null;
            emit(SimulationEvent.of(SimulationEvent.Type.PROCESS_PREEMPTED, p.name, null, tick));
            log.debug("t={} {} preempted, {} instructions left", tick, p.name, p.remainingInstructions());
        }
    }

    private void request(Process p, int resourceId) {
        if (!table.isDeclared(resourceId)) {
            abort(p, resourceId);
            return;
        }

        tick++;
        p.quantumLeft--;
        if (table.tryAcquire(resourceId, p.name) == ResourceTable.Outcome.GRANTED) {
            p.held.add(resourceId);
            p.pc++;
            emit(SimulationEvent.of(SimulationEvent.Type.RESOURCE_GRANTED, p.name, resourceId, tick));
            log.debug("t={} {} allocated R{}", tick, p.name, resourceId);
            return;
        }

        p.state = ProcessState.BLOCKED;
        p.blockedOn = resourceId;
        running = null;
        emit(SimulationEvent.of(SimulationEvent.Type.RESOURCE_BLOCKED, p.name, resourceId, tick));
        log.debug("t={} {} blocked on R{} held by {}", tick, p.name, resourceId, table.ownerOf(resourceId));

        checkForDeadlock();
    }

    private void doWait(Process p, int ticks) {
        if (ticks <= 0) {
            p.pc++;
            return;
        }
        if (p.waitRemaining == 0) p.waitRemaining = ticks;

        tick++;
        p.quantumLeft--;
        p.waitRemaining--;
        emit(SimulationEvent.of(SimulationEvent.Type.PROCESS_WAITED, p.name, null, tick));
        if (p.waitRemaining == 0) p.pc++;
    }

    private void terminate(Process p) {
        retire(p);
        emit(SimulationEvent.terminated(p.name, p.turnaround(), tick));
        log.debug("t={} {} terminated, turnaround {}", tick, p.name, p.turnaround());
    }

    private void abort(Process p, int resourceId) {
        SimulationException e = new SimulationException(SimulationException.Kind.UNKNOWN_RESOURCE,
                p.name, resourceId, tick, "Request for undeclared resource");
        log.error("Aborting {}: {}", p.name, e.getMessage());
        p.aborted = true;
        emit(SimulationEvent.of(SimulationEvent.Type.PROCESS_ABORTED, p.name, resourceId, tick));
        retire(p);
    }

    // Moves p to TERMINATED and hands every resource it held to the next waiter.
    private void retire(Process p) {
        p.state = ProcessState.TERMINATED;
        p.completeTick = tick;
        p.blockedOn = null;
        p.waitRemaining = 0;
        if (running == p) running = null;
        finished.add(p);

        for (ResourceTable.Handoff h : table.releaseAll(p.name)) {
            p.held.remove(h.resourceId);
            emit(SimulationEvent.of(SimulationEvent.Type.RESOURCE_RELEASED, p.name, h.resourceId, tick));
            if (h.newOwner != null) grantWaiter(h.newOwner, h.resourceId);
        }
    }

    // The waiter's pending request completes now; it rejoins the ready queue at the tail.
    private void grantWaiter(String pid, int resourceId) {
        Process w = processes.get(pid);
        w.held.add(resourceId);
        w.blockedOn = null;
        w.pc++;
        w.state = ProcessState.READY;
        pushReady(w);
        emit(SimulationEvent.of(SimulationEvent.Type.RESOURCE_GRANTED, w.name, resourceId, tick));
        log.debug("t={} {} acquired R{} after wait", tick, w.name, resourceId);
    }

    private void checkForDeadlock() {
        List<String> cycle = detector.detect(processes.values(), table);
        while (!cycle.isEmpty()) {
            resolve(cycle);
            cycle = detector.detect(processes.values(), table);
        }
    }

    private void resolveStall() {
        List<String> cycle = detector.detect(processes.values(), table);
        if (cycle.isEmpty()) {
            SimulationException e = new SimulationException(SimulationException.Kind.STALL_WITHOUT_CYCLE,
                    null, null, tick, "No process can run and no circular wait exists: " + processes.values());
            log.error(e.getMessage());
            throw e;
        }
        checkForDeadlock();
    }

    private void resolve(List<String> cycle) {
        emit(SimulationEvent.deadlock(cycle, tick));
        List<Integer> candidates = detector.cycleResources(cycle, processes.values());
        log.warn("t={} deadlock detected involving {} (resources {})", tick, cycle, candidates);

        int choice = -1;
        for (int attempt = 1; maxResolutionAttempts == 0 || attempt <= maxResolutionAttempts; attempt++) {
            choice = resolver.chooseResourceToRelease(candidates);
            String owner = table.isDeclared(choice) ? table.ownerOf(choice) : null;
            if (owner != null && cycle.contains(owner)) {
                forceRelease(choice);
                return;
            }
            emit(SimulationEvent.of(SimulationEvent.Type.INVALID_RESOLUTION, null, choice, tick));
            log.warn("R{} is not held by a process on the cycle (attempt {})", choice, attempt);
        }
        SimulationException e = new SimulationException(SimulationException.Kind.INVALID_RESOLUTION,
                null, choice, tick, "No valid resource chosen to break deadlock " + cycle);
        log.error(e.getMessage());
        throw e;
    }

    private void forceRelease(int resourceId) {
        ResourceTable.Handoff h = table.forceRelease(resourceId);
        // the former owner loses it for good; it is not requested again on its behalf
        processes.get(h.formerOwner).held.remove(resourceId);
        forcedReleases.add(h);
        emit(SimulationEvent.forcedRelease(resourceId, h.formerOwner, h.newOwner, tick));
        log.info("t={} force released R{} from {}", tick, resourceId, h.formerOwner);

        if (h.newOwner != null) grantWaiter(h.newOwner, resourceId);
    }

    private void pushReady(Process p) {
        p.state = ProcessState.READY;
        readyQ.add(p);
    }

    private void emit(SimulationEvent e) {
        listener.accept(e);
    }

    // Snapshots for display and tests
    public int getTick() {
        return tick;
    }

    public Process getRunning() {
        return running;
    }

    public Process getProcess(String pid) {
        return processes.get(pid);
    }

    public Collection<Process> getProcesses() {
        return Collections.unmodifiableCollection(processes.values());
    }

    public List<Process> snapshotReady() {
        return new ArrayList<>(readyQ);
    }

    public List<Process> snapshotBlocked() {
        List<Process> out = new ArrayList<>();
        for (Process p : processes.values()) {
            if (p.state == ProcessState.BLOCKED) out.add(p);
        }
        return out;
    }

    public List<Process> snapshotFinished() {
        return new ArrayList<>(finished);
    }

    public List<ResourceTable.Handoff> snapshotForcedReleases() {
        return new ArrayList<>(forcedReleases);
    }

    public ResourceTable getResourceTable() {
        return table;
    }

    public Scheduler getScheduler() {
        return cpuScheduler;
    }
}

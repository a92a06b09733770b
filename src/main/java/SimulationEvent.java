import java.util.List;

public class SimulationEvent {
    public enum Type {
        PROCESS_STARTED,
        PROCESS_WAITED,
        RESOURCE_GRANTED,
        RESOURCE_BLOCKED,
        RESOURCE_RELEASED,
        PROCESS_PREEMPTED,
        DEADLOCK_DETECTED,
        INVALID_RESOLUTION,
        FORCED_RELEASE,
        PROCESS_TERMINATED,
        PROCESS_ABORTED
    }

    public final Type type;
    public final int tick;
    public final String pid;             // acting process, former owner for FORCED_RELEASE
    public final Integer resourceId;
    public final String newOwner;        // FORCED_RELEASE only
    public final List<String> involved;  // DEADLOCK_DETECTED only
    public final int turnaround;         // PROCESS_TERMINATED only

    private SimulationEvent(Type type, int tick, String pid, Integer resourceId,
                            String newOwner, List<String> involved, int turnaround) {
        this.type = type;
        this.tick = tick;
        this.pid = pid;
        this.resourceId = resourceId;
        this.newOwner = newOwner;
        this.involved = involved == null ? List.of() : List.copyOf(involved);
        this.turnaround = turnaround;
    }

    public static SimulationEvent of(Type type, String pid, Integer resourceId, int tick) {
        return new SimulationEvent(type, tick, pid, resourceId, null, null, -1);
    }

    public static SimulationEvent deadlock(List<String> involved, int tick) {
        return new SimulationEvent(Type.DEADLOCK_DETECTED, tick, null, null, null, involved, -1);
    }

    public static SimulationEvent forcedRelease(int resourceId, String formerOwner, String newOwner, int tick) {
        return new SimulationEvent(Type.FORCED_RELEASE, tick, formerOwner, resourceId, newOwner, null, -1);
    }

    public static SimulationEvent terminated(String pid, int turnaround, int tick) {
        return new SimulationEvent(Type.PROCESS_TERMINATED, tick, pid, null, null, null, turnaround);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(tick).append(' ').append(type);
        if (pid != null) sb.append(' ').append(pid);
        if (resourceId != null) sb.append(" R").append(resourceId);
        if (type == Type.FORCED_RELEASE) sb.append(" -> ").append(newOwner == null ? "none" : newOwner);
        if (!involved.isEmpty()) sb.append(' ').append(involved);
        if (turnaround >= 0) sb.append(" turnaround=").append(turnaround);
        return sb.toString();
    }
}

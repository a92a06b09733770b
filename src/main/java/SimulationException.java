public class SimulationException extends RuntimeException {
    public enum Kind {
        UNKNOWN_RESOURCE,
        INVALID_RESOLUTION,
        // nothing can run and there is no cycle: engine bug
        STALL_WITHOUT_CYCLE
    }

    private final Kind kind;
    private final String processId;
    private final Integer resourceId;
    private final int tick;

    public SimulationException(Kind kind, String processId, Integer resourceId, int tick, String message) {
        super(message + describe(processId, resourceId, tick));
        this.kind = kind;
        this.processId = processId;
        this.resourceId = resourceId;
        this.tick = tick;
    }

    private static String describe(String processId, Integer resourceId, int tick) {
        StringBuilder sb = new StringBuilder(" [tick=").append(tick);
        if (processId != null) sb.append(", process=").append(processId);
        if (resourceId != null) sb.append(", resource=R").append(resourceId);
        return sb.append(']').toString();
    }

    public Kind getKind() { return kind; }
    public String getProcessId() { return processId; }
    public Integer getResourceId() { return resourceId; }
    public int getTick() { return tick; }
}

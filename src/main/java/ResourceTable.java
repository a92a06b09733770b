import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ResourceTable {
    public enum Outcome { GRANTED, ENQUEUED }

    // newOwner is null when nobody waited
    public static class Handoff {
        public final int resourceId;
        public final String formerOwner;
        public final String newOwner;

        Handoff(int resourceId, String formerOwner, String newOwner) {
            this.resourceId = resourceId;
            this.formerOwner = formerOwner;
            this.newOwner = newOwner;
        }

        @Override
        public String toString() {
            return "R" + resourceId + ": " + formerOwner + " -> " + (newOwner == null ? "none" : newOwner);
        }
    }

    private final Map<Integer, String> owner = new TreeMap<>();
    private final Map<Integer, Deque<String>> waiting = new TreeMap<>();

    public ResourceTable(int resourceCount) {
        for (int id = 0; id < resourceCount; id++) {
            waiting.put(id, new ArrayDeque<>());
        }
    }

    public boolean isDeclared(int resourceId) {
        return waiting.containsKey(resourceId);
    }

    public List<Integer> resourceIds() {
        return new ArrayList<>(waiting.keySet());
    }

    public Outcome tryAcquire(int resourceId, String pid) {
        Deque<String> q = queueOf(resourceId);
        String current = owner.get(resourceId);

        if (current == null) {
            owner.put(resourceId, pid);
            return Outcome.GRANTED;
        }
        // re-request of something already held is a no-op grant
        if (current.equals(pid)) return Outcome.GRANTED;

        if (!q.contains(pid)) q.addLast(pid);
        return Outcome.ENQUEUED;
    }

    public List<Handoff> releaseAll(String pid) {
        List<Handoff> out = new ArrayList<>();
        for (Integer id : ownedBy(pid)) {
            out.add(handOn(id, pid));
        }
        // a terminating process may not linger in any queue
        for (Deque<String> q : waiting.values()) q.remove(pid);
        return out;
    }

    public Handoff forceRelease(int resourceId) {
        queueOf(resourceId);
        return handOn(resourceId, owner.get(resourceId));
    }

    private Handoff handOn(int resourceId, String formerOwner) {
        owner.remove(resourceId);
        String next = waiting.get(resourceId).pollFirst();
        if (next != null) owner.put(resourceId, next);
        return new Handoff(resourceId, formerOwner, next);
    }

    public String ownerOf(int resourceId) {
        queueOf(resourceId);
        return owner.get(resourceId);
    }

    public List<String> waitersOf(int resourceId) {
        return Collections.unmodifiableList(new ArrayList<>(queueOf(resourceId)));
    }

    public List<Integer> ownedBy(String pid) {
        List<Integer> ids = new ArrayList<>();
        for (Map.Entry<Integer, String> e : owner.entrySet()) {
            if (e.getValue().equals(pid)) ids.add(e.getKey());
        }
        return ids;
    }

    // the resource pid is queued on, or null
    public Integer awaitedBy(String pid) {
        for (Map.Entry<Integer, Deque<String>> e : waiting.entrySet()) {
            if (e.getValue().contains(pid)) return e.getKey();
        }
        return null;
    }

    private Deque<String> queueOf(int resourceId) {
        Deque<String> q = waiting.get(resourceId);
        if (q == null) {
            throw new SimulationException(SimulationException.Kind.UNKNOWN_RESOURCE, null, resourceId, -1,
                    "Resource R" + resourceId + " is not declared");
        }
        return q;
    }
}

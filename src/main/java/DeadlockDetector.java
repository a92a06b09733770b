import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

// Wait-for graph is rebuilt on every call: P -> Q when P is blocked on a resource Q owns.
public class DeadlockDetector {
    private static final int WHITE = 0, GREY = 1, BLACK = 2;

    // first cycle found, in wait-for order; empty when there is none
    public List<String> detect(Collection<Process> processes, ResourceTable table) {
        Map<String, String> waitsFor = buildGraph(processes, table);

        Map<String, Integer> colour = new HashMap<>();
        for (String pid : waitsFor.keySet()) {
            if (colour.getOrDefault(pid, WHITE) != WHITE) continue;
            List<String> path = new ArrayList<>();
            List<String> cycle = visit(pid, waitsFor, colour, path);
            if (!cycle.isEmpty()) return cycle;
        }
        return new ArrayList<>();
    }

    private List<String> visit(String pid, Map<String, String> waitsFor,
                               Map<String, Integer> colour, List<String> path) {
        colour.put(pid, GREY);
        path.add(pid);

        // a blocked process waits on exactly one resource, so out-degree is at most 1
        String next = waitsFor.get(pid);
        if (next != null) {
            int c = colour.getOrDefault(next, WHITE);
            if (c == GREY) {
                return new ArrayList<>(path.subList(path.indexOf(next), path.size()));
            }
            if (c == WHITE) {
                List<String> cycle = visit(next, waitsFor, colour, path);
                if (!cycle.isEmpty()) return cycle;
            }
        }

        colour.put(pid, BLACK);
        path.remove(path.size() - 1);
        return new ArrayList<>();
    }

    private Map<String, String> buildGraph(Collection<Process> processes, ResourceTable table) {
        Map<String, String> edges = new LinkedHashMap<>();
        for (Process p : processes) {
            if (p.state != ProcessState.BLOCKED || p.blockedOn == null) continue;
            String owner = table.ownerOf(p.blockedOn);
            if (owner != null) edges.put(p.name, owner);
        }
        return edges;
    }

    // resources on the cycle's edges, offered to the operator
    public List<Integer> cycleResources(List<String> cycle, Collection<Process> processes) {
        TreeSet<Integer> ids = new TreeSet<>();
        for (Process p : processes) {
            if (cycle.contains(p.name) && p.blockedOn != null) ids.add(p.blockedOn);
        }
        return new ArrayList<>(ids);
    }
}

import java.util.List;

public class StaticRRScheduler implements Scheduler {
    private final int quantum;

    public StaticRRScheduler(int q) {
        this.quantum = Math.max(1, q);
    }

    @Override
    public Process pickNext(List<Process> readyQ) {
        return readyQ.isEmpty() ? null : readyQ.get(0);
    }

    @Override
    public int chooseQuantum(Process running) {
        return quantum;
    }

    public int getQuantum() {
        return quantum;
    }

    @Override
    public String name() {
        return "RR(q=" + quantum + ")";
    }
}

import java.util.List;

public class FCFSScheduler implements Scheduler {
    @Override
    public Process pickNext(List<Process> readyQ) {
        return readyQ.isEmpty() ? null : readyQ.get(0);
    }

    @Override
    public int chooseQuantum(Process running) {
        // non-preemptive: runs until it blocks or ends
        return Integer.MAX_VALUE;
    }

    @Override
    public String name() {
        return "FCFS";
    }
}

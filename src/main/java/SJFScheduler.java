import java.util.Comparator;
import java.util.List;

public class SJFScheduler implements Scheduler {
    // arrival order, then name, so equal jobs always come out the same way
    static final Comparator<Process> TIE_BREAK =
            Comparator.<Process>comparingInt(p -> p.arrivalOrder).thenComparing(p -> p.name);

    private static final Comparator<Process> ORDER =
            Comparator.comparingInt(Process::remainingInstructions).thenComparing(TIE_BREAK);

    @Override
    public Process pickNext(List<Process> readyQ) {
        return readyQ.stream().min(ORDER).orElse(null);
    }

    @Override
    public int chooseQuantum(Process running) {
        return Integer.MAX_VALUE;
    }

    @Override
    public String name() {
        return "SJF";
    }
}

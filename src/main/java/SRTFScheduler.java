import java.util.Comparator;
import java.util.List;

// Preemptive SJF, re-chosen after every time unit
public class SRTFScheduler implements Scheduler {
    private static final Comparator<Process> ORDER =
            Comparator.comparingInt(Process::remainingBurst).thenComparing(SJFScheduler.TIE_BREAK);

    @Override
    public Process pickNext(List<Process> readyQ) {
        return readyQ.stream().min(ORDER).orElse(null);
    }

    @Override
    public int chooseQuantum(Process running) {
        return 1;
    }

    @Override
    public String name() {
        return "SRTF";
    }
}

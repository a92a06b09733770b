import java.util.List;

public interface Scheduler {
    // Picks from the ready queue without removing; the engine does admission and removal.
    Process pickNext(List<Process> readyQ);

    // How many time units the picked process may consume before it is sent back to the queue.
    int chooseQuantum(Process running);

    String name();
}

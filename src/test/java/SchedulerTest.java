import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class SchedulerTest {

    private static Process process(String name, int arrival, Instruction... script) {
        return new Process(new Job(name, arrival, List.of(script)));
    }

    @Test
    void fcfsTakesHeadWithoutRemovingIt() {
        Process a = process("A", 0, Instruction.waitFor(5), Instruction.end());
        Process b = process("B", 1, Instruction.end());
        List<Process> ready = new ArrayList<>(List.of(a, b));

        FCFSScheduler fcfs = new FCFSScheduler();

        assertSame(a, fcfs.pickNext(ready));
        assertEquals(2, ready.size());
        assertEquals(Integer.MAX_VALUE, fcfs.chooseQuantum(a));
        assertNull(fcfs.pickNext(new ArrayList<>()));
    }

    @Test
    void sjfPrefersFewestRemainingInstructions() {
        Process longer = process("A", 0, Instruction.request(1), Instruction.waitFor(1), Instruction.end());
        Process shorter = process("B", 1, Instruction.waitFor(9), Instruction.end());

        assertSame(shorter, new SJFScheduler().pickNext(List.of(longer, shorter)));
    }

    @Test
    void sjfBreaksTiesByArrivalThenId() {
        Process late = process("A", 1, Instruction.end());
        Process early = process("Z", 0, Instruction.end());
        assertSame(early, new SJFScheduler().pickNext(List.of(late, early)));

        Process b = process("P2", 0, Instruction.end());
        Process a = process("P1", 0, Instruction.end());
        SJFScheduler sjf = new SJFScheduler();
        for (int i = 0; i < 5; i++) {
            assertSame(a, sjf.pickNext(List.of(b, a)));
        }
    }

    @Test
    void srtfUsesRemainingBurstRatherThanInstructionCount() {
        Process oneLongWait = process("A", 0, Instruction.waitFor(5));
        Process threeShortWaits = process("B", 1, Instruction.waitFor(1), Instruction.waitFor(1), Instruction.waitFor(1));
        List<Process> ready = List.of(oneLongWait, threeShortWaits);

        assertSame(threeShortWaits, new SRTFScheduler().pickNext(ready));
        assertSame(oneLongWait, new SJFScheduler().pickNext(ready));
        assertEquals(1, new SRTFScheduler().chooseQuantum(oneLongWait));
    }

    @Test
    void remainingBurstCountsInProgressWait() {
        Process p = process("A", 0, Instruction.waitFor(4), Instruction.end());
        p.waitRemaining = 1;

        assertEquals(2, p.remainingBurst());
    }

    @Test
    void roundRobinQuantumIsAtLeastOne() {
        StaticRRScheduler rr = new StaticRRScheduler(0);
        Process p = process("A", 0, Instruction.end());

        assertEquals(1, rr.chooseQuantum(p));
        assertEquals(3, new StaticRRScheduler(3).chooseQuantum(p));
    }
}

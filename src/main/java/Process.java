import java.util.List;
import java.util.TreeSet;

public class Process {
    public final String name;
    public final int arrivalOrder;
    public final List<Instruction> instructions;
    public final int estimatedBurst;

    // runtime bookkeeping, only touched by PrManager
    public ProcessState state = ProcessState.NEW;
    public int pc = 0;
    public final TreeSet<Integer> held = new TreeSet<>();
    public Integer blockedOn = null;
    public int waitRemaining = 0;
    public int quantumLeft = 0;

    public final int arrivalTick = 0;
    public int startTick = -1;
    public int completeTick = -1;
    public boolean aborted = false;

    public Process(Job j) {
        this.name = j.name;
        this.arrivalOrder = j.arrivalOrder;
        this.instructions = j.instructions;
        this.estimatedBurst = j.estimatedBurst;
    }

    public boolean hasNextInstruction() {
        return pc < instructions.size();
    }

    public Instruction currentInstruction() {
        return instructions.get(pc);
    }

    public int remainingInstructions() {
        return instructions.size() - pc;
    }

    // time units still needed to finish the script, counting an in-progress wait
    public int remainingBurst() {
        int total = 0;
        for (int i = pc; i < instructions.size(); i++) {
            Instruction in = instructions.get(i);
            if (i == pc && in.type == Instruction.Type.WAIT && waitRemaining > 0) total += waitRemaining;
            else total += in.cost();
        }
        return total;
    }

    public int turnaround() {
        return completeTick < 0 ? -1 : completeTick - arrivalTick;
    }

    @Override
    public String toString() {
        return name + "[" + state + ", pc=" + pc + ", held=" + held + "]";
    }
}

import java.util.List;

public class Job {
    public final String name;
    public final int arrivalOrder;
    public final List<Instruction> instructions;
    public final int estimatedBurst;

    public Job(String name, int arrivalOrder, List<Instruction> instructions) {
        this.name = name;
        this.arrivalOrder = arrivalOrder;
        this.instructions = List.copyOf(instructions);

        int burst = 0;
        for (Instruction in : this.instructions) burst += in.cost();
        this.estimatedBurst = burst;
    }

    @Override
    public String toString() {
        return name + " " + instructions;
    }
}

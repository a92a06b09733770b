public final class Instruction {
    public enum Type { REQUEST, WAIT, END }

    private static final Instruction END_INSTRUCTION = new Instruction(Type.END, 0);

    public final Type type;
    // resource id for REQUEST, tick count for WAIT, unused for END
    public final int arg;

    private Instruction(Type type, int arg) {
        this.type = type;
        this.arg = arg;
    }

    public static Instruction request(int resourceId) {
        return new Instruction(Type.REQUEST, resourceId);
    }

    public static Instruction waitFor(int ticks) {
        return new Instruction(Type.WAIT, ticks);
    }

    public static Instruction end() {
        return END_INSTRUCTION;
    }

    // time units this instruction consumes when it runs to completion
    public int cost() {
        switch (type) {
            case WAIT:
                return Math.max(0, arg);
            default:
                return 1;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction other = (Instruction) o;
        return type == other.type && arg == other.arg;
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + arg;
    }

    @Override
    public String toString() {
        switch (type) {
            case REQUEST: return "resource(" + arg + ", allocate)";
            case WAIT:    return "wait(" + arg + ")";
            default:      return "end";
        }
    }
}

public class ProgramFormatException extends Exception {
    private final int lineNumber;

    public ProgramFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class ConsoleResolver implements DeadlockResolver {
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleResolver(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public int chooseResourceToRelease(List<Integer> candidates) {
        String listed = candidates.stream().map(r -> "R" + r).collect(Collectors.joining(", "));
        while (true) {
            out.println("Resources involved in deadlock: " + listed);
            out.print("Enter the resource ID (e.g. 1 for R1) to release: ");
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (line == null) {
                throw new IllegalStateException("Operator input closed while a deadlock was pending");
            }

            line = line.trim();
            if (line.toUpperCase(Locale.ROOT).startsWith("R")) line = line.substring(1);
            try {
                return Integer.parseInt(line);
            } catch (NumberFormatException e) {
                out.println("Invalid input. Please enter one of: " + candidates);
            }
        }
    }
}

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads program definitions:
 * <pre>
 * # comment
 * program P1
 * resource(1, allocate)
 * wait(2)
 * end
 * </pre>
 * {@code for} / {@code next} lines are accepted and ignored.
 */
public class ProgramLoader {
    private static final Pattern PROGRAM = Pattern.compile("program\\s+(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RESOURCE = Pattern.compile("resource\\s*\\(\\s*([^,\\s)]+)\\s*,\\s*(\\w+)\\s*\\)");
    private static final Pattern LOOP_MARKER = Pattern.compile("for\\b.*|next");
    private static final Pattern WAIT = Pattern.compile("wait\\s*\\(\\s*([^)\\s]+)\\s*\\)");

    public List<Job> load(BufferedReader in) throws IOException, ProgramFormatException {
        Map<String, List<Instruction>> programs = new LinkedHashMap<>();
        List<Instruction> current = null;

        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String lower = line.toLowerCase(Locale.ROOT);
            Matcher m;
            if ((m = PROGRAM.matcher(line)).matches()) {
                String name = m.group(1);
                if (programs.containsKey(name)) {
                    throw new ProgramFormatException(lineNo, "duplicate program " + name);
                }
                current = new ArrayList<>();
                programs.put(name, current);
                continue;
            }
            if (LOOP_MARKER.matcher(lower).matches()) continue;
            if (current == null) {
                throw new ProgramFormatException(lineNo, "instruction outside of a program: " + line);
            }

            if ((m = RESOURCE.matcher(lower)).matches()) {
                if (!m.group(2).equals("allocate")) {
                    throw new ProgramFormatException(lineNo, "unsupported resource operation " + m.group(2));
                }
                current.add(Instruction.request(parseNumber(m.group(1), lineNo)));
            } else if ((m = WAIT.matcher(lower)).matches()) {
                current.add(Instruction.waitFor(parseNumber(m.group(1), lineNo)));
            } else if (lower.equals("end")) {
                current.add(Instruction.end());
            } else {
                throw new ProgramFormatException(lineNo, "unknown instruction: " + line);
            }
        }

        List<Job> jobs = new ArrayList<>();
        int order = 0;
        for (Map.Entry<String, List<Instruction>> e : programs.entrySet()) {
            jobs.add(new Job(e.getKey(), order++, e.getValue()));
        }
        return jobs;
    }

    private static int parseNumber(String text, int lineNo) throws ProgramFormatException {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ProgramFormatException(lineNo, "not a number: " + text);
        }
    }
}

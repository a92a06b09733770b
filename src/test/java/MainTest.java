import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;

class MainTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String operatorInput, String... args) {
        return Main.run(args, new ByteArrayInputStream(operatorInput.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(stdout, true), new PrintStream(stderr, true));
    }

    private static String program(String name) throws Exception {
        return Paths.get(MainTest.class.getResource(name).toURI()).toString();
    }

    @Test
    void operatorInputClosingDuringDeadlockIsReported() throws Exception {
        int status = run("3\n1\n", program("/programs/deadlock.txt"));

        assertEquals(4, status);
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Operator input closed"));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Deadlock detected involving: P1, P2"));
    }

    @Test
    void completedRunExitsCleanly() throws Exception {
        int status = run("3\n1\n1\n", program("/programs/deadlock.txt"));

        assertEquals(0, status);
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Completed Processes: P1, P2"));
        assertEquals("", stderr.toString(StandardCharsets.UTF_8));
    }

    @Test
    void missingProgramFileAndBadUsage() {
        assertEquals(1, run("", "no-such-program.txt"));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("not found"));

        assertEquals(1, run(""));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Usage"));
    }
}

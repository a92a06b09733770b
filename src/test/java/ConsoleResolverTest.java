import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import org.junit.jupiter.api.Test;

class ConsoleResolverTest {

    private final StringWriter output = new StringWriter();

    private ConsoleResolver resolver(String input) {
        return new ConsoleResolver(new BufferedReader(new StringReader(input)), new PrintWriter(output, true));
    }

    @Test
    void readsPlainNumber() {
        assertEquals(2, resolver("2\n").chooseResourceToRelease(List.of(1, 2)));
        assertTrue(output.toString().contains("Resources involved in deadlock: R1, R2"));
    }

    @Test
    void acceptsResourcePrefixAndRepromptsOnGarbage() {
        assertEquals(1, resolver("abc\nR1\n").chooseResourceToRelease(List.of(1, 2)));
        assertTrue(output.toString().contains("Invalid input"));
    }

    @Test
    void closedInputFails() {
        assertThrows(IllegalStateException.class, () -> resolver("").chooseResourceToRelease(List.of(1)));
    }
}

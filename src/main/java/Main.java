import java.io.*;
import java.nio.charset.StandardCharsets;

import com.typesafe.config.ConfigException;

public class Main {
    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    // exit status: 0 ok, 1 bad input or config, 2 I/O, 3 simulation failed, 4 operator input gone
    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        if (args.length < 1 || args.length > 2) {
            stderr.println("Usage: java Main <program.txt> [output.txt]");
            return 1;
        }
        String inputPath = args[0];
        String outputPath = (args.length == 2) ? args[1] : null;

        BufferedReader operator = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        try (BufferedReader br = new BufferedReader(new FileReader(inputPath));
             PrintWriter out = (outputPath == null)
                     ? new PrintWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8), true)
                     : new PrintWriter(new FileWriter(outputPath))) {

            SimulationController controller = new SimulationController(br, operator, out, SimulatorConfig.load());
            controller.run();
            return 0;

        } catch (FileNotFoundException e) {
            stderr.println("Error: File '" + inputPath + "' not found.");
            return 1;
        } catch (ProgramFormatException e) {
            stderr.println("Invalid program file: " + e.getMessage());
            return 1;
        } catch (ConfigException e) {
            stderr.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (SimulationException e) {
            stderr.println("Simulation failed (" + e.getKind() + "): " + e.getMessage());
            return 3;
        } catch (IllegalStateException e) {
            stderr.println("Simulation stopped: " + e.getMessage());
            return 4;
        } catch (UncheckedIOException e) {
            stderr.println("Simulation stopped, could not read operator input: " + e.getCause().getMessage());
            return 4;
        } catch (IOException e) {
            stderr.println("I/O Error:");
            e.printStackTrace(stderr);
            return 2;
        }
    }
}

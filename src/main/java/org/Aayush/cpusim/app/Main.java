package org.Aayush.cpusim.app;

import org.Aayush.cpusim.core.SimulationConfig;
import org.Aayush.cpusim.core.SimulationCore;
import org.Aayush.cpusim.core.SimulationException;
import org.Aayush.cpusim.io.ProcessTableLoader;
import org.Aayush.cpusim.io.ReportFormatter;
import org.Aayush.cpusim.process.ProcessTable;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point: simulates every algorithm over one input file.
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    /**
     * @param args a single input file path.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: cpusim <input_file>");
            return EXIT_USAGE;
        }

        SimulationConfig config = SimulationConfig.defaults();
        try {
            SimulationCore core = new SimulationCore(config);
            ProcessTable table = new ProcessTableLoader(core.config().getMaxProcesses()).load(Path.of(args[0]));
            out.print(ReportFormatter.format(core.simulateAll(table)));
            return EXIT_OK;
        } catch (IOException ex) {
            err.println("Error opening file: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (SimulationException ex) {
            if (ex.hasReason(ProcessTableLoader.REASON_INPUT_FORMAT)) {
                err.println(args[0] + ": " + ex.getMessage());
            } else {
                err.println(ex.getMessage());
            }
            return EXIT_FAILURE;
        }
    }
}

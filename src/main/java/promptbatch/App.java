package promptbatch;

import promptbatch.engine.cli.BatchCommand;
import picocli.CommandLine;

/**
 * Command-line entry point.
 */
public final class App {

    private App() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BatchCommand()).execute(args);
        System.exit(code);
    }
}

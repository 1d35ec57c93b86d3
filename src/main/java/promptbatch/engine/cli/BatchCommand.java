package promptbatch.engine.cli;

import picocli.CommandLine.Command;

@Command(
        name = "promptbatch",
        mixinStandardHelpOptions = true,
        version = "promptbatch 1.0.0",
        description = "Daily prompt batch engine",
        subcommands = {
                ServeCommand.class,
                CheckCommand.class
        }
)
public final class BatchCommand implements Runnable {

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | check");
    }
}

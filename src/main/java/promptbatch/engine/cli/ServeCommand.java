package promptbatch.engine.cli;

import promptbatch.engine.config.Dependencies;
import promptbatch.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Runs the HTTP API together with the in-process scheduler until the process is stopped.
 */
@Command(name = "serve", description = "Run the HTTP API, the daily trigger and the reconciler")
final class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Option(names = {"--config"}, description = "INI configuration file")
    File configFile;

    @Option(names = {"--no-scheduler"}, description = "Serve the API only; rely on external cron calls")
    boolean noScheduler;

    @Override
    public Integer call() throws Exception {
        EngineConfig config = EngineConfig.load(configFile);
        Dependencies deps = Dependencies.create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(deps::close, "promptbatch-shutdown"));

        deps.httpServer().start();
        if (!noScheduler) {
            deps.startScheduler();
        }
        log.info("promptbatch serving on port {}", config.serverPort());

        deps.httpServer().awaitClose();
        return 0;
    }
}

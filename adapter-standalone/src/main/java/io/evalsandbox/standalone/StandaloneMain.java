package io.evalsandbox.standalone;

import io.evalsandbox.core.runtime.RuntimeRegistry;
import io.evalsandbox.standalone.config.ConfigLoader;
import io.evalsandbox.standalone.config.ReplConfig;
import io.evalsandbox.standalone.repl.LogbackConfigurator;
import io.evalsandbox.standalone.repl.SandboxRepl;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone REPL.
 *
 * <p>
 * Loads configuration, configures Logback, resolves the runtime from the installed runtimes and runs a
 * {@link SandboxRepl} on standard input. On startup failure, logs the error and exits with a non-zero status.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/evalsandbox.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            ReplConfig config = ConfigLoader.loadFromArgs(args, System::getenv);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

            RuntimeRegistry registry = RuntimeRegistry.installed();
            LOG.info("Evaluation runtimes installed: {}", registry.ids());

            SandboxRepl repl = new SandboxRepl(
                    config.sessionFactory(registry),
                    config.memoryLimit(),
                    config.policy(),
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    System.out,
                    System.err,
                    System.console() != null);
            status = repl.run();
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}

package org.n3x.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.universe.ConfigurationException;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static java.lang.System.exit;

/**
 * Command line entry point. Exit codes: 0 the cluster formed and verified, 1 the run failed,
 * 2 invalid arguments or configuration (nothing was booted).
 */
@Slf4j
public class Main {
    static final int EXIT_CONFIGURATION_ERROR = 2;

    @Parameter(names = {"-h", "--help"}, help = true, description = "Show help.")
    boolean help;

    @Parameter(names = "--debug", description = "Debug mode.")
    private boolean debug = false;

    public static void main(String[] args) throws Exception {
        exit(execute(args));
    }

    static int execute(String... args) throws Exception {
        Main main = new Main();

        JCommander jc = JCommander.newBuilder()
                .addObject(main)
                .addCommand("run", new RunCommand())
                .addCommand("validate", new ValidateCommand())
                .build();

        try {
            jc.parse(args);
        } catch (ParameterException ex) {
            log.error(ex.getMessage());
            jc.usage();
            return EXIT_CONFIGURATION_ERROR;
        }

        String cmd = jc.getParsedCommand();
        if (Objects.isNull(cmd) || main.help) {
            jc.usage();
            return EXIT_CONFIGURATION_ERROR;
        }

        if (main.debug) {
            Logger root = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }

        BaseCommand commandObject = (BaseCommand) jc.getCommands().get(cmd).getObjects().get(0);

        try {
            return commandObject.run();
        } catch (ConfigurationException | ParameterException ex) {
            log.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }
    }
}

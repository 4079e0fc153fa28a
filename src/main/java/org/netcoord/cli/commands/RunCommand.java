package org.netcoord.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.netcoord.cli.CommandLineInterface;
import org.netcoord.runtime.RunResult;
import org.netcoord.runtime.ScenarioAssembler;
import org.netcoord.runtime.ScenarioRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the configured scenario once.
 * <p>
 * Exit code 0 when the run completes, 1 when it is aborted or the configuration is unusable.
 */
@Command(
    name = "run",
    description = "Assemble the configured scenario and run it to completion"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"--max-steps"},
        description = "Override netcoord.max-steps"
    )
    private Long maxSteps;

    @Option(
        names = {"--seed"},
        description = "Override netcoord.seed"
    )
    private Long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config;
        try {
            config = applyOverrides(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        RunResult result = new ScenarioRunner().run(config);
        if (result.isCompleted()) {
            out.printf("Run completed after %d step(s): %s%n", result.stepsExecuted(), result.reason());
            return 0;
        }
        String cause = result.error() == null ? "unknown error" : result.error().getMessage();
        err.printf("Run aborted after %d step(s): %s%n", result.stepsExecuted(), cause);
        log.debug("Run aborted", result.error());
        return 1;
    }

    Config applyOverrides(Config config) {
        Config result = config;
        if (maxSteps != null) {
            result = result.withValue(ScenarioAssembler.ROOT_PATH + ".max-steps", ConfigValueFactory.fromAnyRef(maxSteps));
        }
        if (seed != null) {
            result = result.withValue(ScenarioAssembler.ROOT_PATH + ".seed", ConfigValueFactory.fromAnyRef(seed));
        }
        return result;
    }
}

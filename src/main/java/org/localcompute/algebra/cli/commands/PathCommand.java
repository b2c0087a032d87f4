package org.localcompute.algebra.cli.commands;

import org.localcompute.algebra.derivation.suggest.SimplificationPath;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

@Command(name = "path", description = "Simplifies an expression one named transformation at a time.")
public class PathCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "EXPR", description = "The expression.")
    private String expression;

    @Option(names = "--max-steps", paramLabel = "N",
            description = "Maximum number of transformations (default: algebra.suggestion.max-steps).")
    private Integer maxSteps;

    @Override
    public Integer call() {
        if (maxSteps != null && maxSteps < 0) {
            throw new ParameterException(spec.commandLine(),
                    "--max-steps must not be negative: " + maxSteps);
        }
        SimplificationPath path = maxSteps == null
                ? engine().suggestSimplificationPath(expression)
                : engine().suggestSimplificationPath(expression, maxSteps);
        print(path);
        return path.success() ? OK : FAILED;
    }
}

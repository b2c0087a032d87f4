package org.localcompute.algebra.cli.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "compare", description = "Checks whether two expressions are equivalent.")
public class CompareCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "A", description = "The first expression.")
    private String first;

    @Parameters(index = "1", paramLabel = "B", description = "The second expression.")
    private String second;

    @Override
    public Integer call() {
        print(engine().checkEquivalence(first, second));
        return OK;
    }
}

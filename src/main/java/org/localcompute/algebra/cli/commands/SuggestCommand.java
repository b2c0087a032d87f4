package org.localcompute.algebra.cli.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "suggest", description = "Suggests the next simplification for the last expression of a derivation.")
public class SuggestCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "TEXT", description = "The derivation text.")
    private String text;

    @Override
    public Integer call() {
        print(engine().suggestNextStepFromText(text));
        return OK;
    }
}

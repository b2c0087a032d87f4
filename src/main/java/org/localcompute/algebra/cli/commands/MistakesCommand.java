package org.localcompute.algebra.cli.commands;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "mistakes", description = "Looks for common algebra and calculus mistakes in a derivation.")
public class MistakesCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "TEXT", description = "The derivation text.")
    private String text;

    @Override
    public Integer call() {
        print(engine().detectCommonMistakesFromText(text));
        return OK;
    }
}

package org.localcompute.algebra.cli.commands;

import org.localcompute.algebra.latex.LatexOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;

@Command(name = "latex", description = "Renders a derivation as LaTeX.")
public class LatexCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "TEXT", description = "The derivation text.")
    private String text;

    @Option(names = "--equation", description = "Use a single equation environment instead of align.")
    private boolean equation;

    @Option(names = "--numbered", description = "Number every line.")
    private boolean numbered;

    @Option(names = "--therefore", description = "Start the last line with \\therefore.")
    private boolean therefore;

    @Option(names = "--label", paramLabel = "L", description = "A \\label for the environment.")
    private String label;

    @Override
    public Integer call() {
        LatexOptions options = LatexOptions.DEFAULT
                .withAlign(!equation)
                .withNumbered(numbered)
                .withTherefore(therefore)
                .withLabel(label);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("text", text);
        output.put("latex", engine().derivationTextToLatex(text, options));
        print(output);
        return OK;
    }
}

package org.localcompute.algebra.cli.commands;

import org.localcompute.algebra.eval.EvalResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;

@Command(name = "eval", description = "Evaluates an expression, optionally with variable values.")
public class EvalCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "EXPR", description = "The expression, e.g. '2 + 3 * x'.")
    private String expression;

    @Option(names = "-D", paramLabel = "NAME=VALUE", description = "A variable value, e.g. -D x=2.5. Repeatable.")
    private Map<String, Double> bindings = new LinkedHashMap<>();

    @Override
    public Integer call() {
        EvalResult result = engine().evaluate(expression, bindings);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("expression", expression);
        output.put("bindings", bindings);
        output.put("success", result.success());
        output.put("value", result.value());
        output.put("error", result.error());
        print(output);
        return result.success() ? OK : FAILED;
    }
}

package org.localcompute.algebra.cli.commands;

import org.localcompute.algebra.format.FormatOptions;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Simplifier;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;

@Command(name = "simplify", description = "Simplifies an expression to its fixed point.")
public class SimplifyCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "EXPR", description = "The expression.")
    private String expression;

    @Override
    public Integer call() {
        ParseResult parsed = engine().parse(expression);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("expression", expression);
        output.put("success", parsed.success());
        if (!parsed.success()) {
            output.put("errors", parsed.errors());
            print(output);
            return FAILED;
        }
        Expr simplified = engine().simplify(parsed.expression());
        output.put("simplified", engine().format(simplified, FormatOptions.DEFAULT));
        output.put("indeterminate", new Simplifier().hasIndeterminateForm(simplified));
        print(output);
        return OK;
    }
}

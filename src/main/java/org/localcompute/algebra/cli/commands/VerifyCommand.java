package org.localcompute.algebra.cli.commands;

import org.localcompute.algebra.derivation.DerivationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints the verification result together with its explanation. A derivation that is wrong is
 * still a processed input, so the exit code stays 0.
 */
@Command(name = "verify", description = "Verifies a derivation such as '2x + 3x = 5x = 5 * x'.")
public class VerifyCommand extends AbstractEngineCommand {

    @Parameters(index = "0", paramLabel = "TEXT", description = "The derivation text.")
    private String text;

    @Override
    public Integer call() {
        DerivationResult result = engine().verifyDerivationText(text);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("result", result);
        output.put("explanation", engine().explainDerivationError(result).orElse(null));
        print(output);
        return OK;
    }
}

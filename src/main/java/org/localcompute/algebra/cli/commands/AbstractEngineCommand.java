package org.localcompute.algebra.cli.commands;

import org.localcompute.algebra.api.IAlgebraEngine;
import org.localcompute.algebra.cli.AlgebraCommandLine;
import org.localcompute.algebra.cli.JsonOutput;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Base class of the subcommands: gives access to the engine and prints results as JSON.
 */
abstract class AbstractEngineCommand implements Callable<Integer> {

    static final int OK = 0;
    static final int FAILED = 1;

    @ParentCommand
    private AlgebraCommandLine parent;

    @Spec
    CommandSpec spec;

    IAlgebraEngine engine() {
        return parent.getEngine();
    }

    void print(Object result) {
        JsonOutput.print(spec.commandLine().getOut(), result);
    }
}

package org.mathtutor.expression.cli.commands;

import org.mathtutor.expression.cli.ExpressionCommandLine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "simplify", description = "Prints the simplified form of an expression, or the input if it does not parse.")
public class SimplifyCommand implements Callable<Integer> {

    @ParentCommand
    private ExpressionCommandLine parent;

    @Parameters(index = "0", description = "The expression to simplify.")
    private String expression;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getOut().println(parent.getEngine().simplifyString(expression));
        return 0;
    }
}

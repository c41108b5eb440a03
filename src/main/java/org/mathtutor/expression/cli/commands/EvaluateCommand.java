package org.mathtutor.expression.cli.commands;

import org.mathtutor.expression.ExpressionEngine;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.cli.ExpressionCommandLine;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "evaluate", description = "Evaluates an expression to a number.")
public class EvaluateCommand implements Callable<Integer> {

    /** Exit code of an expression that does not fold to a number. */
    public static final int EXIT_SYMBOLIC = 1;

    @ParentCommand
    private ExpressionCommandLine parent;

    @Parameters(index = "0", description = "The expression to evaluate.")
    private String expression;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ExpressionEngine engine = parent.getEngine();
        AstNode ast;
        try {
            ast = engine.parse(expression);
        } catch (ParseException e) {
            ExpressionCommandLine.printParseError(spec.commandLine().getErr(), expression, e);
            return ExpressionCommandLine.EXIT_PARSE_ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        Double value = engine.tryEvaluate(ast);
        if (value == null) {
            out.println("symbolic");
            return EXIT_SYMBOLIC;
        }
        out.println(engine.astToString(new NumberNode(value)));
        return 0;
    }
}

package org.mathtutor.expression.cli.commands;

import org.mathtutor.expression.cli.ExpressionCommandLine;
import org.mathtutor.expression.diagnostics.Diagnostic;
import org.mathtutor.expression.diagnostics.DiagnosticsEngine;
import org.mathtutor.expression.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the tokens of an expression, one per line.")
public class TokensCommand implements Callable<Integer> {

    @ParentCommand
    private ExpressionCommandLine parent;

    @Parameters(index = "0", description = "The expression to tokenize.")
    private String expression;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = parent.getEngine().tokenize(expression, diagnostics);

        PrintWriter out = spec.commandLine().getOut();
        for (Token token : tokens) {
            String text = token.isImplicit() ? "(implicit)" : "'" + token.text() + "'";
            out.println(token.type() + " " + text + " " + token.span());
        }

        PrintWriter err = spec.commandLine().getErr();
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err.println(diagnostic);
        }
        return 0;
    }
}

package org.mathtutor.expression.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.mathtutor.expression.ExpressionEngine;
import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.analysis.SimplificationOpportunity.CommonFactor;
import org.mathtutor.expression.analysis.SimplificationOpportunity.LikeTerms;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.cli.ExpressionCommandLine;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Prints the simplification opportunities of an expression or fraction as JSON.")
public class AnalyzeCommand implements Callable<Integer> {

    @ParentCommand
    private ExpressionCommandLine parent;

    @Parameters(index = "0", description = "The expression, or the numerator if a denominator is given.")
    private String expression;

    @Option(names = {"-d", "--denominator"}, description = "The denominator of a fraction.")
    private String denominator;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ExpressionEngine engine = parent.getEngine();
        List<SimplificationOpportunity> opportunities;
        String current = expression;
        try {
            AstNode numeratorAst = engine.parse(expression);
            if (denominator == null) {
                opportunities = engine.analyzeExpression(numeratorAst);
            } else {
                current = denominator;
                opportunities = engine.analyzeFraction(numeratorAst, engine.parse(denominator));
            }
        } catch (ParseException e) {
            ExpressionCommandLine.printParseError(spec.commandLine().getErr(), current, e);
            return ExpressionCommandLine.EXIT_PARSE_ERROR;
        }

        Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
        JsonArray json = new JsonArray();
        for (SimplificationOpportunity opportunity : opportunities) {
            json.add(toJson(gson, opportunity));
        }
        spec.commandLine().getOut().println(gson.toJson(json));
        return 0;
    }

    private static JsonObject toJson(Gson gson, SimplificationOpportunity opportunity) {
        JsonObject object = new JsonObject();
        object.addProperty("type", typeOf(opportunity));
        for (Map.Entry<String, JsonElement> entry : gson.toJsonTree(opportunity).getAsJsonObject().entrySet()) {
            object.add(entry.getKey(), entry.getValue());
        }
        return object;
    }

    static String typeOf(SimplificationOpportunity opportunity) {
        if (opportunity instanceof CommonFactor) {
            return "common-factor";
        }
        if (opportunity instanceof LikeTerms) {
            return "like-terms";
        }
        return "reducible-fraction";
    }
}

package org.mathtutor.expression;

import org.mathtutor.expression.analysis.ExpressionAnalyzer;
import org.mathtutor.expression.analysis.OpportunityLocator;
import org.mathtutor.expression.analysis.PartType;
import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.api.IExpressionEngine;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.config.EngineOptions;
import org.mathtutor.expression.diagnostics.DiagnosticsEngine;
import org.mathtutor.expression.evaluation.AstPrinter;
import org.mathtutor.expression.evaluation.EvalResult;
import org.mathtutor.expression.evaluation.Evaluator;
import org.mathtutor.expression.evaluation.Simplifier;
import org.mathtutor.expression.frontend.lexer.Lexer;
import org.mathtutor.expression.frontend.lexer.Token;
import org.mathtutor.expression.frontend.parser.Parser;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main engine implementation. It wires the lexer, parser, evaluator, simplifier,
 * printer and analyzer together for one set of {@link EngineOptions}.
 * <p>
 * Every call creates its own lexer, parser and diagnostics, so an instance holds no
 * mutable state and may be shared between threads.
 */
public class ExpressionEngine implements IExpressionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEngine.class);

    private final EngineOptions options;
    private final Evaluator evaluator;
    private final Simplifier simplifier;
    private final AstPrinter printer;
    private final ExpressionAnalyzer analyzer;

    /**
     * Creates an engine with the default options.
     */
    public ExpressionEngine() {
        this(EngineOptions.DEFAULT);
    }

    /**
     * Creates an engine.
     * @param options The parser and printer settings.
     */
    public ExpressionEngine(EngineOptions options) {
        this.options = options;
        this.evaluator = new Evaluator();
        this.simplifier = new Simplifier(evaluator);
        this.printer = new AstPrinter(options.decimalPlaces(), options.unicodeOperators());
        this.analyzer = new ExpressionAnalyzer();
    }

    /**
     * @return The settings this engine was created with.
     */
    public EngineOptions getOptions() {
        return options;
    }

    @Override
    public List<Token> tokenize(String input) {
        return tokenize(input, new DiagnosticsEngine());
    }

    @Override
    public List<Token> tokenize(String input, DiagnosticsEngine diagnostics) {
        return new Lexer(input == null ? "" : input, diagnostics).scanTokens();
    }

    @Override
    public AstNode parse(String input) throws ParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = tokenize(input, diagnostics);
        return new Parser(tokens, diagnostics, options.defaultExponent()).parse();
    }

    @Override
    public AstNode tryParse(String input) {
        try {
            return parse(input);
        } catch (ParseException e) {
            LOG.debug("Rejected expression '{}': {}", input, e.getMessage());
            return null;
        }
    }

    @Override
    public EvalResult evaluate(AstNode node) {
        if (node == null) {
            return new EvalResult.Symbolic(null);
        }
        return evaluator.evaluate(node);
    }

    @Override
    public Double tryEvaluate(AstNode node) {
        return evaluator.tryEvaluate(node);
    }

    @Override
    public AstNode simplify(AstNode node) {
        if (node == null) {
            return null;
        }
        return simplifier.simplify(node);
    }

    @Override
    public String astToString(AstNode node) {
        if (node == null) {
            return "";
        }
        return printer.print(node);
    }

    @Override
    public List<SimplificationOpportunity> analyzeExpression(AstNode node) {
        return analyzer.analyzeExpression(node);
    }

    @Override
    public List<SimplificationOpportunity> analyzeFraction(AstNode numerator, AstNode denominator) {
        return analyzer.analyzeFraction(numerator, denominator);
    }

    @Override
    public Double evaluateString(String input) {
        return tryEvaluate(tryParse(input));
    }

    @Override
    public String simplifyString(String input) {
        AstNode ast = tryParse(input);
        if (ast == null) {
            return input;
        }
        return astToString(simplify(ast));
    }

    @Override
    public boolean isSpanHighlighted(SourceSpan span, List<SimplificationOpportunity> opportunities, PartType part) {
        return OpportunityLocator.isSpanHighlighted(span, opportunities, part);
    }

    @Override
    public List<SimplificationOpportunity> getOpportunitiesAtSpan(SourceSpan span,
                                                                  List<SimplificationOpportunity> opportunities,
                                                                  PartType part) {
        return OpportunityLocator.getOpportunitiesAtSpan(span, opportunities, part);
    }
}

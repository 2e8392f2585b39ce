package info.isaksson.erland.swanmodel.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import info.isaksson.erland.swanmodel.ast.Equation;
import info.isaksson.erland.swanmodel.ast.GlobalDeclaration;
import info.isaksson.erland.swanmodel.ast.Module;
import info.isaksson.erland.swanmodel.ast.ModuleInformation;
import info.isaksson.erland.swanmodel.ast.ModuleKind;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.ProtectedDecl;
import info.isaksson.erland.swanmodel.ast.ProtectedEquation;
import info.isaksson.erland.swanmodel.ast.ProtectedText;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanModelException;
import info.isaksson.erland.swanmodel.expr.Expression;
import info.isaksson.erland.swanmodel.expr.ProtectedExpr;
import info.isaksson.erland.swanmodel.source.SwanModuleParser;
import info.isaksson.erland.swanmodel.source.SwanSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for Swan module bodies and interfaces.
 *
 * <p>Parsing never fails on bad text: a declaration, section, equation or diagram object
 * that cannot be structured is kept verbatim in a protected node, and a unit that cannot
 * even be split into tokens becomes {@link Module#unstructured}. The information block
 * after the {@code __END__} line is read as JSON.</p>
 */
public final class SwanParser implements SwanModuleParser {

    private static final Logger logger = LogManager.getLogger();

    private static final Pattern END_LINE = Pattern.compile("(?m)^" + ModuleInformation.END_MARKER + "[ \\t]*\\r?$");
    private static final String VERSION_PREFIX = "-- version";
    private static final String TEXT_SOURCE = "<text>";

    @Override public Module parse(SwanSource source) throws IOException {
        return parseModule(source.name(), source.kind(), source.moduleName(), source.text());
    }

    /** Parses the text of a unit named {@code name}. */
    public Module parseModule(String sourceName, ModuleKind kind, PathIdentifier name, String text) {
        LineMap lines = new LineMap(text);
        SourceSpan whole = span(sourceName, lines, 0, text.length());

        int codeEnd = text.length();
        ModuleInformation information = ModuleInformation.none();
        Matcher end = END_LINE.matcher(text);
        if (end.find()) {
            codeEnd = end.start();
            int infoStart = end.end();
            if (infoStart < text.length() && text.charAt(infoStart) == '\n') infoStart++;
            String raw = text.substring(infoStart);
            try {
                information = ModuleInformation.parse(raw);
            } catch (JsonProcessingException e) {
                logger.error("Unreadable module information in {}: {}", sourceName, e.getOriginalMessage());
                information = ModuleInformation.unreadable(raw);
            }
        }

        List<Token> tokens;
        try {
            tokens = new SwanLexer(text, 0, codeEnd, lines).tokenize();
        } catch (SwanSyntaxException e) {
            logger.warn("{} kept unstructured: {}", sourceName, e.getMessage());
            return Module.unstructured(whole, kind, name, text);
        }
        UnitParser unit = new UnitParser(new ParseContext(text, sourceName, lines, tokens), kind == ModuleKind.INTERFACE);
        List<GlobalDeclaration> decls = unit.declarations().declarations();
        long protectedCount = decls.stream().filter(d -> d instanceof ProtectedDecl).count();
        if (protectedCount > 0) logger.debug("{}: {} protected declaration(s)", sourceName, protectedCount);
        return new Module(whole, kind, name, versionHeader(text), decls, information, text);
    }

    private static String versionHeader(String text) {
        int eol = text.indexOf('\n');
        String first = (eol < 0 ? text : text.substring(0, eol)).stripTrailing();
        return first.startsWith(VERSION_PREFIX) ? first : null;
    }

    /** Parses one expression; text that is not exactly one expression gives a {@link ProtectedExpr}. */
    public Expression parseExpression(String text) {
        LineMap lines = new LineMap(text);
        try {
            UnitParser unit = unit(text, lines, false);
            Expression e = unit.expressions().expression();
            expectEnd(unit);
            return e;
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            logger.debug("Protected expression: {}", e.getMessage());
            return new ProtectedExpr(span(TEXT_SOURCE, lines, 0, text.length()), ProtectedText.fallback(text));
        }
    }

    /** Parses one equation; text that is not exactly one equation gives a {@link ProtectedEquation}. */
    public Equation parseEquation(String text) {
        LineMap lines = new LineMap(text);
        try {
            UnitParser unit = unit(text, lines, false);
            Equation eq = unit.scopes().equation();
            expectEnd(unit);
            return eq;
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            logger.debug("Protected equation: {}", e.getMessage());
            return new ProtectedEquation(span(TEXT_SOURCE, lines, 0, text.length()), ProtectedText.fallback(text));
        }
    }

    /** Parses one global declaration of a module body; failures give a {@link ProtectedDecl}. */
    public GlobalDeclaration parseDeclaration(String text) {
        LineMap lines = new LineMap(text);
        try {
            UnitParser unit = unit(text, lines, false);
            GlobalDeclaration d = unit.declarations().declaration();
            expectEnd(unit);
            return d;
        } catch (SwanSyntaxException | IllegalArgumentException | SwanModelException e) {
            logger.debug("Protected declaration: {}", e.getMessage());
            return new ProtectedDecl(span(TEXT_SOURCE, lines, 0, text.length()), ProtectedText.fallback(text));
        }
    }

    private static UnitParser unit(String text, LineMap lines, boolean interfaceUnit) throws SwanSyntaxException {
        List<Token> tokens = new SwanLexer(text, 0, text.length(), lines).tokenize();
        return new UnitParser(new ParseContext(text, TEXT_SOURCE, lines, tokens), interfaceUnit);
    }

    private static void expectEnd(UnitParser unit) throws SwanSyntaxException {
        if (!unit.context().atEnd()) throw unit.context().error("unexpected text");
    }

    private static SourceSpan span(String sourceName, LineMap lines, int start, int end) {
        return new SourceSpan(sourceName, start, end, lines.line(start), lines.column(start),
                lines.line(end), lines.column(end));
    }
}

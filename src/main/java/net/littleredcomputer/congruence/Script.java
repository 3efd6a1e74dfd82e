package net.littleredcomputer.congruence;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableIntArray;
import net.littleredcomputer.congruence.eqs.Explanation;
import net.littleredcomputer.congruence.eqs.SignedVar;
import net.littleredcomputer.congruence.eqs.VarEqs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.StreamSupport;

import static java.util.stream.Collectors.joining;

/**
 * A line-oriented script driving a {@link MonomialTable}. Lines whose first word is "c" are
 * comments. Variables are numbered from 1; in an equality, -4 stands for the negation of v4.
 * <pre>
 *   m 3 1 2        declare v3 := v1 v2
 *   e 1 -4 7 8     v1 = -v4, justified by constraints 7 and 8
 *   push
 *   pop 1
 *   canon 3        rep 3       uses 1       factors 3
 *   equiv 3        explain 3   divides 3 5  find 1 2
 *   show
 * </pre>
 */
public class Script {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private static final Joiner spaceJoiner = Joiner.on(' ');

    // Minimum and maximum argument counts; -1 means unbounded.
    private static final Map<String, int[]> arity = ImmutableMap.<String, int[]>builder()
            .put("m", new int[]{2, -1})
            .put("e", new int[]{2, -1})
            .put("push", new int[]{0, 0})
            .put("pop", new int[]{1, 1})
            .put("canon", new int[]{1, 1})
            .put("rep", new int[]{1, 1})
            .put("uses", new int[]{1, 1})
            .put("factors", new int[]{1, 1})
            .put("equiv", new int[]{1, 1})
            .put("explain", new int[]{1, 1})
            .put("divides", new int[]{2, 2})
            .put("find", new int[]{1, -1})
            .put("show", new int[]{0, 0})
            .build();

    private static class Command {
        final int line;
        final String op;
        final ImmutableIntArray args;

        Command(int line, String op, ImmutableIntArray args) {
            this.line = line;
            this.op = op;
            this.args = args;
        }

        int arg(int i) { return args.get(i); }
    }

    private final List<Command> commands;

    private Script(List<Command> commands) {
        this.commands = commands;
    }

    public int size() { return commands.size(); }

    public static Script parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    public static Script parseFrom(Reader r) {
        List<Command> commands = new ArrayList<>();
        int lineNumber = 0;
        for (String line : (Iterable<String>) new BufferedReader(r).lines()::iterator) {
            ++lineNumber;
            List<String> words = splitter.splitToList(line);
            if (words.isEmpty() || words.get(0).equals("c")) continue;
            final String op = words.get(0);
            final int[] bounds = arity.get(op);
            if (bounds == null) throw new IllegalArgumentException("line " + lineNumber + ": unknown command " + op);
            final int n = words.size() - 1;
            if (n < bounds[0] || (bounds[1] >= 0 && n > bounds[1])) {
                throw new IllegalArgumentException("line " + lineNumber + ": wrong number of arguments to " + op);
            }
            ImmutableIntArray.Builder args = ImmutableIntArray.builder(n);
            for (int i = 1; i <= n; ++i) {
                try {
                    args.add(Integer.parseInt(words.get(i)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("line " + lineNumber + ": not a number: " + words.get(i), e);
                }
            }
            Command c = new Command(lineNumber, op, args.build());
            checkVariables(c);
            commands.add(c);
        }
        return new Script(commands);
    }

    private static void checkVariables(Command c) {
        switch (c.op) {
            case "pop":
                if (c.arg(0) < 0) throw new IllegalArgumentException("line " + c.line + ": negative scope count");
                return;
            case "e":
                // Only the two signed variables; the rest are constraint indices.
                if (c.arg(0) == 0 || c.arg(1) == 0) {
                    throw new IllegalArgumentException("line " + c.line + ": variables are numbered from 1");
                }
                return;
            default:
                for (int i = 0; i < c.args.length(); ++i) {
                    if (c.arg(i) < 1) throw new IllegalArgumentException("line " + c.line + ": variables are numbered from 1");
                }
        }
    }

    private static String vars(Iterable<Monomial> ms) {
        return StreamSupport.stream(ms.spliterator(), false).map(m -> "v" + m.var()).collect(joining(" "));
    }

    public MonomialTable run(PrintStream out) {
        return run(out, EnumSet.noneOf(MonomialTable.Trace.class));
    }

    /**
     * Executes the script against a fresh table, printing the answers to its queries.
     *
     * @return the table in its final state
     */
    MonomialTable run(PrintStream out, EnumSet<MonomialTable.Trace> tracing) {
        VarEqs ve = new VarEqs();
        MonomialTable t = new MonomialTable(ve);
        t.tracing.addAll(tracing);
        for (Command c : commands) {
            log.debug("line %d: %s %s", c.line, c.op, spaceJoiner.join(c.args.asList()));
            switch (c.op) {
                case "m":
                    t.declare(c.arg(0), c.args.subArray(1, c.args.length()));
                    break;
                case "e":
                    ve.merge(SignedVar.fromInt(c.arg(0)), SignedVar.fromInt(c.arg(1)), c.args.subArray(2, c.args.length()));
                    break;
                case "push":
                    t.pushScope();
                    break;
                case "pop":
                    t.popScope(c.arg(0));
                    break;
                case "canon":
                    out.println(t.canonicalFormOf(c.arg(0)));
                    break;
                case "rep": {
                    SignedVars sv = t.canonicalFormOf(c.arg(0));
                    out.printf("%s sign %+d%n", t.representativeOf(sv), t.signRelativeToRepresentative(sv));
                    break;
                }
                case "uses":
                    out.printf("uses v%d: %s%n", c.arg(0), vars(t.useListOf(c.arg(0))));
                    break;
                case "factors":
                    out.printf("factors v%d: %s%n", c.arg(0), vars(t.properFactorsOf(c.arg(0))));
                    break;
                case "equiv":
                    out.printf("equiv v%d: %s%n", c.arg(0), vars(t.signEquivalentMonomials(c.arg(0))));
                    break;
                case "explain": {
                    Explanation e = new Explanation();
                    t.explain(c.arg(0), e);
                    out.printf("explain v%d: %s%n", c.arg(0), e);
                    break;
                }
                case "divides":
                    out.println(t.divides(c.arg(0), c.arg(1)));
                    break;
                case "find":
                    out.println(t.find(c.args).map(SignedVars::toString).orElse("none"));
                    break;
                case "show":
                    t.display(out);
                    break;
                default:
                    throw new IllegalStateException("unhandled command " + c.op);
            }
        }
        return t;
    }
}

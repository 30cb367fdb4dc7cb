package net.littleredcomputer.sat;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.sat.formula.Formula;
import net.littleredcomputer.sat.formula.TseytinEncoding;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final Pattern pigeonholeRe = Pattern.compile("pigeonhole(\\d+),(\\d+)");
    private static final Pattern waerdenRe = Pattern.compile("waerden(\\d+),(\\d+),(\\d+)");
    private static final Pattern langfordRe = Pattern.compile("langford(\\d+)");
    private static final Pattern randomRe = Pattern.compile("random(\\d+),(\\d+),(\\d+),(\\d+)");

    private static Options options() {
        return new Options()
                .addOption("task", true, "sat, formula, cnf or compare")
                .addOption("problem", true, "DIMACS file (- for standard input) or generated problem name")
                .addOption("formula", true, "propositional formula")
                .addOption("algorithm", true, "dpll or cdcl")
                .addOption("conflicts", true, "give up after this many conflicts")
                .addOption("timeout", true, "give up after this long, in ISO-8601 format")
                .addOption("restarts", true, "CDCL restart schedule: none, luby or geometric")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    /**
     * @param name the name of a generated problem (pigeonholeP,H waerdenJ,K,N langfordN
     *             randomK,M,N,SEED), a DIMACS file name, or - for standard input
     */
    static SATProblem satProblem(String name) throws IOException {
        Matcher m;
        if ((m = pigeonholeRe.matcher(name)).matches()) {
            return SATProblem.pigeonhole(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        }
        if ((m = waerdenRe.matcher(name)).matches()) {
            return SATProblem.waerden(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        }
        if ((m = langfordRe.matcher(name)).matches()) {
            return SATProblem.langford(Integer.parseInt(m.group(1)));
        }
        if ((m = randomRe.matcher(name)).matches()) {
            return SATProblem.randomInstance(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), Long.parseLong(m.group(4)));
        }
        // Didn't match a problem generator; try a file
        try (Reader r = new BufferedReader(name.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(name), StandardCharsets.UTF_8))) {
            return SATProblem.parseFrom(r);
        }
    }

    private static RestartPolicy restartPolicy(CommandLine cmd) {
        String r = cmd.getOptionValue("restarts", "luby");
        switch (r) {
            case "none": return RestartPolicy.NEVER;
            case "luby": return RestartPolicy.luby(32);
            case "geometric": return RestartPolicy.geometric(100, 1.5);
            default: throw new IllegalArgumentException("Unknown restart policy: " + r);
        }
    }

    private static Function<SATProblem, AbstractSATSolver> cdcl(CommandLine cmd) {
        RestartPolicy policy = restartPolicy(cmd);
        return p -> new CDCLSolver(p).setRestartPolicy(policy);
    }

    private static Function<SATProblem, AbstractSATSolver> solver(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "cdcl");
        switch (a) {
            case "dpll": return DPLLSolver::new;
            case "cdcl": return cdcl(cmd);
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    private static Budget budget(CommandLine cmd) {
        Budget b = Budget.UNLIMITED;
        if (cmd.hasOption("conflicts")) b = b.withConflicts(Long.parseLong(cmd.getOptionValue("conflicts")));
        if (cmd.hasOption("timeout")) b = b.withTime(Duration.parse(cmd.getOptionValue("timeout")));
        return b;
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static Outcome solve(Function<SATProblem, AbstractSATSolver> f, SATProblem p, CommandLine cmd) {
        AbstractSATSolver s = f.apply(p);
        s.setLogInterval(logInterval(cmd));
        return s.solve(budget(cmd));
    }

    private static String verdict(Outcome o) {
        switch (o.status()) {
            case SATISFIABLE: return "SAT";
            case UNSATISFIABLE: return "UNSAT";
            default: return "UNKNOWN";
        }
    }

    private static String formula(CommandLine cmd) {
        if (!cmd.hasOption("formula")) throw new IllegalArgumentException("Must specify -formula");
        return cmd.getOptionValue("formula");
    }

    /** @return the process exit status */
    static int run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        switch (task) {
            case "sat": {
                if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
                SATProblem p = satProblem(cmd.getOptionValue("problem"));
                Stopwatch sw = Stopwatch.createStarted();
                Outcome o = solve(solver(cmd), p, cmd);
                sw.stop();
                out.println("c " + o);
                out.println("c " + sw);
                switch (o.status()) {
                    case SATISFIABLE: {
                        out.println("s SATISFIABLE");
                        boolean[] bs = o.model().get();
                        List<Integer> v = new ArrayList<>();
                        for (int i = 0; i < bs.length; ++i) v.add(bs[i] ? i + 1 : -i - 1);
                        v.add(0);
                        out.println("v " + spaceJoiner.join(v));
                        break;
                    }
                    case UNSATISFIABLE:
                        out.println("s UNSATISFIABLE");
                        break;
                    default:
                        out.println("s UNKNOWN");
                }
                return 0;
            }
            case "formula": {
                Formula f = Formula.parse(formula(cmd));
                Formula nnf = f.toNNF();
                TseytinEncoding e = nnf.toCNF();
                out.println("formula: " + f);
                out.println("nnf: " + nnf);
                out.printf("cnf: %d variables (%d auxiliary), %d clauses\n",
                        e.problem().nVariables(), e.auxiliaryVariables(), e.problem().nClauses());
                Outcome c = solve(cdcl(cmd), e.problem(), cmd);
                Outcome d = solve(DPLLSolver::new, e.problem(), cmd);
                out.printf("CDCL: %s %s\n", verdict(c), c.elapsed());
                out.printf("DPLL: %s %s\n", verdict(d), d.elapsed());
                if (c.isSatisfiable()) out.println("CDCL model: " + e.project(c.model().get()));
                if (d.isSatisfiable()) out.println("DPLL model: " + e.project(d.model().get()));
                if (c.isSatisfiable() && d.isSatisfiable()) {
                    ImmutableMap<String, Boolean> cm = e.project(c.model().get());
                    ImmutableMap<String, Boolean> dm = e.project(d.model().get());
                    List<String> differ = new ArrayList<>();
                    cm.forEach((atom, value) -> {
                        if (!value.equals(dm.get(atom))) differ.add(atom);
                    });
                    out.println(differ.isEmpty() ? "models agree" : "models differ at: " + spaceJoiner.join(differ));
                }
                if (c.status() != d.status() && c.status() != Outcome.Status.RESOURCE_EXHAUSTED
                        && d.status() != Outcome.Status.RESOURCE_EXHAUSTED) {
                    out.println("VERDICTS DISAGREE");
                    return 1;
                }
                return 0;
            }
            case "cnf": {
                String text = formula(cmd);
                Formula.parse(text).toCNF().problem().printDimacs(out, text);
                return 0;
            }
            case "compare": {
                List<String> names = cmd.getArgList();
                if (names.isEmpty()) throw new IllegalArgumentException("Name some problems to compare");
                out.printf("%-20s %6s %8s  %-7s %12s  %-7s %12s\n", "problem", "vars", "clauses", "CDCL", "time", "DPLL", "time");
                Duration cdclTotal = Duration.ZERO;
                Duration dpllTotal = Duration.ZERO;
                int disagreements = 0;
                for (String name : names) {
                    SATProblem p = satProblem(name);
                    Outcome c = solve(cdcl(cmd), p, cmd);
                    Outcome d = solve(DPLLSolver::new, p, cmd);
                    cdclTotal = cdclTotal.plus(c.elapsed());
                    dpllTotal = dpllTotal.plus(d.elapsed());
                    boolean disagree = c.status() != d.status()
                            && c.status() != Outcome.Status.RESOURCE_EXHAUSTED
                            && d.status() != Outcome.Status.RESOURCE_EXHAUSTED;
                    if (disagree) ++disagreements;
                    out.printf("%-20s %6d %8d  %-7s %10.3fms  %-7s %10.3fms%s\n", name, p.nVariables(), p.nClauses(),
                            verdict(c), c.elapsed().toNanos() / 1e6, verdict(d), d.elapsed().toNanos() / 1e6,
                            disagree ? "  DISAGREE" : "");
                }
                out.printf("total: CDCL %s, DPLL %s, %d disagreement(s)\n", cdclTotal, dpllTotal, disagreements);
                return disagreements == 0 ? 0 : 1;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        int status = run(args, System.out);
        if (status != 0) System.exit(status);
    }
}

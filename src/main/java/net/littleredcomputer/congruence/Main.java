package net.littleredcomputer.congruence;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.*;
import java.util.EnumSet;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("script", true, "filename of monomial script, or - for standard input")
                .addOption("trace", true, "comma-separated trace categories: merge, canonize, scope");
    }

    private static Reader script(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("script")) throw new IllegalArgumentException("Must specify -script");
        String p = cmd.getOptionValue("script");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    static EnumSet<MonomialTable.Trace> tracing(CommandLine cmd) {
        EnumSet<MonomialTable.Trace> t = EnumSet.noneOf(MonomialTable.Trace.class);
        for (String s : commaSplitter.split(cmd.getOptionValue("trace", ""))) {
            t.add(MonomialTable.Trace.valueOf(s.toUpperCase()));
        }
        return t;
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Script s;
        try (Reader r = script(cmd)) {
            s = Script.parseFrom(r);
        }
        EnumSet<MonomialTable.Trace> tracing = tracing(cmd);
        if (!tracing.isEmpty()) Configurator.setLevel(Main.class.getPackage().getName(), Level.TRACE);
        Stopwatch sw = Stopwatch.createStarted();
        MonomialTable t = s.run(System.out, tracing);
        log.info("ran %d commands in %s; %d monomials at scope depth %d", s.size(), sw, t.size(), t.scopeDepth());
    }
}

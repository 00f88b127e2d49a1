package net.littleredcomputer.mheap;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to do: sort or top")
                .addOption("input", true, "file of integers, or - for stdin")
                .addOption("order", true, "max (default) or min")
                .addOption("k", true, "number of elements to print for -task top");
    }

    /** Input is read as UTF-8 whatever the platform default. */
    static Reader input(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("input")) throw new IllegalArgumentException("Must specify -input");
        String p = cmd.getOptionValue("input");
        if (p.equals("-")) return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return Files.newBufferedReader(Paths.get(p), StandardCharsets.UTF_8);
    }

    static HeapOrder<Long> order(String name) {
        switch (name) {
            case "max": return HeapOrder.max();
            case "min": return HeapOrder.min();
            default: throw new IllegalArgumentException("unknown order: " + name);
        }
    }

    static List<Long> readNumbers(Reader r) throws IOException {
        List<Long> numbers = new ArrayList<>();
        BufferedReader br = r instanceof BufferedReader ? (BufferedReader) r : new BufferedReader(r);
        String line;
        while ((line = br.readLine()) != null) {
            for (String token : splitter.split(line)) numbers.add(Long.parseLong(token));
        }
        return numbers;
    }

    /** Runs a task, writing the selected numbers to {@code out} one per line. */
    static void run(CommandLine cmd, Reader in, PrintStream out) throws IOException {
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        HeapOrder<Long> order = order(cmd.getOptionValue("order", "max"));
        Stopwatch sw = Stopwatch.createStarted();
        List<Long> numbers = readNumbers(in);
        Heap<Long> h = Heap.heapify(numbers, order);
        log.info("heapified %d numbers in %s", numbers.size(), sw);
        switch (task) {
            case "sort":
                h.drain().forEach(out::println);
                break;
            case "top": {
                int k = Integer.parseInt(cmd.getOptionValue("k", "10"));
                if (k < 0) throw new IllegalArgumentException("-k must not be negative");
                for (int i = 0; i < k && !h.isEmpty(); ++i) out.println(h.pop().get());
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        sw.stop();
        log.info("%s done in %s", task, sw);
    }

    static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(options(), args);
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = parse(args);
        try (Reader in = input(cmd)) {
            run(cmd, in, System.out);
        }
    }
}

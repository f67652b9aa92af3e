package com.conveyal.gtfsnav;

import com.conveyal.gtfsnav.command.CommandPath;
import com.conveyal.gtfsnav.command.ScheduleCommandInterpreter;
import com.conveyal.gtfsnav.error.CommandException;
import com.conveyal.gtfsnav.error.FeedFetchException;
import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.loader.FeedFetcher;
import com.conveyal.gtfsnav.loader.TableLoadEvent;
import com.conveyal.gtfsnav.loader.ZipFeedLoader;
import com.conveyal.gtfsnav.navigation.ScheduleNode;
import com.google.common.eventbus.Subscribe;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public class GTFSNavigatorMain {

    private static final Logger LOG = LoggerFactory.getLogger(GTFSNavigatorMain.class);

    static final String PROMPT = "gtfs> ";

    public static void main (String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    /**
     * Everything main does, with the streams supplied by the caller.
     * @return the process exit status: 0 on success, 1 if the arguments, the feed or a batch command failed.
     */
    public static int run (String[] args, InputStream in, PrintStream out, PrintStream err) {
        Options options = getOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(options, err);
            return 1;
        }
        if (cmd.hasOption("help")) {
            printHelp(options, out);
            return 0;
        }
        String[] arguments = cmd.getArgs();
        if (arguments.length > 1) {
            err.println("Please specify at most one GTFS feed to load.");
            return 1;
        }
        String[] commands = cmd.getOptionValues("command");
        NavigatorConfig config = new NavigatorConfig(
                cmd.getOptionValue("url"),
                arguments.length == 1 ? new File(arguments[0]) : null,
                commands == null ? null : Arrays.asList(commands));
        LOG.debug("Starting with {}", config);

        Schedule schedule;
        try {
            schedule = loadSchedule(config, err);
        } catch (FeedFetchException | GTFSLoadException e) {
            LOG.error("Could not load GTFS feed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
        ScheduleNode root = ScheduleNode.root(schedule);

        if (!config.isInteractive()) {
            boolean allSucceeded = true;
            for (String command : config.commands) {
                allSucceeded &= interpretLine(root, command, out, err);
            }
            return allSucceeded ? 0 : 1;
        }
        try {
            repl(root, in, out, err);
        } catch (IOException e) {
            LOG.error("Could not read input", e);
            return 1;
        }
        return 0;
    }

    static Schedule loadSchedule (NavigatorConfig config, PrintStream progressStream)
            throws FeedFetchException, GTFSLoadException {
        File feedFile = config.localFeed;
        if (feedFile == null) {
            feedFile = new FeedFetcher().fetch(config.feedUrl,
                    bytes -> progressStream.print("\rDownloaded " + bytes + " bytes"));
            progressStream.println();
        }
        ZipFeedLoader loader = new ZipFeedLoader(feedFile);
        loader.eventBus.register(new Object() {
            @Subscribe
            public void tableLoaded (TableLoadEvent event) {
                if (event.stage == TableLoadEvent.Stage.LOADED) {
                    progressStream.println(String.format("Loaded %d records from %s", event.value,
                            event.tableFileName));
                }
            }
        });
        return loader.load();
    }

    /** Read commands until end of input or an exit command. Each line starts again from the root node. */
    static void repl (ScheduleNode root, InputStream in, PrintStream out, PrintStream err) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                out.println();
                return;
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            if (trimmed.equals("exit") || trimmed.equals("quit")) return;
            interpretLine(root, trimmed, out, err);
        }
    }

    /** @return false if the command failed, in which case the error has been printed. */
    static boolean interpretLine (ScheduleNode root, String line, PrintStream out, PrintStream err) {
        try {
            new ScheduleCommandInterpreter(root, out).interpret(CommandPath.parse(line));
            return true;
        } catch (CommandException e) {
            LOG.debug("Command '{}' failed", line, e);
            err.println("Error: " + e.getMessage());
            return false;
        }
    }

    private static void printHelp (Options options, PrintStream stream) {
        final String HELP = String.join("\n",
                "java -jar gtfs-navigator.jar [options] [INPUT.zip]",
                "Load a GTFS feed (by default the MBTA feed, downloaded over HTTP) and explore it by",
                "drilling down to routes and stops, e.g. routes.list or stops.place-pktrm.routes.info.",
                "",
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(stream);
        writer.println();
        formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, HELP, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.println();
        writer.flush();
    }

    private static Options getOptions () {
        Options options = new Options();
        options.addOption(new Option("help", false, "print this message"));
        options.addOption(Option.builder("url")
                .hasArg()
                .argName("url")
                .desc("download the GTFS feed from this URL (default " + NavigatorConfig.DEFAULT_FEED_URL + ")")
                .build());
        options.addOption(Option.builder("command")
                .hasArg()
                .argName("path")
                .desc("run this command and exit instead of starting an interactive session; may be repeated")
                .build());
        return options;
    }

}

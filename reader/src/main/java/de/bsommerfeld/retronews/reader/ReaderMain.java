package de.bsommerfeld.retronews.reader;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.retronews.core.config.ApplicationMode;
import de.bsommerfeld.retronews.core.config.ConfigException;
import de.bsommerfeld.retronews.core.config.GlobalConfig;
import de.bsommerfeld.retronews.core.domain.Group;
import de.bsommerfeld.retronews.core.domain.Message;
import de.bsommerfeld.retronews.core.util.StorageUtils;
import de.bsommerfeld.retronews.hn.HackerNewsClient;
import de.bsommerfeld.retronews.hn.HackerNewsException;
import de.bsommerfeld.retronews.render.HtmlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <pre>
 * retronews render [--width N] FILE|-     render an HTML snippet as plain text
 * retronews thread [--raw] ID             print a whole thread
 * retronews group [--page N] TAB          list the threads of a tab
 * </pre>
 *
 * Exit codes: 0 on success, 1 on failure, 2 on a usage error.
 */
public class ReaderMain {

    static {
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReaderMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join("\n",
            "Usage: retronews <command> [options]",
            "  render [--width N] FILE|-   render an HTML snippet as plain text",
            "  thread [--raw] ID           print a whole thread",
            "  group [--page N] TAB        list the threads of a tab (1-5 or its name)");

    private final GlobalConfig config;
    private final ApplicationMode mode;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private Injector injector;

    ReaderMain(GlobalConfig config, ApplicationMode mode, InputStream in, PrintStream out, PrintStream err) {
        this.config = config;
        this.mode = mode;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            ReaderMain main = new ReaderMain(ReaderModule.loadConfig(), ApplicationMode.get(), System.in,
                    System.out, System.err);
            exitCode = main.run(args);
        } catch (ConfigException e) {
            LOG.error("Failed to load configuration", e);
            System.err.println(e.getMessage());
            exitCode = EXIT_FAILURE;
        }
        System.exit(exitCode);
    }

    int run(String[] args) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Deque<String> rest = new ArrayDeque<>(Arrays.asList(args).subList(1, args.length));
        try {
            switch (args[0]) {
                case "render":
                    return render(rest);
                case "thread":
                    return thread(rest);
                case "group":
                    return group(rest);
                case "-h":
                case "--help":
                case "help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    throw new UsageException("Unknown command '" + args[0] + "'");
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (HackerNewsException | IOException e) {
            LOG.error("Command '{}' failed", args[0], e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int render(Deque<String> args) throws IOException {
        int width = config.getReader().getWidth();
        String source = null;
        while (!args.isEmpty()) {
            String arg = args.poll();
            if (arg.equals("--width")) {
                width = positiveInt(args.poll(), "--width");
            } else if (source == null) {
                source = arg;
            } else {
                throw new UsageException("Unexpected argument '" + arg + "'");
            }
        }
        if (source == null)
            throw new UsageException("Missing input file");

        String html = source.equals("-")
                ? new String(in.readAllBytes(), StandardCharsets.UTF_8)
                : Files.readString(Paths.get(source), StandardCharsets.UTF_8);
        String text = HtmlRenderer.render(html, width);
        if (!text.isEmpty())
            out.println(text);
        return EXIT_OK;
    }

    private int thread(Deque<String> args) {
        boolean raw = false;
        String id = null;
        while (!args.isEmpty()) {
            String arg = args.poll();
            if (arg.equals("--raw")) {
                raw = true;
            } else if (id == null) {
                id = arg;
            } else {
                throw new UsageException("Unexpected argument '" + arg + "'");
            }
        }
        if (id == null)
            throw new UsageException("Missing thread id");

        String sourceId = id;
        if (id.contains("@")) {
            try {
                sourceId = Message.splitId(id)[0];
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }
        Message root = injector().getInstance(HackerNewsClient.class).fetchThread(sourceId);
        List<Message> messages = ThreadFlattener.flatten(root);
        root.setTotalComments(messages.size());

        for (Message message : messages) {
            out.println(IndexRow.format(message, false));
        }
        for (Message message : messages) {
            out.println();
            List<String> lines = raw
                    ? MessageLines.buildRaw(message, config.getReader().getRawWidth())
                    : MessageLines.build(message, config.getReader().getWidth());
            MessageLines.sanitize(lines).forEach(out::println);
        }
        return EXIT_OK;
    }

    private int group(Deque<String> args) {
        int page = 1;
        String tab = null;
        while (!args.isEmpty()) {
            String arg = args.poll();
            if (arg.equals("--page")) {
                page = positiveInt(args.poll(), "--page");
            } else if (tab == null) {
                tab = arg;
            } else {
                throw new UsageException("Unexpected argument '" + arg + "'");
            }
        }
        if (tab == null)
            throw new UsageException("Missing tab");

        String key = tab;
        Optional<Group> group = GroupTabs.find(key);
        if (group.isEmpty())
            throw new UsageException("Unknown tab '" + key + "'");

        ReaderSession session = injector().getInstance(ReaderSession.class);
        session.loadGroup(group.get().withPage(page));
        if (session.getFlash() != null) {
            err.println(session.getFlash());
            return EXIT_FAILURE;
        }

        for (Message message : session.getMessages()) {
            out.println(IndexRow.format(message, false));
        }
        return EXIT_OK;
    }

    private Injector injector() {
        if (injector == null)
            injector = Guice.createInjector(new ReaderModule(config, mode));
        return injector;
    }

    private static int positiveInt(String value, String option) {
        if (value == null)
            throw new UsageException("Missing value for " + option);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed >= 1)
                return parsed;
        } catch (NumberFormatException e) {
            LOG.debug("Not a number for {}: {}", option, value);
        }
        throw new UsageException("Invalid value for " + option + ": " + value);
    }

    /** Malformed command line. */
    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}

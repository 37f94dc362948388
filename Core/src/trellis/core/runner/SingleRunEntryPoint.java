package trellis.core.runner;

import trellis.core.Suite;
import trellis.core.config.JsonRunRequestParser;
import trellis.core.config.RunRequest;
import trellis.core.exception.ParseException;
import trellis.core.report.JsonEventWriter;
import trellis.core.util.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * A single-use entry point to the system that runs the suites named by a run request and then exits.
 *
 * Every event of the run is written to standard output as one JSON object per line. The exit code is 0 iff no test
 * failed and no suite aborted.
 */
public final class SingleRunEntryPoint {
    private static final Logger LOGGER = Logger.forClass(SingleRunEntryPoint.class);
    private static final String NUM_THREADS_PROPERTY = "trellis.num_threads";

    /**
     * We expect to be given the following arguments:
     *
     * args[0] = REQUEST
     *
     * The REQUEST argument is a path to a file holding a JSON run request, as understood by
     * {@link JsonRunRequestParser}. The suite classes it names must be on the class path and have a public
     * no-argument constructor.
     *
     * The {@code trellis.enable_logger} property turns logging to standard error on, the {@code trellis.num_threads}
     * property sets how many suites may run at once (1 by default).
     *
     * @param args The program arguments.
     */
    public static void main(String[] args) {
        if (!Boolean.parseBoolean(System.getProperty(Logger.ENABLE_PROPERTY, "false"))) {
            Logger.globalDisable();
        }
        System.exit(execute(args, System.out, System.err));
    }

    static int execute(String[] args, PrintStream out, PrintStream err) {
        try {
            if ((args == null) || (args.length != 1)) {
                err.println(usage());
                return 1;
            }

            int numThreads = Integer.parseInt(System.getProperty(NUM_THREADS_PROPERTY, "1"));
            LOGGER.log("num_threads property: " + numThreads);
            LOGGER.log("Given request file: " + args[0]);

            String request = new String(Files.readAllBytes(Paths.get(args[0])), StandardCharsets.UTF_8);
            RunRequest runRequest = new JsonRunRequestParser().parseRunRequest(request);
            LOGGER.log("Parsed " + runRequest);

            List<Suite> suites = loadSuites(runRequest.suiteClassNames);

            RunSummary summary = SuiteRunner.Builder.newBuilder()
                    .reporter(JsonEventWriter.writingTo(out))
                    .filter(runRequest.filter)
                    .configMap(runRequest.configMap)
                    .numThreads(numThreads)
                    .build()
                    .run(suites);

            LOGGER.log(summary.toString());
            return summary.isSuccessful() ? 0 : 1;

        } catch (ParseException | IOException | ReflectiveOperationException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while waiting for suites to finish.");
            return 1;
        } catch (Throwable t) {
            err.println("Unexpected Error!");
            t.printStackTrace(err);
            return 1;
        } finally {
            LOGGER.log("Exiting.");
        }
    }

    private static List<Suite> loadSuites(List<String> classNames) throws ReflectiveOperationException {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        List<Suite> suites = new ArrayList<>();
        for (String className : classNames) {
            Class<?> suiteClass = Class.forName(className, true, classLoader);
            if (!Suite.class.isAssignableFrom(suiteClass)) {
                throw new IllegalArgumentException(className + " is not a " + Suite.class.getName());
            }
            LOGGER.log("Loaded suite class: " + className);
            suites.add((Suite) suiteClass.getDeclaredConstructor().newInstance());
        }
        return suites;
    }

    private static String usage() {
        return SingleRunEntryPoint.class.getName()
                + " <request>"
                + "\n\trequest: a path to a file holding the JSON run request.";
    }
}

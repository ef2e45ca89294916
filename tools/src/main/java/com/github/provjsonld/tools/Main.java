package com.github.provjsonld.tools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.provjsonld.core.ConversionResult;
import com.github.provjsonld.core.ProvJsonLdConsts;
import com.github.provjsonld.core.ProvJsonLdError;
import com.github.provjsonld.core.ProvJsonLdOptions;
import com.github.provjsonld.core.ProvJsonLdProcessor;
import com.github.provjsonld.utils.JSONUtils;

/**
 * Command line front end of the converter.
 * <p>
 * {@link #main(String...)} calls {@link System#exit(int)} with the status
 * returned by {@link #run(PrintStream, PrintStream, String...)}; embedding
 * code should call the latter.
 * </p>
 */
public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;

    public static final int EXIT_FAILED = 1;

    public static final int EXIT_USAGE = 2;

    private Main() {
    }

    /**
     * Main method.
     *
     * @param args
     *            command line arguments
     */
    public static void main(final String... args) {
        System.exit(run(System.out, System.err, args));
    }

    /**
     * Parses the arguments and runs one conversion.
     *
     * @return the exit status
     */
    public static int run(final PrintStream out, final PrintStream err, final String... args) {

        boolean showHelp = false;
        boolean showVersion = false;
        boolean verbose = false;
        boolean pretty = false;
        final ProvJsonLdOptions options = new ProvJsonLdOptions();

        int index = 0;
        while (index < args.length && args[index].startsWith("-") && args[index].length() > 1) {
            final String arg = args[index];
            if (arg.equals("-h")) {
                showHelp = true;
            } else if (arg.equals("-v")) {
                showVersion = true;
            } else if (arg.equals("-V")) {
                verbose = true;
            } else if (arg.equals("-s")) {
                options.setStrict(true);
            } else if (arg.equals("-l")) {
                options.setLenientPrefixes(true);
            } else if (arg.equals("-t")) {
                options.setTypedBundles(true);
            } else if (arg.equals("-r")) {
                options.setCheckReferences(true);
            } else if (arg.equals("-p")) {
                pretty = true;
            } else if (arg.equals("-c")) {
                if (index + 1 == args.length || args[index + 1].isEmpty()) {
                    err.println("INVOCATION ERROR. Option -c requires a URL\n");
                    return EXIT_USAGE;
                }
                options.setContextUrl(args[++index]);
            } else {
                err.println("INVOCATION ERROR. Unknown option " + arg + "\n");
                return EXIT_USAGE;
            }
            ++index;
        }

        if (verbose) {
            setLogLevel("com.github.provjsonld", "DEBUG");
        }

        if (showVersion) {
            out.println(String.format("PROV-JSON to PROV-JSONLD converter %s\nJava %s (%s)",
                    readVersion("com.github.provjsonld", "provjsonld-tools", "unknown version"),
                    System.getProperty("java.version"), System.getProperty("java.vendor")));
            return EXIT_OK;
        }

        if (showHelp) {
            out.println(help());
            return EXIT_OK;
        }

        if (args.length - index != 2) {
            err.println("INVOCATION ERROR. Expected INPUT and OUTPUT paths, got "
                    + (args.length - index) + " argument(s)\n");
            err.println(help());
            return EXIT_USAGE;
        }

        final File input = new File(args[index]);
        final File output = new File(args[index + 1]);

        try {
            final long ts = System.currentTimeMillis();
            final ConversionResult result = convert(input, options);
            write(output, result, pretty);
            LOGGER.info("Converted {} to {} in {} ms ({} warnings)", input, output,
                    System.currentTimeMillis() - ts, result.getWarnings().size());
            out.println("Converted PROV-JSON to PROV-JSONLD: " + output);
            return EXIT_OK;

        } catch (final ProvJsonLdError ex) {
            err.println("CONVERSION FAILED. " + ex.getMessage() + "\n");
            LOGGER.debug("Conversion of {} failed", input, ex);
            return EXIT_FAILED;
        }
    }

    private static ConversionResult convert(final File input, final ProvJsonLdOptions options)
            throws ProvJsonLdError {
        final InputStream stream;
        try {
            stream = new FileInputStream(input);
        } catch (final IOException ex) {
            throw new ProvJsonLdError(ProvJsonLdError.Error.IO_ERROR, "cannot open " + input
                    + ": " + ex.getMessage(), ex);
        }
        try {
            return ProvJsonLdProcessor.fromProvJson(stream, options);
        } finally {
            closeQuietly(stream);
        }
    }

    private static void write(final File output, final ConversionResult result,
            final boolean pretty) throws ProvJsonLdError {
        try {
            final Writer writer = new OutputStreamWriter(new FileOutputStream(output),
                    StandardCharsets.UTF_8);
            try {
                if (pretty) {
                    JSONUtils.writePrettyPrint(writer, result.getDocument());
                } else {
                    JSONUtils.write(writer, result.getDocument());
                }
            } finally {
                writer.close();
            }
        } catch (final IOException ex) {
            throw new ProvJsonLdError(ProvJsonLdError.Error.IO_ERROR, "cannot write " + output
                    + ": " + ex.getMessage(), ex);
        }
    }

    private static void closeQuietly(final InputStream stream) {
        try {
            stream.close();
        } catch (final IOException ex) {
            LOGGER.debug("Could not close input", ex);
        }
    }

    private static void setLogLevel(final String loggerName, final String levelName) {
        try {
            final Logger logger = LoggerFactory.getLogger(loggerName);
            final Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            final Class<?> loggerClass = Class.forName("ch.qos.logback.classic.Logger");
            final Object level = levelClass.getDeclaredMethod("valueOf", String.class).invoke(
                    null, levelName);
            loggerClass.getDeclaredMethod("setLevel", levelClass).invoke(logger, level);
        } catch (final Exception ex) {
            LOGGER.warn("Cannot change log level: logback is not the SLF4J binding");
        }
    }

    private static String help() {
        return String.format(readResource(Main.class.getResource("Main.help")),
                readVersion("com.github.provjsonld", "provjsonld-tools", "unknown version"),
                ProvJsonLdConsts.DEFAULT_CONTEXT_URL);
    }

    private static String readVersion(final String groupId, final String artifactId,
            final String defaultValue) {

        final URL url = Main.class.getClassLoader().getResource(
                "META-INF/maven/" + groupId + "/" + artifactId + "/pom.properties");

        if (url != null) {
            try {
                final InputStream stream = url.openStream();
                try {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    return properties.getProperty("version").trim();
                } finally {
                    stream.close();
                }

            } catch (final IOException ex) {
                LOGGER.warn("Could not parse version string in " + url);
            }
        }

        return defaultValue;
    }

    private static String readResource(final URL url) {
        try {
            final BufferedReader reader = new BufferedReader(new InputStreamReader(
                    url.openStream(), StandardCharsets.UTF_8));
            final StringBuilder builder = new StringBuilder();
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    builder.append(line).append("\n");
                }
            } finally {
                reader.close();
            }
            return builder.toString();
        } catch (final IOException ex) {
            throw new IllegalStateException("Could not load resource " + url, ex);
        }
    }

}

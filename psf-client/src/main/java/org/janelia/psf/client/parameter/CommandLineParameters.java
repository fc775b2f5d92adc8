package org.janelia.psf.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.psf.util.JsonUtils;

/**
 * Base parameters for all PSF command line tools.
 *
 * Subclasses declare their own {@link Parameter} fields and can override {@link #validate()}
 * to reject combinations of values that JCommander cannot check on its own.
 *
 * @author Eric Trautman
 */
@Parameters
public class CommandLineParameters implements Serializable {

    public static final int HELP_EXIT_STATUS = 0;
    public static final int INVALID_EXIT_STATUS = 1;

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses and validates the specified arguments, exiting the JVM after printing usage
     * if help was requested or if the arguments are invalid.
     */
    public void parse(final String[] args,
                      final Class<?> programClass) {
        if (! parse(args, programClass, false)) {
            System.exit(help ? HELP_EXIT_STATUS : INVALID_EXIT_STATUS);
        }
    }

    /**
     * Parses and validates the specified arguments, printing usage
     * if help was requested or if the arguments are invalid.
     *
     * @return true if the arguments are usable, false if help was requested or the arguments are invalid.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass,
                         final boolean exitOnHelpOrFailure) {

        final JCommander jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -cp psf-client-standalone.jar " + programClass.getName())
                .build();

        String problem = null;
        try {
            jCommander.parse(args);
            if (! help) {
                validate();
            }
        } catch (final ParameterException | IllegalArgumentException e) {
            problem = e.getMessage();
        }

        final boolean usable = (problem == null) && (! help);
        if (! usable) {
            final StringBuilder report = new StringBuilder();
            if (problem != null) {
                report.append("\nERROR: invalid command line arguments\n\n").append(problem).append("\n");
            }
            report.append("\n");
            jCommander.getUsageFormatter().usage(report);
            jCommander.getConsole().println(report.toString());
            if (exitOnHelpOrFailure) {
                System.exit(help ? HELP_EXIT_STATUS : INVALID_EXIT_STATUS);
            }
        }

        return usable;
    }

    /**
     * Checks relationships between parsed values.
     * Does nothing by default.
     *
     * @throws IllegalArgumentException
     *   if the parsed values cannot be used together.
     */
    public void validate()
            throws IllegalArgumentException {
    }

    /**
     * @return JSON representation of these parameters (for logging).
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.FAST_MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Requests help for the specified parameters without exiting.
     * Used by tests to verify that parameter annotations are consistent.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        final Class<?> enclosingClass = parameters.getClass().getEnclosingClass();
        parameters.parse(new String[] { "--help" },
                         enclosingClass == null ? parameters.getClass() : enclosingClass,
                         false);
    }

}

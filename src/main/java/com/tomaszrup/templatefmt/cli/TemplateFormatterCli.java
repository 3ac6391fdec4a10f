////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.templatefmt.cli;

import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.TemplateFormatter;
import com.tomaszrup.templatefmt.util.LogLevels;
import com.tomaszrup.templatefmt.util.MdcFileContext;
import com.tomaszrup.templatefmt.util.TargetVersion;
import com.tomaszrup.templatefmt.util.TargetVersionDetector;

/**
 * Command-line front end: formats the named template files in place, or
 * standard input to standard output for {@code -}.
 */
public final class TemplateFormatterCli {

    private static final Logger logger = LoggerFactory.getLogger(TemplateFormatterCli.class);

    static final String PROGRAM_NAME = "template-formatter";

    private static final String OPT_CHECK = "check";
    private static final String OPT_TARGET_VERSION = "target-version";
    private static final String OPT_LOG_LEVEL = "log-level";
    private static final String OPT_HELP = "help";
    private static final String OPT_VERSION = "version";

    private TemplateFormatterCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the formatter with the given arguments and streams.
     *
     * @return the process exit code
     */
    public static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        Options options = buildOptions();
        CommandLine line;
        try {
            line = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            stderr.println("error: " + e.getMessage());
            printUsage(options, stderr);
            return FormatSummary.EXIT_USAGE;
        }

        if (line.hasOption(OPT_HELP)) {
            printHelp(options, stdout);
            return FormatSummary.EXIT_OK;
        }
        if (line.hasOption(OPT_VERSION)) {
            stdout.println(PROGRAM_NAME + " " + version());
            return FormatSummary.EXIT_OK;
        }
        if (line.hasOption(OPT_LOG_LEVEL)) {
            LogLevels.apply(line.getOptionValue(OPT_LOG_LEVEL));
        }

        List<String> filenames = line.getArgList();
        if (filenames.isEmpty()) {
            stderr.println("error: no filenames given");
            printUsage(options, stderr);
            return FormatSummary.EXIT_USAGE;
        }

        Path workingDirectory = Paths.get("").toAbsolutePath();
        Optional<TargetVersion> targetVersion;
        if (line.hasOption(OPT_TARGET_VERSION)) {
            try {
                targetVersion = Optional.of(TargetVersion.parse(line.getOptionValue(OPT_TARGET_VERSION)));
            } catch (IllegalArgumentException e) {
                stderr.println("error: " + e.getMessage());
                return FormatSummary.EXIT_USAGE;
            }
        } else {
            targetVersion = TargetVersionDetector.detect(workingDirectory);
        }
        logger.debug("Target version: {}", targetVersion.map(TargetVersion::toString).orElse("none"));

        MdcFileContext.setWorkingDirectory(workingDirectory);
        FormatRunner runner = new FormatRunner(new TemplateFormatter(), targetVersion,
                line.hasOption(OPT_CHECK), stdin, stdout, stderr);
        FormatSummary summary = new FormatSummary();
        for (String filename : filenames) {
            FileOutcome outcome = runner.formatPath(filename);
            summary.record(outcome, FormatRunner.STDIN_NAME.equals(filename));
        }

        String message = summary.message();
        if (!message.isEmpty()) {
            stderr.println(message);
        }
        return summary.exitCode();
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder()
                .longOpt(OPT_CHECK)
                .desc("Don't write files, only report those that would be reformatted")
                .build());
        options.addOption(Option.builder()
                .longOpt(OPT_TARGET_VERSION)
                .hasArg()
                .argName("VERSION")
                .desc("Framework version to migrate templates to, one of: " + TargetVersion.supportedList()
                        + " (default: detected from pyproject.toml)")
                .build());
        options.addOption(Option.builder()
                .longOpt(OPT_LOG_LEVEL)
                .hasArg()
                .argName("LEVEL")
                .desc("Log level: ERROR, WARN, INFO, DEBUG or TRACE")
                .build());
        options.addOption("h", OPT_HELP, false, "Show this help and exit");
        options.addOption("V", OPT_VERSION, false, "Show the version and exit");
        return options;
    }

    private static void printHelp(Options options, PrintStream out) {
        PrintWriter writer = new PrintWriter(out, true, StandardCharsets.UTF_8);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, PROGRAM_NAME + " [OPTIONS] FILENAMES...",
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, false);
        writer.flush();
    }

    private static void printUsage(Options options, PrintStream out) {
        PrintWriter writer = new PrintWriter(out, true, StandardCharsets.UTF_8);
        new HelpFormatter().printUsage(writer, HelpFormatter.DEFAULT_WIDTH, PROGRAM_NAME, options);
        writer.flush();
    }

    static String version() {
        String version = TemplateFormatterCli.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}

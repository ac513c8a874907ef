package com.github.danielflower.mavenplugins.releaseplan.compat;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import org.apache.maven.plugin.logging.Log;
import org.codehaus.plexus.util.StringUtils;
import org.codehaus.plexus.util.cli.CommandLineException;
import org.codehaus.plexus.util.cli.CommandLineUtils;
import org.codehaus.plexus.util.cli.Commandline;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Runs an external API comparison tool. The command may use the placeholders <code>{package}</code>,
 * <code>{current}</code> (the package directory) and <code>{baseline}</code> (the published copy). Exit code 0
 * means compatible; anything else is reported as incompatible with the tool output as details.
 */
public class CommandLineCompatibilityChecker implements CompatibilityChecker {

    public static final String PACKAGE_PLACEHOLDER = "{package}";
    public static final String CURRENT_PLACEHOLDER = "{current}";
    public static final String BASELINE_PLACEHOLDER = "{baseline}";

    private final Log log;
    private final String executable;
    private final String[] arguments;

    public CommandLineCompatibilityChecker(Log log, String command) throws ValidationException {
        this.log = log;
        String[] parts;
        try {
            parts = CommandLineUtils.translateCommandline(command);
        } catch (Exception e) {
            throw new ValidationException("The compatibility command could not be parsed: " + command, e);
        }
        if (parts.length == 0) {
            throw new ValidationException("The compatibility command is empty",
                Arrays.asList("Set compatibilityCommand to the tool that compares a module with its published version."));
        }
        this.executable = parts[0];
        this.arguments = Arrays.copyOfRange(parts, 1, parts.length);
    }

    @Override
    public boolean isAvailable() {
        if (executable.contains("/") || executable.contains(File.separator)) {
            return new File(executable).canExecute();
        }
        String path = System.getenv("PATH");
        if (StringUtils.isEmpty(path)) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (new File(dir, executable).canExecute() || new File(dir, executable + ".exe").canExecute()
                || new File(dir, executable + ".cmd").canExecute()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public CompatibilityCheck check(Package pkg, Path publishedDirectory) throws IOException {
        Commandline commandline = new Commandline();
        commandline.setExecutable(executable);
        commandline.setWorkingDirectory(pkg.getDirectory().toFile());
        for (String argument : arguments) {
            commandline.createArg().setValue(argument
                .replace(PACKAGE_PLACEHOLDER, pkg.getName())
                .replace(CURRENT_PLACEHOLDER, pkg.getDirectory().toString())
                .replace(BASELINE_PLACEHOLDER, publishedDirectory.toString()));
        }
        log.debug("Checking the API of " + pkg.getName() + ": " + commandline);

        CommandLineUtils.StringStreamConsumer out = new CommandLineUtils.StringStreamConsumer();
        CommandLineUtils.StringStreamConsumer err = new CommandLineUtils.StringStreamConsumer();
        int exitCode;
        try {
            exitCode = CommandLineUtils.executeCommandLine(commandline, out, err);
        } catch (CommandLineException e) {
            throw new IOException("Could not run " + executable + " for " + pkg.getName(), e);
        }
        if (exitCode == 0) {
            return CompatibilityCheck.compatible();
        }
        String details = (out.getOutput() + err.getOutput()).trim();
        return CompatibilityCheck.incompatible(details.isEmpty() ? executable + " exited with " + exitCode : details);
    }
}

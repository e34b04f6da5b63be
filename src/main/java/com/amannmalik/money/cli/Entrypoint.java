package com.amannmalik.money.cli;

import com.amannmalik.money.api.MoneyException;
import com.amannmalik.money.codec.JsonDecodingException;
import com.amannmalik.money.decimal.DecimalContext;
import com.amannmalik.money.decimal.DecimalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

public final class Entrypoint {
    private static final Logger LOG = LoggerFactory.getLogger(Entrypoint.class);

    private Entrypoint() {
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        var root = new RootCommand();
        var commandLine = new CommandLine(root);
        commandLine.addSubcommand("sum", new AggregateCommand(AggregateCommand.Kind.SUM));
        commandLine.addSubcommand("min", new AggregateCommand(AggregateCommand.Kind.MIN));
        commandLine.addSubcommand("max", new AggregateCommand(AggregateCommand.Kind.MAX));
        commandLine.addSubcommand("round", new RoundCommand());
        commandLine.addSubcommand("to-cents", new ToCentsCommand());
        commandLine.addSubcommand("from-cents", new FromCentsCommand());
        commandLine.setExecutionStrategy(parseResult -> {
            root.applyDefaultScale();
            return new RunLast().execute(parseResult);
        });
        commandLine.setExecutionExceptionHandler(Entrypoint::handleFailure);
        return commandLine;
    }

    private static int handleFailure(Exception e, CommandLine commandLine, ParseResult parseResult) throws Exception {
        if (e instanceof DecimalException
                || e instanceof MoneyException
                || e instanceof JsonDecodingException) {
            LOG.debug("Command {} failed", commandLine.getCommandName(), e);
            commandLine.getErr().println("error: " + e.getMessage());
            return 1;
        }
        throw e;
    }

    @Command(
            name = "money",
            description = "Currency-tagged decimal arithmetic",
            mixinStandardHelpOptions = true,
            versionProvider = ManifestVersionProvider.class)
    static final class RootCommand implements Runnable {
        @Spec
        private CommandSpec spec;

        @Option(
                names = "--default-scale",
                description = "Fractional digits kept by operations without an explicit scale (default: 20)")
        Integer defaultScale;

        RootCommand() {
        }

        void applyDefaultScale() {
            if (defaultScale != null) {
                DecimalContext.configure(new DecimalContext(defaultScale));
            }
        }

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
    }

    public static final class ManifestVersionProvider implements IVersionProvider {
        public ManifestVersionProvider() {
        }

        @Override
        public String[] getVersion() {
            var version = Entrypoint.class.getPackage().getImplementationVersion();
            if (version == null || version.isBlank()) {
                version = "development";
            }
            return new String[]{"money " + version};
        }
    }
}

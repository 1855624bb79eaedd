package work.stackenv.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.stackenv.api.StackenvConfiguration;
import work.stackenv.env.Environment;
import work.stackenv.env.EnvironmentStore;
import work.stackenv.install.BuildCollaborator;
import work.stackenv.install.BuildCollaboratorProvider;
import work.stackenv.install.BuildFailureException;
import work.stackenv.install.DirectoryStageCollaborator;
import work.stackenv.install.InstallReport;
import work.stackenv.install.PrefixBuildCollaborator;
import work.stackenv.spec.Spec;

@CommandLine.Command(
    name = "env",
    description = "Create, modify, concretize and install environments.",
    mixinStandardHelpOptions = true,
    subcommands = {
        EnvCommand.Create.class,
        EnvCommand.Destroy.class,
        EnvCommand.ListEnvironments.class,
        EnvCommand.Add.class,
        EnvCommand.Remove.class,
        EnvCommand.Concretize.class,
        EnvCommand.Install.class,
        EnvCommand.Uninstall.class,
        EnvCommand.Status.class,
        EnvCommand.Stage.class,
        EnvCommand.Loads.class,
        EnvCommand.Upgrade.class
    }
)
final class EnvCommand implements Runnable {
    @CommandLine.ParentCommand
    private StackenvCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private StackenvConfiguration configuration;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    StackenvConfiguration configuration() {
        if (configuration == null) {
            configuration = parent.configuration();
        }
        return configuration;
    }

    EnvironmentStore store() {
        return new EnvironmentStore(configuration());
    }

    /**
     * First non-blank candidate, else {@code STACKENV_ENV}; a usage error when neither is available.
     */
    String environmentName(CommandLine.Model.CommandSpec command, String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        String fromEnv = parent.variable(StackenvCommand.ENV_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        throw new CommandLine.ParameterException(
            command.commandLine(),
            "`stackenv env " + command.name() + "` requires an environment: pass ENV or set " + StackenvCommand.ENV_VARIABLE
        );
    }

    BuildCollaborator builds(CommandLine.Model.CommandSpec command, String name) {
        List<String> names = new ArrayList<>();
        for (BuildCollaboratorProvider provider : BuildCollaboratorProvider.available()) {
            if (provider.name().equals(name)) {
                return provider.create(configuration());
            }
            names.add(provider.name());
        }
        throw new CommandLine.ParameterException(
            command.commandLine(),
            "Unknown build collaborator '" + name + "' (available: " + String.join(", ", names) + ")"
        );
    }

    static void printTree(PrintWriter out, Spec root) {
        out.println("    " + root.shortHash() + "  " + root.format());
        for (Spec node : root.traverse()) {
            if (node != root) {
                out.println("    " + node.shortHash() + "      ^" + node.format());
            }
        }
    }

    /**
     * Shared plumbing of the subcommands.
     */
    abstract static class EnvSubcommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        EnvCommand env;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        PrintWriter out() {
            return spec.commandLine().getOut();
        }
    }

    /**
     * Subcommands operating on one existing environment.
     */
    abstract static class SelectingSubcommand extends EnvSubcommand {
        @CommandLine.Option(
            names = {"-e", "--env"},
            paramLabel = "ENV",
            description = "Environment to operate on (default: $STACKENV_ENV).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        String envOption;

        Environment open(String positional) {
            return env.store().read(env.environmentName(spec, positional, envOption));
        }
    }

    @CommandLine.Command(name = "create", description = "Create a new environment.")
    static final class Create extends EnvSubcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Name of the environment.")
        String name;

        @CommandLine.Parameters(
            index = "1",
            arity = "0..1",
            paramLabel = "MANIFEST",
            description = "Optional stackenv.yaml to initialize the environment from."
        )
        Path manifest;

        @Override
        public Integer call() throws Exception {
            Environment created = manifest == null
                ? env.store().create(name, null)
                : env.store().create(name, Files.readString(manifest), manifest.toString());
            out().println("==> Created environment '" + name + "' in " + created.path());
            return 0;
        }
    }

    @CommandLine.Command(name = "destroy", description = "Remove environments and their files.")
    static final class Destroy extends EnvSubcommand {
        @CommandLine.Option(names = {"-y", "--yes-to-all"}, description = "Do not ask for confirmation.")
        boolean yes;

        @CommandLine.Parameters(arity = "1..*", paramLabel = "NAME", description = "Environments to remove.")
        List<String> names = new ArrayList<>();

        @Override
        public Integer call() {
            if (!yes) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Refusing to destroy environments without -y");
            }
            EnvironmentStore store = env.store();
            for (String name : names) {
                store.destroy(name);
                out().println("==> Successfully removed environment '" + name + "'");
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "list", description = "List environments.")
    static final class ListEnvironments extends EnvSubcommand {
        @Override
        public Integer call() {
            List<String> names = env.store().list();
            if (names.isEmpty()) {
                out().println("==> No environments");
                return 0;
            }
            out().println("==> " + names.size() + " environments");
            names.forEach(name -> out().println("    " + name));
            return 0;
        }
    }

    @CommandLine.Command(name = "add", description = "Add specs to an environment.")
    static final class Add extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "1..*", paramLabel = "SPEC", description = "Abstract specs to add.")
        List<String> specs = new ArrayList<>();

        @Override
        public Integer call() {
            Environment environment = open(null);
            for (String raw : specs) {
                Spec added = environment.add(raw);
                out().println("==> Adding " + added + " to environment " + environment.name());
            }
            environment.write();
            return 0;
        }
    }

    @CommandLine.Command(name = "remove", description = "Remove specs from an environment.")
    static final class Remove extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "1..*", paramLabel = "SPEC", description = "Specs to remove.")
        List<String> specs = new ArrayList<>();

        @Override
        public Integer call() {
            Environment environment = open(null);
            for (String raw : specs) {
                Spec removed = environment.remove(raw);
                out().println("==> Removing " + removed + " from environment " + environment.name());
            }
            environment.write();
            return 0;
        }
    }

    @CommandLine.Command(name = "concretize", description = "Concretize an environment and write its lockfile.")
    static final class Concretize extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "0..1", paramLabel = "ENV", description = "Environment name.")
        String name;

        @Override
        public Integer call() {
            Environment environment = open(name);
            List<Spec> roots = environment.concretize();
            environment.write();
            for (int i = 0; i < roots.size(); i++) {
                out().println("==> Concretized " + environment.userSpecs().get(i));
                printTree(out(), roots.get(i));
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "install", description = "Install every package of an environment.")
    static final class Install extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "0..1", paramLabel = "ENV", description = "Environment name.")
        String name;

        @CommandLine.Option(names = "--fake", description = "Only record install prefixes; do not build.")
        boolean fake;

        @CommandLine.Option(
            names = "--builder",
            paramLabel = "NAME",
            description = "Build collaborator to use.",
            defaultValue = PrefixBuildCollaborator.Provider.NAME,
            showDefaultValue = CommandLine.Help.Visibility.ALWAYS
        )
        String builder;

        @Override
        public Integer call() {
            Environment environment = open(name);
            BuildCollaborator builds = env.builds(spec, fake ? PrefixBuildCollaborator.Provider.NAME : builder);
            InstallReport report = environment.install(builds);
            environment.write();
            report.installed().forEach(node -> out().println("==> Installed " + node.format() + "/" + node.shortHash()));
            report.upToDate().forEach(node -> out().println("==> " + node.format() + "/" + node.shortHash() + " is already installed"));
            for (BuildFailureException failure : report.failures()) {
                out().println("==> Error: " + failure.getMessage());
            }
            report.skipped().forEach(node -> out().println("==> Skipped " + node.format() + "/" + node.shortHash()));
            return report.success() ? 0 : 1;
        }
    }

    @CommandLine.Command(name = "uninstall", description = "Uninstall every package of an environment.")
    static final class Uninstall extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "0..1", paramLabel = "ENV", description = "Environment name.")
        String name;

        @Override
        public Integer call() {
            Environment environment = open(name);
            List<Spec> removed = environment.uninstall(env.builds(spec, PrefixBuildCollaborator.Provider.NAME));
            removed.forEach(node -> out().println("==> Uninstalled " + node.format() + "/" + node.shortHash()));
            return 0;
        }
    }

    @CommandLine.Command(name = "status", description = "Show the specs of an environment and their install status.")
    static final class Status extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "0..1", paramLabel = "ENV", description = "Environment name.")
        String name;

        @Override
        public Integer call() {
            Environment environment = open(name);
            environment.status(out(), env.builds(spec, PrefixBuildCollaborator.Provider.NAME));
            out().flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "stage", description = "Create stage directories for every package of an environment.")
    static final class Stage extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "0..1", paramLabel = "ENV", description = "Environment name.")
        String name;

        @Override
        public Integer call() {
            Environment environment = open(name);
            if (!environment.isConcretized()) {
                environment.concretize();
                environment.write();
            }
            DirectoryStageCollaborator stager = new DirectoryStageCollaborator(env.configuration().stageDirectory());
            environment.stage(stager).forEach(dir -> out().println("==> Staged " + dir));
            return 0;
        }
    }

    @CommandLine.Command(name = "loads", description = "Write the module load list of an environment.")
    static final class Loads extends SelectingSubcommand {
        @CommandLine.Parameters(arity = "0..1", paramLabel = "ENV", description = "Environment name.")
        String name;

        @Override
        public Integer call() throws Exception {
            Environment environment = open(name);
            Path loads = environment.writeLoads(env.builds(spec, PrefixBuildCollaborator.Provider.NAME));
            out().println("==> Wrote " + loads);
            Files.readAllLines(loads).forEach(line -> out().println("    " + line));
            return 0;
        }
    }

    @CommandLine.Command(name = "upgrade", description = "Upgrade one package of an environment to its best version.")
    static final class Upgrade extends SelectingSubcommand {
        @CommandLine.Parameters(index = "0", paramLabel = "NAME", description = "Package to upgrade.")
        String packageName;

        @Override
        public Integer call() {
            Environment environment = open(null);
            List<Spec> roots = environment.upgradeDependency(packageName);
            environment.write();
            for (Spec root : roots) {
                printTree(out(), root);
            }
            return 0;
        }
    }
}

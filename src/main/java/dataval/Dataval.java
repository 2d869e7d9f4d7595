package dataval;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "dataval",
        mixinStandardHelpOptions = true,
        subcommands = {Clear.class, Copy.class, Status.class, Index.class},
        versionProvider = DatavalVersionProvider.class,
        description = "Checksum validated backup and clearing of session data")
public class Dataval implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        spec.commandLine().usage(System.err);
        return 0;
    }
}

package skytiles;

import skytiles.acquisition.cli.RootCommand;
import picocli.CommandLine;

public final class App {
    private App() {}

    public static void main(String[] args) {
        CommandLine cli = new CommandLine(new RootCommand());
        cli.setExpandAtFiles(false);
        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }
}

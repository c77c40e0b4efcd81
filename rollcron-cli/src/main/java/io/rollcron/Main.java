package io.rollcron;

import io.rollcron.cli.RollcronCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RollcronCommand()).execute(args);
        System.exit(code);
    }
}

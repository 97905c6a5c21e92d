package io.looming;

import io.looming.cli.LoomingCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LoomingCommand()).execute(args);
        System.exit(code);
    }
}

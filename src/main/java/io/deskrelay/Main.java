package io.deskrelay;

import io.deskrelay.cli.DeskRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DeskRelayCommand()).execute(args);
        System.exit(code);
    }
}

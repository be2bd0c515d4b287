package com.questrail.meshgate;

import com.questrail.meshgate.cli.GatewayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GatewayCommand()).execute(args);
        System.exit(code);
    }
}

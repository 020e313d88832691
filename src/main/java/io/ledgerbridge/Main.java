package io.ledgerbridge;

import io.ledgerbridge.cli.LedgerBridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LedgerBridgeCommand()).execute(args);
        System.exit(code);
    }
}

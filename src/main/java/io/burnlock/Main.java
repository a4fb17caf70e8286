package io.burnlock;

import io.burnlock.cli.BurnlockCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = BurnlockCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}

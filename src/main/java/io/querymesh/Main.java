package io.querymesh;

import io.querymesh.cli.QueryMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new QueryMeshCommand()).execute(args);
        System.exit(code);
    }
}

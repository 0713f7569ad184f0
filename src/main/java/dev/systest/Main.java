package dev.systest;

import dev.systest.cli.SysTestCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SysTestCli()).execute(args);
        System.exit(exitCode);
    }
}

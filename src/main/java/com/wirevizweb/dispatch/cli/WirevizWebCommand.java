package com.wirevizweb.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for WireViz-Web.
 * Routes to subcommands: serve, render, decode, encode, health.
 */
@Command(
        name = "wireviz-web",
        mixinStandardHelpOptions = true,
        version = "WireViz-Web 0.1.0",
        description = "Render WireViz cable and harness diagrams over HTTP or from the command line",
        subcommands = {
                ServeCommand.class,
                RenderCommand.class,
                DecodeCommand.class,
                EncodeCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WirevizWebCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help. Reuse the running
        // CommandLine: its factory knows how to build the subcommands.
        spec.commandLine().usage(System.out);
    }
}

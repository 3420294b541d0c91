package com.azure.simpleRuntime.tool;

import com.azure.simpleRuntime.tool.cli.InvokeCommand;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new InvokeCommand());
        int exitCode = cmd.execute(args);

        logger.debug("simple-runtime finished with exit code {}", exitCode);
        System.exit(exitCode);
    }
}

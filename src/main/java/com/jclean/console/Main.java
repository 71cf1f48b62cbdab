package com.jclean.console;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.jclean.session.CommandDispatcher;
import com.jclean.session.CommandResult;
import com.jclean.session.Session;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of the interactive cleaning tool.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws IOException {
        LauncherOptions options = new LauncherOptions();
        JCommander commander = JCommander.newBuilder()
            .addObject(options)
            .programName("jclean")
            .build();
        try {
            commander.parse(args);
            options.getDelimiter();
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            commander.usage();
            System.exit(1);
            return;
        }
        if (options.isHelp()) {
            commander.usage();
            return;
        }

        CommandDispatcher dispatcher = new CommandDispatcher(new Session(), options.toConfig());
        if (options.getFile() != null) {
            CommandResult<Table> loaded = dispatcher.load(options.getFile());
            if (!loaded.isSuccess()) {
                logger.warn("Could not preload {}: {}", options.getFile(), loaded.getMessage());
            }
        }
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new ConsoleApp(dispatcher, in, System.out).run();
    }
}

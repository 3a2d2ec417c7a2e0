package com.example.jsonecho;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class JsonEchoCli {
    private static final Logger log = LoggerFactory.getLogger(JsonEchoCli.class);

    static final String DEFAULT_CONFIG = "json-echo.json";
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final Path workingDirectory;
    private final PrintStream out;

    JsonEchoCli(Path workingDirectory, PrintStream out) {
        this.workingDirectory = workingDirectory;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new JsonEchoCli(Paths.get("").toAbsolutePath(), System.out).run(args);
        System.exit(exitCode);
    }

    int run(String[] args) {
        Map<String, String> options = new HashMap<>();
        List<String> commands = new ArrayList<>();
        parseArguments(args, options, commands);
        if (options.containsKey("help")) {
            printUsage();
            return EXIT_OK;
        }
        if (commands.size() != 1) {
            printUsage();
            return EXIT_USAGE;
        }

        String configOption = options.getOrDefault("config", DEFAULT_CONFIG);
        Path configFile;
        try {
            configFile = Paths.get(configOption);
        } catch (InvalidPathException ex) {
            log.error("Invalid configuration path '{}': {}", configOption, ex.getReason());
            return EXIT_FAILURE;
        }
        PathResolver resolver = configFile.isAbsolute()
                ? new PathResolver(configFile.getParent())
                : PathResolver.discover(workingDirectory);
        ConfigLoader loader = new ConfigLoader(resolver);
        String configName = configFile.isAbsolute() ? configFile.getFileName().toString() : configFile.toString();

        try {
            return switch (commands.get(0)) {
                case "init" -> init(loader, configName);
                case "check" -> check(loader, configName);
                default -> {
                    out.println("Unknown command: " + commands.get(0));
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (JsonEchoException ex) {
            log.error("{} failed: {}", commands.get(0), ex.getMessage());
            log.debug("Failure detail", ex);
            return EXIT_FAILURE;
        }
    }

    private int init(ConfigLoader loader, String configName) {
        Path target = loader.resolver().resolve(configName);
        if (Files.exists(target)) {
            log.error("Refusing to overwrite existing configuration {}", target);
            return EXIT_FAILURE;
        }
        loader.save(configName, Configuration.defaults());
        out.println("Configuration file created at: " + target);
        return EXIT_OK;
    }

    private int check(ConfigLoader loader, String configName) {
        Configuration configuration = loader.load(configName);
        RouteStore store = RouteStore.populate(configuration.routes());
        out.printf("%d routes, serving on http://%s:%d%n",
                store.size(), configuration.hostname(), configuration.port());
        for (Model model : store.getModels()) {
            out.printf("  %-40s %d%s%n", model.identifier(), model.status(),
                    model.description() == null ? "" : "  " + model.description());
        }
        return EXIT_OK;
    }

    private static void parseArguments(String[] args, Map<String, String> options, List<String> commands) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                options.put("help", "true");
                continue;
            }
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length == 2) {
                    options.put(parts[0], parts[1]);
                }
                continue;
            }
            commands.add(arg);
        }
    }

    private void printUsage() {
        out.println("json-echo configuration tool");
        out.println("Usage: java -jar json-echo.jar [--config=PATH] <init|check>");
        out.println("  init   write a default " + DEFAULT_CONFIG);
        out.println("  check  load the configuration and list its routes");
    }
}

package io.codecarver.core;

import io.codecarver.core.api.ApiServer;
import io.codecarver.core.carver.Carver;
import io.codecarver.core.carver.DeploymentFailedException;
import io.codecarver.core.config.CarverConfig;
import io.codecarver.core.config.ConfigAudit;
import io.codecarver.core.ledger.InMemoryLedger;
import io.codecarver.core.ledger.PlacementLedger;
import io.codecarver.core.ledger.RocksDBLedger;
import io.codecarver.core.metrics.CarveMetrics;
import io.codecarver.core.protocol.AddressDerivation;
import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.Hex;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }
        int code;
        try {
            code = run(options, System.out);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            code = 1;
        }
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(CliOptions options, PrintStream out) throws IOException, InterruptedException {
        CarverConfig config = resolveConfig(options);
        Path ledgerPath = options.inMemory() ? null : options.dataDir().resolve("ledger").toAbsolutePath().normalize();

        if ("audit".equals(options.command())) {
            List<ConfigAudit.Finding> findings = ConfigAudit.audit(config, ledgerPath);
            findings.forEach(out::println);
            return ConfigAudit.hasErrors(findings) ? 2 : 0;
        }
        if ("address".equals(options.command())) {
            CodeAddress address = AddressDerivation.addressOf(config.engineAddress, Hex.parse(options.commandArg()));
            out.println(address.toChecksumHex());
            return 0;
        }

        PlacementLedger ledger = openLedger(config, ledgerPath);
        try {
            Carver carver = new Carver(ledger, config);
            switch (options.command()) {
                case "carve": {
                    try {
                        CodeAddress address = carver.carve(Hex.parse(options.commandArg()));
                        out.println(address.toChecksumHex());
                        return 0;
                    } catch (DeploymentFailedException e) {
                        out.println("Deployment failed: " + e.getMessage());
                        return 3;
                    }
                }
                case "verify": {
                    CodeAddress address = CodeAddress.fromHex(options.commandArg());
                    boolean carved = carver.isCarved(address);
                    out.println(address.toChecksumHex() + (carved ? " is carved" : " is not carved"));
                    return carved ? 0 : 4;
                }
                case "code": {
                    CodeAddress address = CodeAddress.fromHex(options.commandArg());
                    Optional<byte[]> code = carver.readCarved(address);
                    if (code.isEmpty()) {
                        out.println(address.toChecksumHex() + " holds no carved code");
                        return 4;
                    }
                    out.println(Hex.toPrefixedHex(code.get()));
                    return 0;
                }
                case "serve":
                    serve(carver, options);
                    return 0;
                default:
                    throw new IllegalStateException("Unhandled command: " + options.command());
            }
        } finally {
            if (ledger instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) ledger).close();
                } catch (Exception e) {
                    LOG.warning("Failed to close ledger: " + e.getMessage());
                }
            }
        }
    }

    static CarverConfig resolveConfig(CliOptions options) {
        Path configPath = options.configPath() != null
                ? options.configPath()
                : options.dataDir().resolve("carver.json");
        CarverConfig config = CarverConfig.loadOrDefault(configPath);
        if (options.engineAddress() != null) {
            config = config.withEngine(CodeAddress.fromHex(options.engineAddress()));
        }
        LOG.info("Effective config: " + config);
        return config;
    }

    private static PlacementLedger openLedger(CarverConfig config, Path ledgerPath) throws IOException {
        if (ledgerPath == null) {
            LOG.info("Using in-memory ledger");
            return new InMemoryLedger(config.hostRules);
        }
        Files.createDirectories(ledgerPath);
        LOG.info("Opening ledger at " + ledgerPath);
        return RocksDBLedger.open(ledgerPath.toString(), config.hostRules);
    }

    private static void serve(Carver carver, CliOptions options) throws IOException, InterruptedException {
        ApiServer apiServer = new ApiServer(carver, options.apiBind(), options.apiPort(), options.apiToken());
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "code-carver-shutdown"));
        try {
            apiServer.start();
            LOG.info("Carver running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            apiServer.stop();
            LOG.info("=== Metrics ===\n" + CarveMetrics.scrapeMetrics());
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            String command,
            String commandArg,
            Path dataDir,
            boolean inMemory,
            Path configPath,
            String engineAddress,
            String apiBind,
            int apiPort,
            String apiToken
    ) {
        private static final List<String> COMMANDS = List.of("address", "carve", "verify", "code", "audit", "serve");
        private static final List<String> COMMANDS_WITH_ARG = List.of("address", "carve", "verify", "code");

        static CliOptions parse(String[] args) {
            Path dataDir = envPath("CODE_CARVER_DATA_DIR", Path.of("./data/carver"));
            boolean inMemory = false;
            Path configPath = null;
            String engineAddress = envOrDefault("CODE_CARVER_ENGINE_ADDRESS", null);
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("CODE_CARVER_ENABLE_API"));
            String apiBind = envOrDefault("CODE_CARVER_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = System.getenv("CODE_CARVER_API_TOKEN");
            boolean showHelp = false;
            String error = null;
            List<String> positional = new ArrayList<>();

            try {
                apiPort = envPort("CODE_CARVER_API_PORT", 8080);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.startsWith("--config=")) {
                        configPath = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--engine-address=")) {
                        engineAddress = arg.substring("--engine-address=".length()).trim();
                        try {
                            CodeAddress.fromHex(engineAddress);
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = "Invalid value for --engine-address: " + engineAddress;
                        }
                    } else if (arg.equals("--enable-api")) {
                        enableApi = true;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        try {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else if (!arg.startsWith("--")) {
                        positional.add(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            String command = enableApi ? "serve" : "audit";
            String commandArg = null;
            if (!positional.isEmpty()) {
                command = positional.get(0);
                if (!COMMANDS.contains(command)) {
                    if (error == null) {
                        error = "Unknown command: " + command;
                    }
                    showHelp = true;
                } else if (COMMANDS_WITH_ARG.contains(command)) {
                    if (positional.size() < 2) {
                        if (error == null) {
                            error = "Command '" + command + "' requires an argument";
                        }
                        showHelp = true;
                    } else {
                        commandArg = positional.get(1);
                    }
                }
                int expected = COMMANDS_WITH_ARG.contains(command) ? 2 : 1;
                if (positional.size() > expected && error == null) {
                    showHelp = true;
                    error = "Unexpected argument: " + positional.get(expected);
                }
            }

            if (engineAddress != null && engineAddress.isBlank()) {
                engineAddress = null;
            }
            if (apiToken != null && apiToken.isBlank()) {
                apiToken = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    command,
                    commandArg,
                    dataDir,
                    inMemory,
                    configPath,
                    engineAddress,
                    apiBind,
                    apiPort,
                    apiToken
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: code-carver [options] [command] [argument]

Commands:
  address <hex>              Print the address runtime code would be carved at
  carve <hex>                Carve runtime code into the ledger and print its address
  verify <address>           Exit 0 if the address holds code that re-derives to it
  code <address>             Print the carved code stored at an address
  audit                      Check the effective configuration (default)
  serve                      Start the HTTP API and run until interrupted

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data and carver.json (default ./data/carver)
  --in-memory                Use a non-persistent ledger
  --config=<file>            Config file (default <data-dir>/carver.json)
  --engine-address=<addr>    Override the engine address used in every derivation
  --enable-api               Same as the 'serve' command
  --api-bind=<host>          Bind address for the HTTP API (default 127.0.0.1)
  --api-port=<port>          Port for the HTTP API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the HTTP API

Environment overrides:
  CODE_CARVER_DATA_DIR       Override --data-dir
  CODE_CARVER_ENGINE_ADDRESS Override the configured engine address
  CODE_CARVER_ENABLE_API     Set to "true" to serve without the CLI flag
  CODE_CARVER_API_BIND       Override --api-bind
  CODE_CARVER_API_PORT       Override --api-port
  CODE_CARVER_API_TOKEN      Token for API auth (if --api-token not supplied)
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}

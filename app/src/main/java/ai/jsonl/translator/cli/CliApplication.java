package ai.jsonl.translator.cli;

import ai.jsonl.translator.batch.BatchTranslationException;
import ai.jsonl.translator.batch.BatchTranslator;
import ai.jsonl.translator.batch.TreeTranslator;
import ai.jsonl.translator.config.Config;
import ai.jsonl.translator.config.ConfigLoader;
import ai.jsonl.translator.config.DotenvEnvironmentReader;
import ai.jsonl.translator.config.EnvironmentReader;
import ai.jsonl.translator.config.TranslatorConfig;
import ai.jsonl.translator.jsonl.JsonlFormatException;
import ai.jsonl.translator.jsonl.JsonlReader;
import ai.jsonl.translator.jsonl.JsonlWriter;
import ai.jsonl.translator.logging.LoggingConfigurator;
import ai.jsonl.translator.translate.ChatModelFactory;
import ai.jsonl.translator.translate.ChatModelTranslator;
import ai.jsonl.translator.translate.MockTranslator;
import ai.jsonl.translator.translate.PassThroughTranslator;
import ai.jsonl.translator.translate.Translator;
import ai.jsonl.translator.translate.TranslatorFactory;
import ai.jsonl.translator.tree.TreeValue;
import dev.langchain4j.model.chat.ChatModel;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and batch translator.
 */
public final class CliApplication {

    static final int EXIT_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final ChatModelFactory chatModelFactory;
    private final JsonlReader reader;
    private final JsonlWriter writer;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()
                        .orElse(new DotenvEnvironmentReader(Path.of(DotenvEnvironmentReader.DEFAULT_FILE_NAME)))),
                new ChatModelFactory(), new JsonlReader(), new JsonlWriter());
    }

    CliApplication(ConfigLoader configLoader, ChatModelFactory chatModelFactory, JsonlReader reader, JsonlWriter writer) {
        this.configLoader = configLoader;
        this.chatModelFactory = chatModelFactory;
        this.reader = reader;
        this.writer = writer;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        LOGGER.info("Loading settings from environment...");
        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        logSettings(config);

        ExecutorService modelExecutor = Executors.newFixedThreadPool(config.concurrencyLimit(), modelThreadFactory());
        try {
            Translator translator = createTranslatorFactory(config, modelExecutor).select(config.translationMode());

            LOGGER.info("Loading JSON objects from {}...", config.inputFile());
            List<TreeValue> records = reader.read(config.inputFile());
            LOGGER.info("{} JSON objects loaded.", records.size());

            LOGGER.info("Beginning translation tasks...");
            Instant start = Instant.now();
            List<TreeValue> translations = new BatchTranslator(new TreeTranslator(translator))
                    .translate(records, config.concurrencyLimit(), config.recordLimit());
            LOGGER.info("Translation tasks completed in {}.", Duration.between(start, Instant.now()));

            LOGGER.info("Saving translations to {}...", config.outputFile());
            writer.write(config.outputFile(), translations);
            LOGGER.info("Translations saved to {}.", config.outputFile());
            return 0;
        } catch (BatchTranslationException ex) {
            LOGGER.error("Translation aborted, nothing was written: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (JsonlFormatException | UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (IllegalStateException ex) {
            LOGGER.error("Failed to initialize the translator: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } finally {
            modelExecutor.shutdownNow();
        }
    }

    private void logSettings(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        LOGGER.info("Temperature : {}", translatorConfig.temperature());
        LOGGER.info("Max retries : {}", translatorConfig.maxRetries());
        LOGGER.info("Timeout : {} seconds", translatorConfig.timeout().toSeconds());
        LOGGER.info("Provider : {}", translatorConfig.provider());
        LOGGER.info("Model : {}", translatorConfig.modelName());
        LOGGER.info("URL : {}", translatorConfig.baseUrl().orElse("<provider default>"));
        LOGGER.info("Input file : {}", config.inputFile());
        LOGGER.info("Output file : {}", config.outputFile());
        LOGGER.info("Number of tasks : {}", config.concurrencyLimit());
        LOGGER.info("Lines limit : {}", config.hasRecordLimit() ? config.recordLimit() : "no limit");
        LOGGER.info("Target language : {} ({} mode)", config.targetLanguage(), config.translationMode());
    }

    private TranslatorFactory createTranslatorFactory(Config config, ExecutorService modelExecutor) {
        return new TranslatorFactory(() -> createProductionTranslator(config, modelExecutor),
                new PassThroughTranslator(), new MockTranslator());
    }

    private Translator createProductionTranslator(Config config, ExecutorService modelExecutor) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        LOGGER.info("Initializing language model...");
        ChatModel chatModel = chatModelFactory.create(translatorConfig, config.secrets());
        LOGGER.info("Language model initialized.");
        return new ChatModelTranslator(chatModel, modelExecutor, config.targetLanguage(),
                translatorConfig.provider().name(), translatorConfig.modelName());
    }

    private static ThreadFactory modelThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "translator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

package com.designcontext.simplifier.cli;

import com.designcontext.simplifier.cli.exception.OptionsValidationException;
import com.designcontext.simplifier.cli.model.SimplifyOptions;
import com.designcontext.simplifier.cli.model.ValidatedSimplifyOptions;
import com.designcontext.simplifier.cli.output.SimplifyResultsPrinter;
import com.designcontext.simplifier.cli.validation.SimplifyOptionsValidator;
import com.designcontext.simplifier.pipeline.PipelineConfig;
import com.designcontext.simplifier.pipeline.PipelineResult;
import com.designcontext.simplifier.pipeline.SimplificationPipeline;
import com.designcontext.simplifier.resolver.ResolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command that simplifies a fetched design document into model context.
 */
@Command(
        name = "simplify",
        mixinStandardHelpOptions = true,
        version = "design-context-simplifier 1.0.0",
        description = "Simplifies a design document into a compact JSON form with shared style values, "
                + "semantic variable names and component variant rules."
)
public class SimplifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SimplifyCommand.class);

    @Mixin
    private SimplifyOptions options = new SimplifyOptions();

    private final SimplifyOptionsValidator validator = new SimplifyOptionsValidator();
    private final SimplifyResultsPrinter printer = new SimplifyResultsPrinter();
    private final PrintStream out;

    public SimplifyCommand() {
        this(new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    public SimplifyCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        try {
            ValidatedSimplifyOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            ResolverConfig resolverConfig = ResolverConfig.builder()
                    .searchDirectories(validated.getMappingSearchDirectories())
                    .remoteUrl(options.getMappingUrl())
                    .tokenFile(options.getTokens())
                    .build();

            PipelineConfig config = PipelineConfig.builder()
                    .designFile(validated.getInput())
                    .variablesFile(options.getVariables())
                    .fileKey(options.getFileKey())
                    .outputFile(validated.getOutputFile())
                    .maxDepth(options.getMaxDepth())
                    .extractorPreset(options.getExtractors())
                    .resolverConfig(resolverConfig)
                    .heuristicsFile(options.getHeuristics())
                    .skipResolution(options.isSkipResolution())
                    .prettyPrint(options.isPretty())
                    .exportMappingsFile(options.getExportMappings())
                    .build();

            SimplificationPipeline pipeline = new SimplificationPipeline(config);
            PipelineResult result = pipeline.run();

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            if (validated.getOutputFile() == null) {
                out.println(pipeline.toJson(result.getDesign()));
            }
            printer.printSuccess(options, result);
            return 0;

        } catch (OptionsValidationException e) {
            log.error("Invalid options ({}):", e.getErrorCount());
            e.getErrors().forEach(error -> log.error("  {}", error));
            return 1;
        } catch (Exception e) {
            log.error("Simplification failed with exception", e);
            return 1;
        }
    }
}

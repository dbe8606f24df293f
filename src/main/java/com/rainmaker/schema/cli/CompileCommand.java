package com.rainmaker.schema.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.cli.exception.OptionsValidationException;
import com.rainmaker.schema.cli.model.CompileOptions;
import com.rainmaker.schema.cli.model.ValidatedCompileOptions;
import com.rainmaker.schema.cli.output.CompileResultsPrinter;
import com.rainmaker.schema.cli.validation.CompileOptionsValidator;
import com.rainmaker.schema.codegen.SchemaCompiler;
import com.rainmaker.schema.codegen.exception.SchemaCompilerException;
import com.rainmaker.schema.codegen.model.CompilationResult;
import com.rainmaker.schema.codegen.project.PrismaDocumentRenderer;
import com.rainmaker.schema.codegen.util.FileWriteUtil;
import com.rainmaker.schema.model.SchemaSet;
import com.rainmaker.schema.parser.SchemaDefinitionException;
import com.rainmaker.schema.parser.SchemaDefinitionReader;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that compiles a schema definition file into a relational model
 * document.
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        version = "schema-model-compiler 1.0.0",
        description = "Compiles JSON-safe schema definitions into a relational model schema."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final String LOGGER_ROOT = "com.rainmaker.schema";

    @Mixin
    private CompileOptions options = new CompileOptions();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();
    private final PrintStream out;

    public CompileCommand() {
        this(System.out);
    }

    public CompileCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }
        applyLogLevel(validated.getCompilerOptions().getLogLevel());
        printer.printBanner(validated);

        try {
            SchemaSet schemaSet = new SchemaDefinitionReader().read(validated.getSchemaPath());
            CompilationResult result = new SchemaCompiler().compileModels(schemaSet, validated.getCompilerOptions());
            String document = new PrismaDocumentRenderer().render(result.getDocument(), validated.getHeader());

            if (validated.getOutputPath() != null) {
                FileWriteUtil.safeWriteString(validated.getOutputPath(), document);
            } else {
                out.print(document);
                out.flush();
            }
            printer.printSuccess(validated, result);
            return 0;

        } catch (SchemaCompilerException e) {
            log.error("Compilation failed: {}", e.describe());
            return 1;
        } catch (SchemaDefinitionException e) {
            log.error("Invalid schema definition: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            return 1;
        }
    }

    static void applyLogLevel(String level) {
        Logger logger = LoggerFactory.getLogger(LOGGER_ROOT);
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}

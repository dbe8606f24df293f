package com.rainmaker.schema.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.rainmaker.schema.cli.exception.OptionsValidationException;
import com.rainmaker.schema.cli.model.CompileOptions;
import com.rainmaker.schema.cli.model.ValidatedCompileOptions;
import com.rainmaker.schema.codegen.CompilerOptions;
import com.rainmaker.schema.codegen.project.DocumentHeader;

public class CompileOptionsValidator {

	static final Set<String> LOG_LEVELS = Set.of("error", "warn", "info", "debug");

	private static final Pattern ENV_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		Path schemaPath = null;
		if (o.getSchemaPath() == null) {
			errors.add("Schema definition file is required (--schema / -s).");
		} else if (!Files.isRegularFile(o.getSchemaPath())) {
			errors.add("Schema definition file does not exist or is not a file: " + o.getSchemaPath());
		} else {
			schemaPath = o.getSchemaPath().toAbsolutePath().normalize();
		}

		Path outputPath = null;
		if (o.getOutputPath() != null) {
			outputPath = o.getOutputPath().toAbsolutePath().normalize();
			if (Files.isDirectory(outputPath)) {
				errors.add("Output path is a directory: " + outputPath);
			} else if (Files.exists(outputPath) && !o.isForce()) {
				errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
			}
		}

		String logLevel = o.getLogLevel() == null ? "info" : o.getLogLevel().toLowerCase(Locale.ROOT);
		if (!LOG_LEVELS.contains(logLevel)) {
			errors.add("Log level must be one of error, warn, info, debug. Got: " + o.getLogLevel());
		}

		List<String> include = clean(o.getInclude());
		List<String> exclude = clean(o.getExclude());
		for (String name : include) {
			if (exclude.contains(name)) {
				errors.add("Model is both included and excluded: " + name);
			}
		}

		if (o.getDefaultSchema() != null && o.getDefaultSchema().isBlank()) {
			errors.add("Default schema must not be blank (--default-schema).");
		}

		DocumentHeader header = null;
		if (o.isHeader()) {
			if (isBlank(o.getProvider())) {
				errors.add("Datasource provider must not be blank (--provider).");
			}
			if (o.getDatabaseUrlEnv() == null || !ENV_NAME.matcher(o.getDatabaseUrlEnv()).matches()) {
				errors.add("Database URL variable must be a valid environment variable name. Got: "
						+ o.getDatabaseUrlEnv());
			}
			header = DocumentHeader.builder()
					.provider(o.getProvider())
					.databaseUrlEnv(o.getDatabaseUrlEnv())
					.build();
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		CompilerOptions compilerOptions = CompilerOptions.builder()
				.logLevel(logLevel)
				.schemaPath(schemaPath)
				.outputPath(outputPath)
				.includedModels(include)
				.excludedModels(exclude)
				.validateSchema(o.isValidateSchema())
				.validateRelations(o.isValidateRelations())
				.defaultSchema(o.getDefaultSchema())
				.build();

		return new ValidatedCompileOptions(schemaPath, outputPath, compilerOptions, header);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<String> clean(List<String> names) {
		if (names == null) {
			return List.of();
		}
		return names.stream().map(String::trim).filter(s -> !s.isEmpty()).distinct().toList();
	}
}

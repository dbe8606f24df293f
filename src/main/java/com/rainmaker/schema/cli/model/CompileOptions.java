package com.rainmaker.schema.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "compile" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class CompileOptions {

	@Option(names = { "--schema", "-s" }, description = "JSON schema definition file to compile")
	private Path schemaPath;

	@Option(names = { "--output",
			"-o" }, description = "File to write the generated schema to (defaults to standard output)")
	private Path outputPath;

	@Option(names = { "--include" }, split = ",", description = "Only compile these top-level models (comma-separated)")
	private List<String> include = new ArrayList<>();

	@Option(names = { "--exclude" }, split = ",", description = "Leave these top-level models out (comma-separated)")
	private List<String> exclude = new ArrayList<>();

	@Option(names = {
			"--validate-schema" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Check field names and schema shape before compiling (default: true)")
	private boolean validateSchema;

	@Option(names = {
			"--validate-relations" }, negatable = true, defaultValue = "true", fallbackValue = "true", description = "Check that relation targets exist (default: true)")
	private boolean validateRelations;

	@Option(names = {
			"--default-schema" }, description = "Database schema that needs no @@schema directive")
	private String defaultSchema;

	@Option(names = {
			"--log-level" }, defaultValue = "info", description = "One of error, warn, info, debug (default: info)")
	private String logLevel;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--header" }, description = "Prepend datasource and generator blocks")
	private boolean header;

	@Option(names = {
			"--provider" }, defaultValue = "postgresql", description = "Datasource provider used with --header (default: postgresql)")
	private String provider;

	@Option(names = {
			"--database-url-env" }, defaultValue = "DATABASE_URL", description = "Environment variable holding the connection string (default: DATABASE_URL)")
	private String databaseUrlEnv;

}

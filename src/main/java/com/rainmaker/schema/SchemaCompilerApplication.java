package com.rainmaker.schema;

import com.rainmaker.schema.cli.CompileCommand;

import picocli.CommandLine;

/**
 * Main entry point for the schema model compiler. Reads JSON schema
 * definitions and writes the relational model schema they describe.
 */
public class SchemaCompilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CompileCommand()).execute(args);
        System.exit(exitCode);
    }
}

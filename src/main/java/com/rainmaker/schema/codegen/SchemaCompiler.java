package com.rainmaker.schema.codegen;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.codegen.discovery.DiscoveryResult;
import com.rainmaker.schema.codegen.discovery.ModelDiscoveryService;
import com.rainmaker.schema.codegen.emitter.PrismaModelEmitter;
import com.rainmaker.schema.codegen.exception.SchemaValidationException;
import com.rainmaker.schema.codegen.model.CompilationResult;
import com.rainmaker.schema.codegen.model.EnumDefinition;
import com.rainmaker.schema.codegen.model.ModelDefinition;
import com.rainmaker.schema.model.ObjectNode;
import com.rainmaker.schema.model.SchemaNode;
import com.rainmaker.schema.model.SchemaNodes;
import com.rainmaker.schema.model.SchemaSet;
import com.rainmaker.schema.validation.SchemaValidator;

/**
 * Compiles a set of named schemas into relational model DSL text.
 *
 * Pipeline: filter, validate, discover, map and emit. Any failure aborts the
 * whole compilation; no partial document is ever returned. The compiler keeps
 * no state between calls.
 */
public class SchemaCompiler {

    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    private final SchemaValidator validator;
    private final ModelDiscoveryService discoveryService;
    private final PrismaModelEmitter emitter;

    public SchemaCompiler() {
        this(new SchemaValidator(), new ModelDiscoveryService(), new PrismaModelEmitter());
    }

    public SchemaCompiler(SchemaValidator validator, ModelDiscoveryService discoveryService, PrismaModelEmitter emitter) {
        this.validator = validator;
        this.discoveryService = discoveryService;
        this.emitter = emitter;
    }

    public String compile(Map<String, ? extends SchemaNode> schemas) {
        return compile(SchemaSet.of(schemas), CompilerOptions.defaults());
    }

    public String compile(SchemaSet schemaSet, CompilerOptions options) {
        return compileModels(schemaSet, options).getDocument();
    }

    /**
     * Compiles and returns the structured blocks together with the rendered text.
     */
    public CompilationResult compileModels(SchemaSet schemaSet, CompilerOptions options) {
        log.info("Compiling {} schema(s)...", schemaSet.getSchemas().size());

        log.debug("Step 1: Selecting models");
        Map<String, SchemaNode> selected = select(schemaSet.getSchemas(), options);

        if (options.isValidateSchema()) {
            log.debug("Step 2: Validating top-level schemas");
            selected.forEach((name, schema) -> validator.validateSchema(SchemaNodes.unwrap(schema), name));
        }

        log.debug("Step 3: Discovering nested models, enums and relations");
        DiscoveryResult discovery = discoveryService.discover(selected, schemaSet.getMetadata());

        if (options.isValidateSchema()) {
            discovery.getModels().forEach((name, object) -> {
                if (!selected.containsKey(name)) {
                    validator.validateSchema(object, name);
                }
            });
        }
        if (options.isValidateRelations()) {
            log.debug("Step 4: Validating relations");
            for (Map.Entry<String, ObjectNode> entry : discovery.getModels().entrySet()) {
                validator.validateRelations(entry.getValue(), discovery.getModels(), schemaSet.getMetadata(),
                        entry.getKey());
            }
        }

        log.debug("Step 5: Emitting models");
        List<ModelDefinition> models = emitter.buildModels(discovery, schemaSet.getMetadata(), options.getDefaultSchema());
        List<EnumDefinition> enums = List.copyOf(discovery.getEnums().values());
        String document = emitter.render(enums, models);

        log.info("Compiled {} model(s) ({} nested), {} enum(s), {} relation(s)",
                models.size(), models.size() - discovery.getTopLevelModelCount(), enums.size(),
                discovery.getRelations().size());

        return CompilationResult.builder()
                .enums(enums)
                .models(models)
                .relations(discovery.getRelations())
                .document(document)
                .topLevelModelCount(discovery.getTopLevelModelCount())
                .build();
    }

    /**
     * Applies the include and exclude lists, keeping caller order. Names in
     * the include list must exist.
     */
    private Map<String, SchemaNode> select(Map<String, SchemaNode> schemas, CompilerOptions options) {
        List<String> include = options.getIncludedModels() != null ? options.getIncludedModels() : List.of();
        List<String> exclude = options.getExcludedModels() != null ? options.getExcludedModels() : List.of();

        for (String name : include) {
            if (!schemas.containsKey(name)) {
                throw new SchemaValidationException("Included model '" + name + "' is not defined", null, name);
            }
        }
        for (String name : exclude) {
            if (!schemas.containsKey(name)) {
                log.warn("Excluded model '{}' is not defined; ignoring", name);
            }
        }

        Map<String, SchemaNode> selected = new LinkedHashMap<>();
        schemas.forEach((name, schema) -> {
            if ((include.isEmpty() || include.contains(name)) && !exclude.contains(name)) {
                selected.put(name, schema);
            }
        });
        if (selected.size() != schemas.size()) {
            log.info("Selected {} of {} model(s)", selected.size(), schemas.size());
        }
        return selected;
    }
}

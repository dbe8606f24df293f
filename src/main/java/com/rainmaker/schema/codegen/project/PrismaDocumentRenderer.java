package com.rainmaker.schema.codegen.project;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rainmaker.schema.codegen.exception.SchemaGenerationException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the final schema document from {@code templates/schema.prisma.ftl}:
 * an optional header followed by the compiled model and enum blocks.
 */
public class PrismaDocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(PrismaDocumentRenderer.class);

    static final String TEMPLATE = "schema.prisma.ftl";

    private final Configuration freemarkerConfig;

    public PrismaDocumentRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @param body   compiled model and enum blocks
     * @param header header blocks, or null to render the body alone
     */
    public String render(String body, DocumentHeader header) {
        Map<String, Object> model = new HashMap<>();
        model.put("header", header != null);
        if (header != null) {
            model.put("provider", header.getProvider());
            model.put("databaseUrlEnv", header.getDatabaseUrlEnv());
            model.put("clientGenerator", header.getClientGenerator());
        }
        model.put("body", body);

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            log.debug("Rendered schema document ({} chars)", out.getBuffer().length());
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new SchemaGenerationException("Failed to render schema document: " + e.getMessage(), null, null, e);
        }
    }
}

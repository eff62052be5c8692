package com.rivet.core.template;

import com.rivet.core.exception.RivetException;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders FreeMarker templates from the classpath ({@code /templates}) or from strings.
 *
 * <p>Missing variables fail the render instead of producing partial output.
 */
public class TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

    private final Configuration freemarkerConfig;

    public TemplateRenderer() {
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
     * Renders a classpath template.
     *
     * @param templatePath path below {@code /templates}
     * @param model data model
     * @return rendered text
     * @throws RivetException if the template is missing or fails to render
     */
    public String render(String templatePath, Map<String, Object> model) {
        log.debug("Rendering template {}", templatePath);
        try {
            Template template = freemarkerConfig.getTemplate(templatePath);
            return process(template, model);
        } catch (TemplateNotFoundException e) {
            throw new RivetException("Template not found: " + templatePath, e);
        } catch (IOException e) {
            throw new RivetException("Failed to load template " + templatePath, e);
        }
    }

    /**
     * Renders template source that did not come from the classpath.
     *
     * @param name name used in error messages
     * @param source template text
     * @param model data model
     * @return rendered text
     * @throws RivetException if the template fails to parse or render
     */
    public String renderString(String name, String source, Map<String, Object> model) {
        log.debug("Rendering inline template {}", name);
        try {
            Template template = new Template(name, new StringReader(source), freemarkerConfig);
            return process(template, model);
        } catch (IOException e) {
            throw new RivetException("Failed to parse template " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns whether a classpath template exists.
     *
     * @param templatePath path below {@code /templates}
     * @return true if it can be loaded
     */
    public boolean exists(String templatePath) {
        return getClass().getResource("/templates/" + templatePath) != null;
    }

    private String process(Template template, Map<String, Object> model) {
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException | IOException e) {
            throw new RivetException("Failed to render template " + template.getName() + ": " + e.getMessage(), e);
        }
        return out.toString();
    }
}

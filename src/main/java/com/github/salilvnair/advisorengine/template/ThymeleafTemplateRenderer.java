package com.github.salilvnair.advisorengine.template;

import org.springframework.stereotype.Component;
import org.thymeleaf.context.Context;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders plain-text prompt templates with Thymeleaf TEXT mode. Besides the
 * native {@code [(${name})]} syntax, {@code {{name}}} placeholders are
 * accepted and rendered unescaped.
 */
@Component
public class ThymeleafTemplateRenderer {

    private static final Pattern LEGACY_VAR_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final SpringTemplateEngine templateEngine;

    public ThymeleafTemplateRenderer() {
        StringTemplateResolver resolver = new StringTemplateResolver();
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCacheable(false);

        SpringTemplateEngine engine = new SpringTemplateEngine();
        engine.setTemplateResolver(resolver);
        engine.setEnableSpringELCompiler(true);
        this.templateEngine = engine;
    }

    public String render(String template, Map<String, Object> variables) {
        String raw = template == null ? "" : template;
        if (raw.isBlank()) {
            return raw;
        }
        Context context = new Context();
        if (variables != null) {
            context.setVariables(variables);
        }
        String rendered = templateEngine.process(normalizeTemplate(raw), context);
        return rendered == null ? "" : rendered;
    }

    private String normalizeTemplate(String template) {
        Matcher matcher = LEGACY_VAR_PATTERN.matcher(template);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String replacement = "[(${" + matcher.group(1).trim() + "})]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}

package com.rivet.core.deploy;

import com.rivet.core.exception.RivetException;
import com.rivet.core.template.TemplateRenderer;
import com.rivet.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a starter {@code deploy/<target>.yaml}.
 */
public class DeploymentTemplates {

    private final TemplateRenderer renderer;

    public DeploymentTemplates(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Creates the file unless it exists.
     *
     * @param projectRoot project root
     * @param target target name
     * @param appName application name used for defaults
     * @return true if written, false if it already existed
     */
    public boolean create(Path projectRoot, String target, String appName) {
        Path file = DeploymentConfig.fileFor(projectRoot, target);
        if (Files.exists(file)) {
            return false;
        }
        String content = renderer.render("deploy/target.yaml.ftl", Map.of("target", target, "app", appName));
        try {
            FileUtils.writeAtomically(file, content);
        } catch (IOException e) {
            throw new RivetException("Failed to write " + file, e);
        }
        return true;
    }
}

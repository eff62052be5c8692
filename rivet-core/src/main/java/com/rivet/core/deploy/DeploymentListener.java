package com.rivet.core.deploy;

/**
 * Receives progress from a deployment.
 */
public interface DeploymentListener {

    void step(String message);

    void warning(String message);
}

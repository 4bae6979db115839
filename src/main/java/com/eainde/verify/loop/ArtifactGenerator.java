package com.eainde.verify.loop;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.RemediationPlan;

/**
 * Produces the next artifact version from the previous one and the remediation plan.
 * The loop treats any exception thrown here as a generation failure.
 */
public interface ArtifactGenerator {

    /**
     * @throws com.eainde.verify.error.GenerationFailureException if no new version can be produced
     */
    Artifact regenerate(Artifact previous, RemediationPlan plan);
}

package org.docmigrations.pipeline.steps;

import java.util.List;

/**
 * Service interface for contributing migration steps. Implementations are discovered through
 * {@link java.util.ServiceLoader}, so they need a public no-arg constructor and an entry in
 * {@code META-INF/services/org.docmigrations.pipeline.steps.MigrationStepProvider}.
 */
public interface MigrationStepProvider {
    List<MigrationStep> steps();
}

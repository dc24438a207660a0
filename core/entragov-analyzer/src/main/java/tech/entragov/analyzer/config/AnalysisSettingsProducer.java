package tech.entragov.analyzer.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Produces the {@link AnalysisSettings} the analyzers are injected with.
 */
@ApplicationScoped
public class AnalysisSettingsProducer {

    private static final Logger LOG = Logger.getLogger(AnalysisSettingsProducer.class);

    @Inject
    AnalysisConfig config;

    // Singleton: a record cannot be proxied
    @Produces
    @Singleton
    public AnalysisSettings produceSettings() {
        AnalysisSettings settings = AnalysisSettings.from(config);
        LOG.infof("Analysis settings: %d privileged roles, excessive role threshold %d, dormancy lookback %s",
            settings.privilegedRoles().size(), settings.excessiveRoleThreshold(), settings.dormancyLookback());
        return settings;
    }
}

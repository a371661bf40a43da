package io.periodic4j.config;

import io.periodic4j.core.DetachPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for schedule persistence.
 */
@ConfigurationProperties(prefix = "periodic")
public class PeriodicProperties {
    private boolean enabled = true;
    private DetachPolicy detachPolicy = DetachPolicy.OWNER;
    private boolean transactional = true; // needs a MongoTransactionManager bean
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public DetachPolicy getDetachPolicy() {
        return detachPolicy;
    }

    public void setDetachPolicy(DetachPolicy detachPolicy) {
        this.detachPolicy = detachPolicy;
    }

    public boolean isTransactional() {
        return transactional;
    }

    public void setTransactional(boolean transactional) {
        this.transactional = transactional;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}

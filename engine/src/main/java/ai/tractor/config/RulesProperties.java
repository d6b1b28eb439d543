package ai.tractor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Table options bound from {@code rules.*}.
 * <p>
 * Usage: {@code -Drules.trace-rejections=true} to log every rejected play with its reason.
 * <p>
 * The field initialisers are the defaults. A plain Spring context never reads
 * {@code application.properties}, so it relies on them.
 */
@Component
@ConfigurationProperties(prefix = "rules")
public class RulesProperties {
    /** Log the reason for every rejected play at INFO. */
    private boolean traceRejections = false;
    /**
     * Whether the round-starting player may count the kitty as seen when leading.
     * <p>
     * The standard rules give the round starter this knowledge. Turning it off departs from
     * them: the starter then judges multi-combo leads as if the kitty were unseen.
     */
    private boolean kittyVisibleToRoundStarter = true;

    public boolean isTraceRejections() {
        return traceRejections;
    }

    public void setTraceRejections(boolean traceRejections) {
        this.traceRejections = traceRejections;
    }

    public boolean isKittyVisibleToRoundStarter() {
        return kittyVisibleToRoundStarter;
    }

    public void setKittyVisibleToRoundStarter(boolean kittyVisibleToRoundStarter) {
        this.kittyVisibleToRoundStarter = kittyVisibleToRoundStarter;
    }
}

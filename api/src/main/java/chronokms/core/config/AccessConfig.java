package chronokms.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for access request handling and the local key-holder.
 *
 * <p>Configuration prefix: {@code kms.access}
 */
@ConfigMapping(prefix = "kms.access")
public interface AccessConfig {

    /**
     * Actor name of the key-holder in audit events.
     *
     * @return key-holder id (default: kms-main)
     */
    @WithDefault("kms-main")
    String keyHolderId();

    /**
     * Maximum wait for a key-holder decision.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration keyHolderTimeout();

    /**
     * Largest number of keys the local key-holder derives for one request.
     *
     * @return key limit (default: 86400, one day at one-second steps)
     */
    @WithDefault("86400")
    int maxKeysPerRequest();

    /**
     * Time step of the local key-holder.
     *
     * @return granularity (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration granularity();
}

/*
 * Where: Notification infrastructure configuration
 * What: Puts the NATS connection under Spring management
 * Why: Both event subscribers share one connection
 */
package com.monsoonfire.notification.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties)
            throws IOException, InterruptedException {
        Options options = new Options.Builder()
                .server(properties.url())
                .connectionName("notification")
                .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
                .build();
        return Nats.connect(options);
    }
}

package org.subtrack.subscription;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@ConfigurationProperties(prefix = "subtrack.subscriptions")
@Data
public class SubscriptionProperties {

	/** Maximum time given to a single store operation. */
	private Duration storeTimeout = Duration.ofSeconds(5);
	
}

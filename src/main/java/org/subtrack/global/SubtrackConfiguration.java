package org.subtrack.global;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.session.WebSessionManager;
import org.subtrack.subscription.SubscriptionProperties;

import reactor.core.publisher.Mono;

@Configuration
@EnableConfigurationProperties({SubscriptionProperties.class})
public class SubtrackConfiguration {

	@Bean
	WebSessionManager webSessionManager() {
		return exchange -> Mono.empty();
	}
	
	/** Millisecond ticks: the store keeps microseconds at most. */
	@Bean
	Clock clock() {
		return Clock.tickMillis(ZoneId.systemDefault());
	}
	
}

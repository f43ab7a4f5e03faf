package org.subtrack.global.rest;

import java.util.UUID;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

/**
 * Per-request correlation id carried in the Reactor context.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RequestIds {

	public static final String HEADER = "X-Request-Id";
	public static final String CONTEXT_KEY = "subtrack.requestId";
	
	private static final String NONE = "-";
	private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._-]{1,128}");
	
	public static String generate() {
		return UUID.randomUUID().toString();
	}
	
	/** Returns the received id when it is short and plain enough to be logged, a new one otherwise. */
	public static String acceptOrGenerate(String received) {
		if (received != null && ACCEPTED.matcher(received).matches()) return received;
		return generate();
	}
	
	public static Context with(String requestId) {
		return Context.of(CONTEXT_KEY, requestId);
	}
	
	public static String from(ContextView context) {
		return context.getOrDefault(CONTEXT_KEY, NONE);
	}
	
}

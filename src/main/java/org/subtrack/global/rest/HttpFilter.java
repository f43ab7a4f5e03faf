package org.subtrack.global.rest;

import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.mutable.MutableObject;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class HttpFilter implements WebFilter {

	@Override
	public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
		long start = System.currentTimeMillis();
		String requestId = RequestIds.acceptOrGenerate(exchange.getRequest().getHeaders().getFirst(RequestIds.HEADER));
		exchange.getResponse().getHeaders().set(RequestIds.HEADER, requestId);
		MutableObject<Disposable> schedule = new MutableObject<>(null);
		exchange.getResponse().beforeCommit(() -> Mono.fromRunnable(() -> {
			Disposable d = schedule.getValue();
			if (d != null && !d.isDisposed()) d.dispose();
			long time = System.currentTimeMillis() - start;
			HttpStatusCode status = exchange.getResponse().getStatusCode();
			log.debug("[{}] {} {} {} {} ms", requestId, exchange.getRequest().getMethod(), exchange.getRequest().getPath(), status != null ? status.value() : 200, time);
			if (time > 2000) log.info("[{}] Request took {} ms: {} {}", requestId, time, exchange.getRequest().getMethod(), exchange.getRequest().getPath());
		}));
		schedule.setValue(Schedulers.boundedElastic().schedule(() -> {
			schedule.setValue(null);
			log.warn("[{}] Request not comitted after 10 seconds: {} {}", requestId, exchange.getRequest().getMethod(), exchange.getRequest().getPath());
		}, 10, TimeUnit.SECONDS));
		return chain.filter(exchange).contextWrite(RequestIds.with(requestId));
	}
	
}

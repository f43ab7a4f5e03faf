package org.subtrack.global.rest;

import org.springframework.core.MethodParameter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import org.subtrack.global.exceptions.StorageException;
import org.subtrack.global.exceptions.SubtrackException;
import org.subtrack.global.exceptions.ValidationUtils;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@Slf4j
public class RestExceptions {

	@ExceptionHandler(StorageException.class)
	public Mono<ResponseEntity<ApiError>> handleStorageError(StorageException error, ServerWebExchange exchange) {
		log.error("Storage error returned by {} {}: operation {} failed", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getOperation());
		return Mono.fromSupplier(() -> ResponseEntity.status(error.getStatus()).body(error.toApiError()));
	}
	
	@ExceptionHandler(SubtrackException.class)
	public Mono<ResponseEntity<ApiError>> handleSubtrackError(SubtrackException error, ServerWebExchange exchange) {
		log.warn("Subtrack error returned by {} {}: {} - {} - {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getErrorCode(), error.getMessage());
		return Mono.fromSupplier(() -> ResponseEntity.status(error.getStatus()).body(error.toApiError()));
	}
	
	@ExceptionHandler(ServerWebInputException.class)
	public Mono<ResponseEntity<ApiError>> handleInputError(ServerWebInputException error, ServerWebExchange exchange) {
		ApiError result;
		String parameterName = getParameterName(error.getMethodParameter());
		if (parameterName != null) {
			result = new ApiError(400, ValidationUtils.INVALID_PREFIX + parameterName, error.getReason());
		} else {
			result = new ApiError(400, "invalid-input", "Invalid request");
		}
		log.warn("Framework input error returned by {} {}: 400 - {} - {} => {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getMethodParameter(), error.getMessage(), result);
		return Mono.fromSupplier(() -> ResponseEntity.status(400).body(result));
	}
	
	private String getParameterName(MethodParameter p) {
		if (p == null) return null;
		RequestParam rp = p.getParameterAnnotation(RequestParam.class);
		if (rp != null && !rp.name().isBlank()) return rp.name();
		PathVariable pv = p.getParameterAnnotation(PathVariable.class);
		if (pv != null && !pv.name().isBlank()) return pv.name();
		return p.getParameterName();
	}
	
	@ExceptionHandler(ErrorResponseException.class)
	public Mono<ResponseEntity<ApiError>> handleFrameworkError(ErrorResponseException error, ServerWebExchange exchange) {
		int status = error.getStatusCode().value();
		var body = error.getBody();
		var result = new ApiError(status, body.getTitle(), body.getDetail());
		log.warn("Framework error returned by {} {}: {} - {} - {} => {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), status, error.getMessage(), result);
		return Mono.fromSupplier(() -> ResponseEntity.status(status).body(result));
	}
	
	@ExceptionHandler(Exception.class)
	public Mono<ResponseEntity<ApiError>> handleOtherError(Exception error, ServerWebExchange exchange) {
		log.warn("Generic error returned by {} {}: {} - {}", exchange.getRequest().getMethod(), exchange.getRequest().getURI(), error.getClass().getSimpleName(), error.getMessage(), error);
		return Mono.fromSupplier(() -> ResponseEntity.status(500).body(new ApiError(500, "internal-error", "Internal server error")));
	}
	
}

package com.z254.butterfly.concierge.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Access log for every HTTP request: method, path, status and latency.
 * <p>
 * The latency up to the moment the response is committed is also returned in the
 * {@value #PROCESS_TIME_HEADER} header, in milliseconds with one decimal.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter implements WebFilter {

    public static final String PROCESS_TIME_HEADER = "X-Process-Time-Ms";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long start = System.nanoTime();
        exchange.getResponse().beforeCommit(() -> {
            exchange.getResponse().getHeaders().set(PROCESS_TIME_HEADER, formatMillis(start));
            return Mono.empty();
        });

        return chain.filter(exchange)
                .doFinally(signal -> {
                    ServerHttpRequest request = exchange.getRequest();
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    log.info("{} {} -> {} ({} ms)",
                            request.getMethod(),
                            request.getPath().value(),
                            status != null ? status.value() : 200,
                            formatMillis(start));
                });
    }

    static String formatMillis(long startNanos) {
        return String.format(Locale.ROOT, "%.1f", (System.nanoTime() - startNanos) / 1_000_000.0);
    }
}

/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.speechstream.config.logging.MdcFilter} injects {@code requestId},
 * {@code userId}, {@code sessionId}, {@code method} and {@code uri} into Log4j2's
 * {@code ThreadContext} for every HTTP request.
 *
 * <p>Log Format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] [sessionId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.config.logging;

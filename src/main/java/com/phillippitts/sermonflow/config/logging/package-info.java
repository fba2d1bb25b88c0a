/**
 * Logging infrastructure: ThreadContext (MDC) population for HTTP requests.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by {@link com.phillippitts.sermonflow.config.logging.MdcFilter}</li>
 *   <li>{@code sermonId} - set around a processing cycle and around each processing job</li>
 * </ul>
 *
 * <p>Both keys are printed by the console pattern in {@code log4j2-spring.xml}.
 */
package com.phillippitts.sermonflow.config.logging;

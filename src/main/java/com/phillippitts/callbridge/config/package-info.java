/**
 * Spring configuration: typed properties, thread pools, outbound clients and logging.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code properties} - {@code @ConfigurationProperties} classes bound from
 *       {@code callbridge.*} and {@code threadpool.*}</li>
 *   <li>{@code logging} - request MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.callbridge.config;

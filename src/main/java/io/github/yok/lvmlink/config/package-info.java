/**
 * Configuration package for LvmLink.
 *
 * <p>
 * Contains Spring Boot {@code @ConfigurationProperties} classes bound from
 * {@code application.yml}: the export directory and the cache behavior of the reader.
 * </p>
 */
package io.github.yok.lvmlink.config;

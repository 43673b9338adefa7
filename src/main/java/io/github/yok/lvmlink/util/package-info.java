/**
 * Utility package for LvmLink.
 *
 * <p>
 * Provides fatal-error reporting for the command line and path rendering for log messages.
 * </p>
 */
package io.github.yok.lvmlink.util;

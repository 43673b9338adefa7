package io.github.yok.lvmlink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings that control how LVM files are read, bound from {@code lvm.read.*}.
 *
 * <p>
 * Typical usage in {@code application.yml}:
 * </p>
 *
 * <pre>
 * lvm:
 *   read:
 *     read-from-cache: true
 *     dump-cache: true
 *     cache-suffix: ".cache.json"
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "lvm.read")
@Data
public class LvmReadConfig {

    // Reuse a fresh cache file instead of parsing the source
    private boolean readFromCache = true;

    // Write the cache file after parsing the source
    private boolean dumpCache = true;

    // Appended to the source file name to form the cache file name
    private String cacheSuffix = ".cache.json";
}

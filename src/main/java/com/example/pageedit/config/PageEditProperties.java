package com.example.pageedit.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Strongly typed configuration for page editing.
 */
@Component
@ConfigurationProperties(prefix = "pageedit")
public class PageEditProperties {

    /**
     * Directory holding version payloads ({@code docs/}) and page artifacts ({@code sidecars/}).
     */
    private Path storageRoot = Path.of("media");

    /**
     * How long a request waits for the exclusive lease on a document.
     */
    private Duration lockTimeout = Duration.ofSeconds(10);

    /**
     * Language assigned to uploads that do not declare one.
     */
    private String defaultLanguage = "deu";

    @PostConstruct
    void validate() {
        Assert.notNull(storageRoot, "pageedit.storage-root must be set");
        Assert.isTrue(lockTimeout != null && !lockTimeout.isNegative() && !lockTimeout.isZero(),
                "pageedit.lock-timeout must be positive");
        Assert.hasText(defaultLanguage, "pageedit.default-language must not be blank");
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    public void setStorageRoot(Path storageRoot) {
        this.storageRoot = storageRoot;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }
}

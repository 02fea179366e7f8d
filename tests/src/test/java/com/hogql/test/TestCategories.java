package com.hogql.test;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tag annotations used to select test groups, e.g. {@code -Dgroups=registry}.
 */
public final class TestCategories {

    private TestCategories() {
        // Utility class - prevent instantiation
    }

    /** Fast tests with no shared state */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("unit")
    public @interface Unit {
    }

    /** Tests that exercise the whole function table */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("registry")
    public @interface Registry {
    }

    /** Tests covering the settings enforcer */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("settings")
    public @interface Settings {
    }

    /** Tests that compile whole expressions or queries */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("integration")
    public @interface Integration {
    }

    /** Tests of the injection boundary */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("security")
    public @interface Security {
    }
}

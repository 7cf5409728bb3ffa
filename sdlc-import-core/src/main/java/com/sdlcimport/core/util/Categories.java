package com.sdlcimport.core.util;

import java.util.List;

/**
 * Constants for decision category identifiers.
 * <p>
 * Signatures, narrative catalog entries and decision records all refer to these
 * identifiers. Custom signature files may introduce further categories.
 * </p>
 */
public final class Categories {
    /** Programming language of the codebase. */
    public static final String LANGUAGE = "language";

    /** Application or web framework. */
    public static final String FRAMEWORK = "framework";

    /** API style (REST, GraphQL, gRPC). */
    public static final String API = "api";

    /** Primary database engine. */
    public static final String DATABASE = "database";

    /** ORM or data-access library. */
    public static final String DATA_ACCESS = "data-access";

    /** Caching layer. */
    public static final String CACHING = "caching";

    /** Messaging or event streaming. */
    public static final String MESSAGING = "messaging";

    /** Authentication and authorization. */
    public static final String AUTH = "auth";

    /** Automated test framework. */
    public static final String TESTING = "testing";

    /** Build tool. */
    public static final String BUILD = "build";

    /** Deployment and infrastructure-as-code. */
    public static final String INFRASTRUCTURE = "infrastructure";

    /** Continuous integration and delivery. */
    public static final String CI_CD = "ci-cd";

    /** Logging, metrics and tracing. */
    public static final String OBSERVABILITY = "observability";

    /** All built-in categories in rendering order. */
    public static final List<String> ALL = List.of(
        LANGUAGE, FRAMEWORK, API, DATABASE, DATA_ACCESS, CACHING, MESSAGING,
        AUTH, TESTING, BUILD, INFRASTRUCTURE, CI_CD, OBSERVABILITY
    );

    private Categories() {
        // Prevent instantiation
    }
}

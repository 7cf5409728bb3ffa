package com.sdlcimport.core.scanner;

import com.sdlcimport.core.util.FileUtils;
import com.sdlcimport.core.util.GlobMatcher;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classification of an inventory file.
 */
public enum FileKind {
    SOURCE,
    TEST,
    CONFIG,
    BUILD,
    INFRASTRUCTURE,
    DOCUMENTATION,
    BINARY,
    OTHER;

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
        "png", "jpg", "jpeg", "gif", "bmp", "ico", "svgz", "webp", "pdf", "zip", "gz", "tgz",
        "bz2", "xz", "7z", "rar", "jar", "war", "ear", "class", "exe", "dll", "so", "dylib",
        "o", "a", "lib", "bin", "woff", "woff2", "ttf", "otf", "eot", "mp3", "mp4", "mov",
        "avi", "wav", "pyc", "pyo", "db", "sqlite", "keystore", "jks", "p12"
    );

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
        "java", "kt", "kts", "scala", "groovy", "py", "js", "mjs", "cjs", "ts", "jsx", "tsx",
        "go", "rb", "cs", "fs", "vb", "php", "rs", "c", "cc", "cpp", "h", "hpp", "swift", "m",
        "sql", "sh", "bash", "ps1", "vue", "svelte", "dart", "ex", "exs", "erl", "clj", "lua",
        "pl", "r", "graphql", "gql", "proto", "html", "css", "scss"
    );

    private static final Set<String> CONFIG_EXTENSIONS = Set.of(
        "yml", "yaml", "json", "properties", "toml", "ini", "xml", "env", "conf", "cfg", "config"
    );

    private static final Set<String> DOCUMENTATION_EXTENSIONS = Set.of(
        "md", "markdown", "rst", "adoc", "txt"
    );

    private static final Set<String> BUILD_FILES = Set.of(
        "pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle", "settings.gradle.kts",
        "gradle.properties", "package.json", "makefile", "cmakelists.txt", "go.mod", "go.sum",
        "cargo.toml", "pyproject.toml", "setup.py", "setup.cfg", "pipfile", "gemfile",
        "composer.json", "build.sbt", "requirements.txt", "tsconfig.json", "build.xml"
    );

    private static final GlobMatcher BUILD_PATTERNS = GlobMatcher.of(List.of(
        "*.csproj", "*.fsproj", "*.vbproj", "*.sln", "requirements*.txt", "webpack.config.*",
        "vite.config.*"
    ));

    private static final GlobMatcher INFRASTRUCTURE_PATTERNS = GlobMatcher.of(List.of(
        "Dockerfile", "Dockerfile.*", "*.dockerfile", "docker-compose*.yml", "docker-compose*.yaml",
        "compose.yml", "compose.yaml", "*.tf", "*.tfvars", "*.bicep", "Chart.yaml", "Jenkinsfile",
        ".gitlab-ci.yml", "azure-pipelines.yml", "Procfile", "serverless.yml",
        "**/.github/workflows/**", "**/k8s/**", "**/kubernetes/**", "**/helm/**",
        "**/.circleci/**", "**/ansible/**", "**/terraform/**"
    ));

    private static final GlobMatcher TEST_PATTERNS = GlobMatcher.of(List.of(
        "**/src/test/**", "**/test/**", "**/tests/**", "**/__tests__/**", "**/spec/**",
        "*Test.java", "*Tests.java", "*IT.java", "*Test.kt", "*Tests.cs", "*_test.go",
        "test_*.py", "*_test.py", "*.spec.ts", "*.spec.js", "*.test.ts", "*.test.js",
        "*.test.tsx", "*.spec.tsx", "*_spec.rb"
    ));

    /**
     * Classifies a file by its relative path.
     *
     * <p>Order of precedence: binary, infrastructure, build, test, source, config,
     * documentation, other.
     *
     * @param relativePath path relative to the scanned root, {@code /}-separated
     * @return file kind
     */
    public static FileKind classify(String relativePath) {
        String extension = FileUtils.getExtension(relativePath);
        String fileName = FileUtils.getFileName(relativePath).toLowerCase(Locale.ROOT);

        if (BINARY_EXTENSIONS.contains(extension)) {
            return BINARY;
        }
        if (INFRASTRUCTURE_PATTERNS.matches(relativePath)) {
            return INFRASTRUCTURE;
        }
        if (BUILD_FILES.contains(fileName) || BUILD_PATTERNS.matches(relativePath)) {
            return BUILD;
        }
        if (SOURCE_EXTENSIONS.contains(extension)) {
            return TEST_PATTERNS.matches(relativePath) ? TEST : SOURCE;
        }
        if (CONFIG_EXTENSIONS.contains(extension)) {
            return CONFIG;
        }
        if (DOCUMENTATION_EXTENSIONS.contains(extension)) {
            return DOCUMENTATION;
        }
        return OTHER;
    }

    /**
     * Returns true if files of this kind carry program code.
     *
     * @return true for SOURCE and TEST
     */
    public boolean isCode() {
        return this == SOURCE || this == TEST;
    }
}

package org.carball.autolysis.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}

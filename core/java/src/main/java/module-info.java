module io.github.cyfko.drllens.core {
    requires java.logging;

    exports io.github.cyfko.drllens.core;
    exports io.github.cyfko.drllens.core.api;
    exports io.github.cyfko.drllens.core.config;
    exports io.github.cyfko.drllens.core.diagnostics;
    exports io.github.cyfko.drllens.core.exception;
    exports io.github.cyfko.drllens.core.model;
    exports io.github.cyfko.drllens.core.outline;
    exports io.github.cyfko.drllens.core.parsing;
    exports io.github.cyfko.drllens.core.spi;
    exports io.github.cyfko.drllens.core.utils;
}

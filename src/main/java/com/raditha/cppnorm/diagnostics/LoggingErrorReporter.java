package com.raditha.cppnorm.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards diagnostics to SLF4J, mapping severities onto log levels.
 */
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger logger = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(Diagnostic diagnostic) {
        switch (diagnostic.severity()) {
            case ERROR -> logger.error(diagnostic.toDisplayString());
            case WARNING -> logger.warn(diagnostic.toDisplayString());
            case INFORMATION -> logger.info(diagnostic.toDisplayString());
            case DEBUG -> logger.debug(diagnostic.toDisplayString());
        }
    }
}

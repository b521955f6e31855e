package org.chatvault.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level column of console output: ERROR red, WARN yellow, INFO cyan.
 * Other levels are left as they are.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        int level = event.getLevel().toInt();
        if (level == Level.ERROR_INT) {
            return ANSI_RED + in + ANSI_RESET;
        }
        if (level == Level.WARN_INT) {
            return ANSI_YELLOW + in + ANSI_RESET;
        }
        if (level == Level.INFO_INT) {
            return ANSI_CYAN + in + ANSI_RESET;
        }
        return in;
    }
}

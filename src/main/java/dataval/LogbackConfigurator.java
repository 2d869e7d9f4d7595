package dataval;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.layout.TTLLLayout;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ch.qos.logback.core.spi.ContextAwareBase;

/**
 * Console logging at INFO. Registered via META-INF/services so no logback.xml is needed.
 */
public class LogbackConfigurator extends ContextAwareBase implements Configurator {

    public LogbackConfigurator() {
    }

    @Override
    public ExecutionStatus configure(LoggerContext lc) {
        addInfo("Setting up dataval console configuration.");

        TTLLLayout layout = new TTLLLayout();
        layout.setContext(lc);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(lc);
        encoder.setLayout(layout);

        ThresholdFilter infoOnly = new ThresholdFilter();
        infoOnly.setLevel(Level.INFO.levelStr);
        infoOnly.setContext(lc);
        infoOnly.start();

        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(lc);
        consoleAppender.setName("console");
        consoleAppender.setEncoder(encoder);
        consoleAppender.addFilter(infoOnly);
        consoleAppender.start();

        Logger rootLogger = lc.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.INFO);
        rootLogger.addAppender(consoleAppender);

        // let the caller decide
        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }
}

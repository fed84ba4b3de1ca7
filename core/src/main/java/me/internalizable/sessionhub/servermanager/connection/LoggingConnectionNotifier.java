package me.internalizable.sessionhub.servermanager.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Notifier that writes user-facing messages to the log.
 */
public class LoggingConnectionNotifier implements ConnectionNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingConnectionNotifier.class);

    @Override
    public void info(@Nonnull String message) {
        LOGGER.info(message);
    }

    @Override
    public void error(@Nonnull String message) {
        LOGGER.error(message);
    }
}

package com.bazaarvoice.feedgate.common.dropwizard.log;

import com.bazaarvoice.feedgate.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Functions;
import com.google.common.base.Objects;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.dropwizard.lifecycle.ExecutorServiceManager;
import io.dropwizard.util.Duration;
import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Logs the first occurrence of a message immediately, then counts repeats and emits one summary line per interval
 * for as long as the message keeps recurring.  A message that stops recurring for three intervals is forgotten.
 */
public class DefaultRateLimitedLogFactory implements RateLimitedLogFactory {

    private enum Level { WARN, ERROR }

    private final ScheduledExecutorService _executor;
    private final Duration _interval;
    private final LoadingCache<Message, Message> _messages;

    @Inject
    public DefaultRateLimitedLogFactory(LifeCycleRegistry lifeCycle) {
        this(defaultExecutor(lifeCycle), Duration.seconds(30));
    }

    @VisibleForTesting
    DefaultRateLimitedLogFactory(ScheduledExecutorService executor, Duration interval) {
        _executor = requireNonNull(executor, "executor");
        _interval = requireNonNull(interval, "interval");

        _messages = CacheBuilder.newBuilder()
                .expireAfterAccess(interval.getQuantity() * 3, interval.getUnit())
                .build(CacheLoader.from(Functions.<Message>identity()));
        _executor.scheduleWithFixedDelay(_messages::cleanUp, 1, 1, TimeUnit.MINUTES);
    }

    private static ScheduledExecutorService defaultExecutor(LifeCycleRegistry lifeCycle) {
        String nameFormat = "RateLimitedLog-%d";
        ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(1, threadFactory);
        lifeCycle.manage(new ExecutorServiceManager(executor, Duration.seconds(5), nameFormat));
        return executor;
    }

    @Override
    public RateLimitedLog from(final Logger log) {
        requireNonNull(log, "log");
        return new RateLimitedLog() {
            @Override
            public void warn(Throwable t, String message, Object... args) {
                _messages.getUnchecked(new Message(log, Level.WARN, message)).log(t, args);
            }

            @Override
            public void error(Throwable t, String message, Object... args) {
                _messages.getUnchecked(new Message(log, Level.ERROR, message)).log(t, args);
            }
        };
    }

    private class Message implements Runnable {
        private final Logger _log;
        private final Level _level;
        private final String _message;
        private long _count;
        private Throwable _lastThrowable;
        private Object[] _lastArgs;
        private boolean _scheduled;

        private Message(Logger log, Level level, String message) {
            _log = log;
            _level = level;
            _message = message;
        }

        synchronized void log(Throwable t, Object... args) {
            if (_scheduled) {
                _count++;
                _lastThrowable = t;
                _lastArgs = args;
                return;
            }
            checkState(_count == 0);
            emit(MessageFormatter.arrayFormat(_message, args).getMessage(), t);
            _executor.schedule(this, _interval.getQuantity(), _interval.getUnit());
            _scheduled = true;
        }

        private synchronized void report() {
            if (_count == 0) {
                // Quiet for a full interval
                _scheduled = false;
                return;
            }
            String message = MessageFormatter.arrayFormat(_message, _lastArgs).getMessage();
            emit(String.format("Repeated %d %s within the last %s: %s",
                    _count, _count == 1 ? "time" : "times", _interval, message), _lastThrowable);

            _count = 0;
            _lastThrowable = null;
            _lastArgs = null;
            _executor.schedule(this, _interval.getQuantity(), _interval.getUnit());
        }

        private void emit(String text, Throwable t) {
            if (_level == Level.WARN) {
                _log.warn(text, t);
            } else {
                _log.error(text, t);
            }
        }

        @Override
        public void run() {
            report();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Message)) {
                return false;
            }
            Message message = (Message) o;
            return _log.equals(message._log) && _level == message._level && Objects.equal(_message, message._message);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(_log, _level, _message);
        }
    }
}

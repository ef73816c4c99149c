package com.zegelin.jsonwriter.pool;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.LoggerFactory;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

public class TestThreadLocalCharArrayPool {
    @Mock
    private Appender<ILoggingEvent> loggingEventAppender;

    private AutoCloseable mocks;
    private Level originalLevel;

    @BeforeMethod
    public void beforeMethod() {
        mocks = MockitoAnnotations.openMocks(this);

        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(ThreadLocalCharArrayPool.class);

        originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        logger.addAppender(loggingEventAppender);
    }

    @AfterMethod
    public void afterMethod() throws Exception {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(ThreadLocalCharArrayPool.class);

        logger.detachAppender(loggingEventAppender);
        logger.setLevel(originalLevel);

        mocks.close();
    }

    private List<String> debugMessages() {
        final ArgumentCaptor<ILoggingEvent> events = ArgumentCaptor.forClass(ILoggingEvent.class);
        verify(loggingEventAppender, atLeastOnce()).doAppend(events.capture());

        return events.getAllValues().stream()
                .filter(event -> event.getLevel() == Level.DEBUG)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    @Test
    public void testOversizedRentIsUnpooledAndLogged() {
        final ThreadLocalCharArrayPool pool = new ThreadLocalCharArrayPool(1);

        final char[] array = pool.rent((1 << 20) + 1);
        assertThat(array).hasSize((1 << 20) + 1);

        pool.giveBack(array);
        assertThat(pool.retainedArrayCount()).isZero();

        assertThat(debugMessages()).anySatisfy(message -> assertThat(message).contains("exceeds the largest size class"));
    }

    @Test
    public void testReturnToFullBucketIsDroppedAndLogged() {
        final ThreadLocalCharArrayPool pool = new ThreadLocalCharArrayPool(1);

        pool.giveBack(new char[64]);
        pool.giveBack(new char[64]);

        assertThat(pool.retainedArrayCount()).isEqualTo(1);
        assertThat(debugMessages()).anySatisfy(message -> assertThat(message).contains("its size class is full"));
    }

    @Test
    public void testReuseOnSameThread() {
        final ThreadLocalCharArrayPool pool = new ThreadLocalCharArrayPool(1);

        final char[] array = pool.rent(20);
        assertThat(array).hasSize(32);

        pool.giveBack(array);
        pool.giveBack(new char[32]);

        assertThat(pool.retainedArrayCount()).isEqualTo(1);
        assertThat(pool.rent(32)).isSameAs(array);
    }

    @Test
    public void testThreadsDoNotShare() throws InterruptedException {
        final ThreadLocalCharArrayPool pool = new ThreadLocalCharArrayPool(4);

        final char[] array = pool.rent(64);
        pool.giveBack(array);

        final AtomicReference<char[]> rentedElsewhere = new AtomicReference<>();
        final Thread thread = new Thread(() -> rentedElsewhere.set(pool.rent(64)));
        thread.start();
        thread.join();

        assertThat(rentedElsewhere.get()).isNotSameAs(array);
        assertThat(pool.retainedArrayCount()).isEqualTo(1);
    }
}
